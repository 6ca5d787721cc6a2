package vn.legaldoc.structure.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import vn.legaldoc.structure.model.LegalNode;
import vn.legaldoc.structure.model.NodeType;

/**
 * Tree under construction. Nodes live in a flat list and refer to their children by index; the
 * open path is a stack of indices whose levels strictly increase from the root upwards.
 *
 * <p>{@link #push(int)} and {@link #pop()} are the only operations that change the open path.
 */
final class NodeArena {

    private static final int ROOT = 0;

    private final List<Slot> slots = new ArrayList<>();
    private final List<Integer> path = new ArrayList<>();
    private final boolean mergeDuplicates;
    private int mergedCount;

    NodeArena(String title, boolean mergeDuplicates) {
        this.mergeDuplicates = mergeDuplicates;
        slots.add(new Slot(NodeType.DOCUMENT, title, Optional.empty()));
        path.add(ROOT);
    }

    /**
     * Places a classified node: closes open nodes at the same or a deeper level, then either
     * appends the candidate to the new top or folds it into the top's last child when it is an
     * echo of that child.
     *
     * @return index of the node that is now open for the candidate's children
     */
    int attach(Candidate candidate) {
        while (path.size() > 1 && slot(top()).type.level() >= candidate.level()) {
            pop();
        }
        Slot parent = slot(top());
        if (mergeDuplicates && !parent.children.isEmpty()) {
            int lastIndex = parent.children.get(parent.children.size() - 1);
            Slot last = slot(lastIndex);
            if (DuplicateMerger.isDuplicate(last.type, last.title, candidate.type(), candidate.title())) {
                last.absorb(candidate);
                mergedCount++;
                push(lastIndex);
                return lastIndex;
            }
        }
        Slot created = new Slot(candidate.type(), candidate.title(), candidate.anchorId());
        created.content.addAll(candidate.content());
        slots.add(created);
        int index = slots.size() - 1;
        parent.children.add(index);
        push(index);
        return index;
    }

    void appendContent(String text) {
        if (text != null && !text.isBlank()) {
            slot(top()).content.add(text.strip());
        }
    }

    void push(int index) {
        Slot candidate = slot(index);
        if (!path.isEmpty() && slot(top()).type.level() >= candidate.type.level()) {
            throw new IllegalStateException("Open path must deepen: " + slot(top()).type + " -> " + candidate.type);
        }
        path.add(index);
    }

    int pop() {
        if (path.size() <= 1) {
            throw new IllegalStateException("The document root cannot be closed");
        }
        return path.remove(path.size() - 1);
    }

    int top() {
        return path.get(path.size() - 1);
    }

    OpenContext context() {
        NodeType top = slot(top()).type;
        NodeType nearestNonPoint = NodeType.DOCUMENT;
        for (int i = path.size() - 1; i >= 0; i--) {
            NodeType type = slot(path.get(i)).type;
            if (type != NodeType.POINT) {
                nearestNonPoint = type;
                break;
            }
        }
        return new OpenContext(top, nearestNonPoint);
    }

    List<NodeType> openTypes() {
        List<NodeType> types = new ArrayList<>(path.size());
        for (int index : path) {
            types.add(slot(index).type);
        }
        return types;
    }

    int nodeCount() {
        return slots.size();
    }

    int mergedCount() {
        return mergedCount;
    }

    /**
     * Copies the arena into an immutable tree rooted at the document node.
     */
    LegalNode freeze() {
        return freeze(ROOT);
    }

    private LegalNode freeze(int index) {
        Slot slot = slot(index);
        List<LegalNode> children = new ArrayList<>(slot.children.size());
        for (int child : slot.children) {
            children.add(freeze(child));
        }
        return new LegalNode(slot.type, slot.title, slot.content, children, slot.anchorId);
    }

    private Slot slot(int index) {
        return slots.get(index);
    }

    private static final class Slot {
        private final NodeType type;
        private String title;
        private final List<String> content = new ArrayList<>();
        private final List<Integer> children = new ArrayList<>();
        private Optional<String> anchorId;

        private Slot(NodeType type, String title, Optional<String> anchorId) {
            this.type = type;
            this.title = title;
            this.anchorId = anchorId;
        }

        private void absorb(Candidate echo) {
            if (echo.title().length() > title.length()) {
                title = echo.title();
            }
            content.addAll(echo.content());
            if (anchorId.isEmpty()) {
                anchorId = echo.anchorId();
            }
        }
    }
}
