package vn.legaldoc.structure.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Stream;

/**
 * Immutable node of a parsed document tree.
 */
public record LegalNode(NodeType type, String title, List<String> content, List<LegalNode> children,
                        Optional<String> anchorId) {

    public LegalNode {
        Objects.requireNonNull(type, "type");
        title = title == null ? "" : title;
        content = content == null ? List.of() : List.copyOf(content);
        children = children == null ? List.of() : List.copyOf(children);
        anchorId = anchorId == null ? Optional.empty() : anchorId;
        for (LegalNode child : children) {
            if (child.level() <= type.level()) {
                throw new IllegalArgumentException("Child " + child.type() + " cannot nest under " + type);
            }
        }
    }

    public static LegalNode emptyDocument(String title) {
        return new LegalNode(NodeType.DOCUMENT, title, List.of(), List.of(), Optional.empty());
    }

    public int level() {
        return type.level();
    }

    /**
     * Content lines joined with newlines, trimmed; empty when the node has no own text.
     */
    public String joinedContent() {
        return String.join("\n", content).strip();
    }

    /**
     * Depth-first, pre-order stream over this node and all of its descendants.
     */
    public Stream<LegalNode> flatten() {
        return Stream.concat(Stream.of(this), children.stream().flatMap(LegalNode::flatten));
    }
}
