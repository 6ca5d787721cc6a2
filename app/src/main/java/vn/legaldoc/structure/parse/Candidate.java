package vn.legaldoc.structure.parse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import vn.legaldoc.structure.model.NodeType;

/**
 * Node proposed by the classifier for one line, before it is placed in the tree.
 */
public record Candidate(NodeType type, String title, List<String> content, Optional<String> anchorId) {

    public Candidate {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(title, "title");
        content = content == null ? List.of() : List.copyOf(content);
        anchorId = anchorId == null ? Optional.empty() : anchorId;
    }

    public static Candidate header(NodeType type, String title, Optional<String> anchorId) {
        return new Candidate(type, title, List.of(), anchorId);
    }

    /**
     * Numbered node whose marker becomes the title and whose remaining text is its first content line.
     */
    public static Candidate numbered(NodeType type, String marker, String remainder, Optional<String> anchorId) {
        List<String> content = remainder == null || remainder.isBlank() ? List.of() : List.of(remainder.strip());
        return new Candidate(type, marker, content, anchorId);
    }

    public int level() {
        return type.level();
    }
}
