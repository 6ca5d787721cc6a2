package vn.legaldoc.structure.model;

import java.util.Locale;

/**
 * Closed set of structural node kinds, each pinned to a hierarchy level.
 */
public enum NodeType {
    DOCUMENT(0),
    PART(1),
    CHAPTER(2),
    SECTION(3),
    ARTICLE(4),
    ITEM(4),
    CLAUSE(5),
    SUBITEM(5),
    POINT(6);

    private final int level;

    NodeType(int level) {
        this.level = level;
    }

    public int level() {
        return level;
    }

    /**
     * Name used in the serialized tree, e.g. {@code "article"}.
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static NodeType fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Node type must be provided");
        }
        for (NodeType type : values()) {
            if (type.wireName().equals(raw.trim().toLowerCase(Locale.ROOT))) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unsupported node type: " + raw);
    }
}
