package vn.legaldoc.structure.parse;

/**
 * Legal-document genres that share a structural layout.
 */
public enum Dialect {
    HIERARCHICAL,
    DECISION,
    DIRECTIVE,
    PLAN;

    public static Dialect from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Dialect must be provided");
        }
        for (Dialect dialect : values()) {
            if (dialect.name().equalsIgnoreCase(raw.trim())) {
                return dialect;
            }
        }
        throw new IllegalArgumentException("Unsupported dialect: " + raw);
    }
}
