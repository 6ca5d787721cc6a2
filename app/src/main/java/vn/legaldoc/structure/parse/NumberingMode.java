package vn.legaldoc.structure.parse;

/**
 * Interpretation of loose Arabic numbering ({@code "1."}, {@code "2.1"}) relative to the open node.
 */
public enum NumberingMode {
    /** Clauses under articles; siblings of open clauses and points. */
    CLAUSE,
    /** Top-level items, dotted numbers as subitems beneath them. */
    ITEM,
    /** Items under Roman-numeral sections or at the top level. */
    PLAN_ITEM
}
