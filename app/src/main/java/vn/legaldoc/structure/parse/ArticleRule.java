package vn.legaldoc.structure.parse;

/**
 * How much evidence an unanchored {@code "Điều <n>"} line needs to open an article.
 */
public enum ArticleRule {
    /** Bold required, except punctuated headers in loose documents. */
    STRICT,
    /** Any line that reads as an article header. */
    RELAXED
}
