package vn.legaldoc.structure.parse;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;
import vn.legaldoc.structure.model.NodeType;

/**
 * Parameterization of the parsing engine for one document genre.
 *
 * @param enabledTypes       node types the classifier may produce
 * @param articleRule        evidence needed for unanchored article headers
 * @param looseArticles      accept punctuated non-bold article headers under {@link ArticleRule#STRICT}
 * @param numbering          meaning of loose Arabic numbering
 * @param romanChapters      short {@code "I. ..."} lines open chapters
 * @param romanSections      bold {@code "I. ..."} lines open sections
 * @param mergeDuplicates    collapse echoed headers into the previous sibling
 * @param appendixPhase      route appendix headers and their text to attachments
 * @param referenceGuard     reject header candidates that cite other headers
 * @param repairBrokenHeaders join header lines split by the source markup
 * @param signerLineLimit    lines shorter than this are signer candidates in the footer
 */
public record DialectProfile(
        Dialect dialect,
        Set<NodeType> enabledTypes,
        ArticleRule articleRule,
        boolean looseArticles,
        NumberingMode numbering,
        boolean romanChapters,
        boolean romanSections,
        boolean mergeDuplicates,
        boolean appendixPhase,
        boolean referenceGuard,
        boolean repairBrokenHeaders,
        int signerLineLimit
) {

    public DialectProfile {
        Objects.requireNonNull(dialect, "dialect");
        Objects.requireNonNull(articleRule, "articleRule");
        Objects.requireNonNull(numbering, "numbering");
        if (enabledTypes == null || enabledTypes.isEmpty()) {
            throw new IllegalArgumentException("enabledTypes must not be empty");
        }
        if (enabledTypes.contains(NodeType.DOCUMENT)) {
            throw new IllegalArgumentException("document nodes are created by the parser, not classified");
        }
        enabledTypes = Set.copyOf(enabledTypes);
        if (signerLineLimit <= 0) {
            throw new IllegalArgumentException("signerLineLimit must be positive");
        }
    }

    public static DialectProfile hierarchical(boolean looseArticles) {
        return new DialectProfile(Dialect.HIERARCHICAL,
                EnumSet.of(NodeType.PART, NodeType.CHAPTER, NodeType.SECTION, NodeType.ARTICLE,
                        NodeType.CLAUSE, NodeType.POINT),
                ArticleRule.STRICT, looseArticles, NumberingMode.CLAUSE,
                true, false, true, true, true, true, 50);
    }

    public static DialectProfile decision() {
        return new DialectProfile(Dialect.DECISION,
                EnumSet.of(NodeType.ARTICLE, NodeType.CLAUSE, NodeType.POINT),
                ArticleRule.RELAXED, true, NumberingMode.CLAUSE,
                false, false, false, false, false, true, 60);
    }

    public static DialectProfile directive() {
        return new DialectProfile(Dialect.DIRECTIVE,
                EnumSet.of(NodeType.ITEM, NodeType.SUBITEM, NodeType.POINT),
                ArticleRule.RELAXED, false, NumberingMode.ITEM,
                false, false, false, false, false, false, 60);
    }

    public static DialectProfile plan() {
        return new DialectProfile(Dialect.PLAN,
                EnumSet.of(NodeType.SECTION, NodeType.ITEM, NodeType.POINT),
                ArticleRule.RELAXED, false, NumberingMode.PLAN_ITEM,
                false, true, false, false, false, false, 60);
    }

    public static DialectProfile of(Dialect dialect, boolean looseArticles) {
        return switch (dialect) {
            case HIERARCHICAL -> hierarchical(looseArticles);
            case DECISION -> decision();
            case DIRECTIVE -> directive();
            case PLAN -> plan();
        };
    }

    public boolean enables(NodeType type) {
        return enabledTypes.contains(type);
    }
}
