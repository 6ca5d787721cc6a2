package vn.legaldoc.structure.parse;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import vn.legaldoc.structure.html.SourceLine;
import vn.legaldoc.structure.model.NodeType;

/**
 * Proposes a structural node for a body line, or nothing when the line is plain content.
 *
 * <p>Signals are tried in a fixed order: anchor names, then bold-qualified part, chapter and
 * section headers, article headers, loose Arabic numbering and finally point markers.
 */
public class LineClassifier {

    static final int SHORT_LINE = 100;

    private final DialectProfile profile;
    private final PatternTable patterns;

    public LineClassifier(DialectProfile profile) {
        this(profile, PatternTable.get());
    }

    LineClassifier(DialectProfile profile, PatternTable patterns) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    public Optional<Candidate> classify(SourceLine line, OpenContext context) {
        Optional<Candidate> anchored = classifyAnchor(line);
        if (anchored.isPresent()) {
            return anchored;
        }
        Optional<Candidate> header = classifyHeader(line);
        if (header.isPresent()) {
            return header;
        }
        Optional<Candidate> numbered = classifyNumbering(line, context);
        if (numbered.isPresent()) {
            return numbered;
        }
        return classifyPoint(line);
    }

    /**
     * True when the line carries an enabled anchor signal or an accepted part, chapter, section
     * or article header. Loose numbering and point markers do not count.
     */
    public boolean isStructuralHeader(SourceLine line) {
        return classifyAnchor(line).isPresent() || classifyHeader(line).isPresent();
    }

    Optional<Candidate> classifyAnchor(SourceLine line) {
        return AnchorSignal.typeOf(line.anchorId())
                .filter(profile::enables)
                .map(type -> Candidate.header(type, line.text(), line.anchorId()));
    }

    Optional<Candidate> classifyHeader(SourceLine line) {
        String text = line.text();
        boolean articleHeader = patterns.article().matcher(text).matches();
        boolean reference = profile.referenceGuard() && ReferenceLineGuard.isReferenceLine(text);

        if (!articleHeader && !reference) {
            if (profile.enables(NodeType.PART) && line.bold() && patterns.part().matcher(text).matches()) {
                return Optional.of(Candidate.header(NodeType.PART, text, line.anchorId()));
            }
            if (profile.enables(NodeType.CHAPTER) && isChapter(line)) {
                return Optional.of(Candidate.header(NodeType.CHAPTER, text, line.anchorId()));
            }
            if (profile.enables(NodeType.SECTION)) {
                Optional<Candidate> section = classifySection(line);
                if (section.isPresent()) {
                    return section;
                }
            }
        }
        if (articleHeader && profile.enables(NodeType.ARTICLE) && acceptsArticle(line, reference)) {
            return Optional.of(Candidate.header(NodeType.ARTICLE, text, line.anchorId()));
        }
        return Optional.empty();
    }

    private boolean isChapter(SourceLine line) {
        String text = line.text();
        if (line.bold() && patterns.chapter().matcher(text).matches()) {
            return true;
        }
        return profile.romanChapters()
                && (line.bold() || text.length() < SHORT_LINE)
                && patterns.romanHeading().matcher(text).matches();
    }

    private Optional<Candidate> classifySection(SourceLine line) {
        if (!line.bold()) {
            return Optional.empty();
        }
        String text = line.text();
        if (profile.romanSections()) {
            Matcher roman = patterns.romanHeading().matcher(text);
            if (roman.matches()) {
                String title = (roman.group(1) + ". " + roman.group(2)).strip();
                return Optional.of(Candidate.header(NodeType.SECTION, title, line.anchorId()));
            }
        }
        if (patterns.section().matcher(text).matches()) {
            return Optional.of(Candidate.header(NodeType.SECTION, text, line.anchorId()));
        }
        return Optional.empty();
    }

    private boolean acceptsArticle(SourceLine line, boolean reference) {
        return switch (profile.articleRule()) {
            case RELAXED -> true;
            case STRICT -> line.bold()
                    || (profile.looseArticles() && !reference && patterns.looseArticle().matcher(line.text()).find());
        };
    }

    Optional<Candidate> classifyNumbering(SourceLine line, OpenContext context) {
        Matcher matcher = patterns.looseNumbering().matcher(line.text());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String number = matcher.group(1);
        boolean dotted = number.indexOf('.') >= 0;
        if (!dotted && matcher.group(2).isEmpty()) {
            return Optional.empty();
        }
        String remainder = matcher.group(3);
        NodeType type = numberedType(dotted, context);
        if (type == null || !profile.enables(type)) {
            return Optional.empty();
        }
        return Optional.of(Candidate.numbered(type, number, remainder, line.anchorId()));
    }

    private NodeType numberedType(boolean dotted, OpenContext context) {
        return switch (profile.numbering()) {
            case CLAUSE -> switch (context.top()) {
                case ARTICLE, CLAUSE, POINT -> NodeType.CLAUSE;
                default -> null;
            };
            case ITEM -> switch (context.nearestNonPoint()) {
                case DOCUMENT -> NodeType.ITEM;
                case ITEM, SUBITEM -> dotted ? NodeType.SUBITEM : NodeType.ITEM;
                default -> null;
            };
            case PLAN_ITEM -> switch (context.nearestNonPoint()) {
                case DOCUMENT, SECTION, ITEM -> NodeType.ITEM;
                default -> null;
            };
        };
    }

    Optional<Candidate> classifyPoint(SourceLine line) {
        if (!profile.enables(NodeType.POINT)) {
            return Optional.empty();
        }
        Matcher matcher = patterns.point().matcher(line.text());
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String marker = matcher.group(1) + matcher.group(2);
        return Optional.of(Candidate.numbered(NodeType.POINT, marker, matcher.group(3), line.anchorId()));
    }
}
