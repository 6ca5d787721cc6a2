package vn.legaldoc.structure.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import vn.legaldoc.structure.html.SourceLine;

/**
 * Re-joins header lines that the source markup split apart, such as {@code "Điều"} /
 * {@code "5. Phạm vi"} or {@code "Chương I"} / {@code "QUY ĐỊNH CHUNG"}.
 */
final class BrokenHeaderRepairer {

    private static final Locale VIETNAMESE = Locale.forLanguageTag("vi");

    private final PatternTable patterns;

    BrokenHeaderRepairer(PatternTable patterns) {
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    List<SourceLine> repair(List<SourceLine> lines) {
        List<SourceLine> repaired = new ArrayList<>(lines.size());
        int index = 0;
        while (index < lines.size()) {
            SourceLine current = lines.get(index++);
            if (index < lines.size() && isBareKeyword(current)
                    && patterns.leadingNumeral().matcher(lines.get(index).text()).lookingAt()) {
                current = current.join(lines.get(index++));
            }
            if (patterns.bareArticle().matcher(current.text()).matches()) {
                if (index < lines.size() && isArticleTitle(lines.get(index))) {
                    current = current.join(lines.get(index++));
                }
            } else if (patterns.bareChapter().matcher(current.text()).matches()) {
                while (index < lines.size() && isChapterTitle(lines.get(index))) {
                    current = current.join(lines.get(index++));
                }
            }
            repaired.add(current);
        }
        return repaired;
    }

    private boolean isBareKeyword(SourceLine line) {
        return patterns.bareKeyword().matcher(line.text()).matches();
    }

    private boolean isArticleTitle(SourceLine next) {
        String text = next.text();
        return !text.isEmpty()
                && Character.isLetter(text.codePointAt(0))
                && !patterns.point().matcher(text).matches()
                && !isSeparateLine(next);
    }

    private boolean isChapterTitle(SourceLine next) {
        return (next.bold() || isUpperCase(next.text())) && !isSeparateLine(next);
    }

    /**
     * Lines that carry their own meaning and must never be folded into a preceding header.
     */
    private boolean isSeparateLine(SourceLine line) {
        if (line.anchorId().isPresent()) {
            return true;
        }
        String text = line.text();
        return patterns.looseNumbering().matcher(text).matches()
                || patterns.article().matcher(text).matches()
                || patterns.chapter().matcher(text).matches()
                || patterns.part().matcher(text).matches()
                || patterns.section().matcher(text).matches()
                || patterns.romanHeading().matcher(text).matches()
                || patterns.recipients().matcher(text).find()
                || patterns.signature().matcher(text).find()
                || patterns.appendix().matcher(text).find();
    }

    private static boolean isUpperCase(String text) {
        return text.codePoints().anyMatch(Character::isLetter) && text.equals(text.toUpperCase(VIETNAMESE));
    }
}
