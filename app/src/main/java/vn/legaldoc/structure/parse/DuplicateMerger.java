package vn.legaldoc.structure.parse;

import java.util.Locale;
import vn.legaldoc.structure.html.TextCleaner;
import vn.legaldoc.structure.model.NodeType;

/**
 * Decides whether a new header is an echo of its previous sibling. The source CMS sometimes
 * renders a header twice, once styled and once as plain text.
 */
public final class DuplicateMerger {

    private DuplicateMerger() {
    }

    public static boolean isDuplicate(NodeType existingType, String existingTitle,
                                      NodeType candidateType, String candidateTitle) {
        if (existingType != candidateType) {
            return false;
        }
        String first = normalize(existingTitle);
        String second = normalize(candidateTitle);
        if (first.equals(second)) {
            return true;
        }
        return isBoundedPrefix(first, second) || isBoundedPrefix(second, first);
    }

    /**
     * Lower-cased, whitespace-collapsed title without trailing periods.
     */
    static String normalize(String title) {
        String cleaned = TextCleaner.clean(title).toLowerCase(Locale.ROOT);
        int end = cleaned.length();
        while (end > 0 && cleaned.charAt(end - 1) == '.') {
            end--;
        }
        return cleaned.substring(0, end);
    }

    /**
     * {@code shorter} starts {@code longer} and is followed by a period, space or colon. A period
     * followed by a digit continues a number ({@code "1"} vs {@code "1.1"}) and is not a boundary.
     */
    private static boolean isBoundedPrefix(String shorter, String longer) {
        if (shorter.isEmpty() || longer.length() <= shorter.length() || !longer.startsWith(shorter)) {
            return false;
        }
        char delimiter = longer.charAt(shorter.length());
        if (delimiter == ' ' || delimiter == ':') {
            return true;
        }
        if (delimiter != '.') {
            return false;
        }
        int next = shorter.length() + 1;
        return next >= longer.length() || !Character.isDigit(longer.charAt(next));
    }
}
