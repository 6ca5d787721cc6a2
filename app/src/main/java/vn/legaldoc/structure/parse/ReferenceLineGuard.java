package vn.legaldoc.structure.parse;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Rejects header candidates that are really citations of other headers, e.g.
 * {@code "Chương II quy định tại Điều 5"} or a long sentence ending in {@code "Thông tư này"}.
 *
 * <p>The thresholds were tuned on the crawled corpus and have no labelled validation set; keep
 * them as they are.
 */
public final class ReferenceLineGuard {

    static final int MAX_HEADER_LENGTH = 300;

    private static final List<String> CITATION_PHRASES = List.of(
            "quy định tại", "căn cứ", "tại chương", "của chương", "tại điều", "của điều");
    private static final Pattern SELF_REFERENCE_ENDING = Pattern.compile(
            "(văn bản|thông tư|nghị định|luật|quyết định|pháp lệnh|nghị quyết) này[.;:]?$");
    private static final Pattern HEADER_LIST = Pattern.compile("(chương|điều)\\s+\\d+[,;]\\s*(chương|điều)");

    private ReferenceLineGuard() {
    }

    public static boolean isReferenceLine(String text) {
        if (text == null) {
            return false;
        }
        if (text.length() > MAX_HEADER_LENGTH) {
            return true;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        if (SELF_REFERENCE_ENDING.matcher(lower).find()) {
            return true;
        }
        if (HEADER_LIST.matcher(lower).find()) {
            return true;
        }
        for (String phrase : CITATION_PHRASES) {
            if (lower.contains(phrase)) {
                return true;
            }
        }
        return false;
    }
}
