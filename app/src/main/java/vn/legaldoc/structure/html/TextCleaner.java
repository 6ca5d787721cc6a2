package vn.legaldoc.structure.html;

import java.text.Normalizer;
import java.util.regex.Pattern;

/**
 * Whitespace and Unicode normalization applied to every extracted line.
 */
public final class TextCleaner {

    private static final Pattern SPACE_LIKE = Pattern.compile("[\\u00a0\\u2007\\u202f\\u200b\\ufeff]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    private TextCleaner() {
    }

    /**
     * NFC-normalizes, maps non-breaking and zero-width spaces to ASCII spaces, drops carriage
     * returns and collapses whitespace runs to a single space.
     */
    public static String clean(String raw) {
        if (raw == null || raw.isEmpty()) {
            return "";
        }
        String composed = Normalizer.normalize(raw, Normalizer.Form.NFC);
        String spaced = SPACE_LIKE.matcher(composed.replace("\r", "")).replaceAll(" ");
        return WHITESPACE_RUN.matcher(spaced).replaceAll(" ").strip();
    }
}
