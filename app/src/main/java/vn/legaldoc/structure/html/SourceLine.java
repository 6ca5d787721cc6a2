package vn.legaldoc.structure.html;

import java.util.Objects;
import java.util.Optional;

/**
 * One visible line of the source document with the weak signals attached to it.
 */
public record SourceLine(String text, boolean bold, Optional<String> anchorId) {

    public SourceLine {
        Objects.requireNonNull(text, "text");
        anchorId = anchorId == null ? Optional.empty() : anchorId.filter(value -> !value.isBlank());
    }

    public static SourceLine plain(String text) {
        return new SourceLine(text, false, Optional.empty());
    }

    public static SourceLine bold(String text) {
        return new SourceLine(text, true, Optional.empty());
    }

    public static SourceLine anchored(String text, boolean bold, String anchorId) {
        return new SourceLine(text, bold, Optional.ofNullable(anchorId));
    }

    public int length() {
        return text.length();
    }

    /**
     * Joins {@code next} onto this line, keeping the first anchor and either line's boldness.
     */
    public SourceLine join(SourceLine next) {
        return new SourceLine(text + " " + next.text(), bold || next.bold(), anchorId.or(next::anchorId));
    }

    public SourceLine withText(String replacement) {
        return new SourceLine(replacement, bold, anchorId);
    }
}
