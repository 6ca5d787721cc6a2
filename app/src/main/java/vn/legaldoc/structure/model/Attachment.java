package vn.legaldoc.structure.model;

/**
 * Appendix or sample form captured after its header line.
 */
public record Attachment(String title, String content) {

    public Attachment {
        if (title == null || title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        content = content == null ? "" : content;
    }
}
