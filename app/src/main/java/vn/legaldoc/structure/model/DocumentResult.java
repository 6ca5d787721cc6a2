package vn.legaldoc.structure.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of parsing one document: the structure tree plus its side channels.
 */
public record DocumentResult(LegalNode root, DocumentMetadata metadata, List<Attachment> attachments) {

    public DocumentResult {
        Objects.requireNonNull(root, "root");
        if (root.type() != NodeType.DOCUMENT) {
            throw new IllegalArgumentException("root must be a document node");
        }
        metadata = metadata == null ? DocumentMetadata.empty() : metadata;
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public static DocumentResult empty(String title) {
        return new DocumentResult(LegalNode.emptyDocument(title), DocumentMetadata.empty(), List.of());
    }
}
