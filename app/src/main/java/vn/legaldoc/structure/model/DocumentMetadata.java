package vn.legaldoc.structure.model;

import java.util.List;

/**
 * Footer data routed away from the tree: the distribution list and the signature block.
 */
public record DocumentMetadata(List<String> recipients, List<String> signers) {

    public DocumentMetadata {
        recipients = recipients == null ? List.of() : List.copyOf(recipients);
        signers = signers == null ? List.of() : List.copyOf(signers);
    }

    public static DocumentMetadata empty() {
        return new DocumentMetadata(List.of(), List.of());
    }

    public boolean isEmpty() {
        return recipients.isEmpty() && signers.isEmpty();
    }
}
