package vn.legaldoc.structure.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.regex.Matcher;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.legaldoc.structure.html.SourceLine;
import vn.legaldoc.structure.model.Attachment;
import vn.legaldoc.structure.model.DocumentMetadata;

/**
 * Routes each line either to the structure tree or to one of the side channels (recipients,
 * signers, attachments). Phase changes are driven by the line stream and may happen any number
 * of times in one document.
 */
final class PhaseController {

    private static final Logger logger = LoggerFactory.getLogger(PhaseController.class);

    enum Phase {
        BODY,
        METADATA,
        APPENDIX
    }

    private enum FooterMode {
        RECIPIENTS,
        SIGNERS
    }

    /**
     * What the parser has to do with a line after routing.
     *
     * @param kind what to do
     * @param text line for {@link Kind#CLASSIFY}, content prefix for {@link Kind#APPEND_CONTENT}
     */
    record Decision(Kind kind, String text) {

        enum Kind {
            CLASSIFY,
            APPEND_CONTENT,
            CONSUMED
        }

        static final Decision CONSUMED = new Decision(Kind.CONSUMED, "");

        static Decision classify(String text) {
            return new Decision(Kind.CLASSIFY, text);
        }

        static Decision appendContent(String text) {
            return new Decision(Kind.APPEND_CONTENT, text);
        }
    }

    private final DialectProfile profile;
    private final LineClassifier classifier;
    private final PatternTable patterns;

    private final List<String> recipients = new ArrayList<>();
    private final List<String> signers = new ArrayList<>();
    private final List<AttachmentDraft> attachments = new ArrayList<>();
    private Phase phase = Phase.BODY;
    private FooterMode footerMode = FooterMode.SIGNERS;
    private int discardedLines;

    PhaseController(DialectProfile profile, LineClassifier classifier, PatternTable patterns) {
        this.profile = Objects.requireNonNull(profile, "profile");
        this.classifier = Objects.requireNonNull(classifier, "classifier");
        this.patterns = Objects.requireNonNull(patterns, "patterns");
    }

    Decision route(SourceLine line) {
        switch (phase) {
            case METADATA -> {
                if (!endsFooter(line)) {
                    routeFooterLine(line);
                    return Decision.CONSUMED;
                }
                phase = Phase.BODY;
            }
            case APPENDIX -> {
                return routeAppendixLine(line);
            }
            case BODY -> {
                // routed below
            }
        }
        return routeBodyLine(line);
    }

    Phase phase() {
        return phase;
    }

    int discardedLines() {
        return discardedLines;
    }

    DocumentMetadata metadata() {
        return new DocumentMetadata(recipients, signers);
    }

    List<Attachment> attachments() {
        List<Attachment> result = new ArrayList<>(attachments.size());
        for (AttachmentDraft draft : attachments) {
            result.add(draft.toAttachment());
        }
        return result;
    }

    private Decision routeBodyLine(SourceLine line) {
        String text = line.text();
        if (isRecipientsMarker(text)) {
            enterFooter(FooterMode.RECIPIENTS);
            recipients.add(text);
            return Decision.CONSUMED;
        }
        if (line.bold()) {
            Matcher inline = patterns.inlineRecipients().matcher(text);
            if (inline.find()) {
                enterFooter(FooterMode.RECIPIENTS);
                recipients.add(inline.group(1).strip());
                String prefix = text.substring(0, inline.start()).replaceAll("[./;\\s]+$", "").strip();
                return prefix.isEmpty() ? Decision.CONSUMED : Decision.appendContent(prefix);
            }
        }
        if (isSignatureMarker(text) && (line.bold() || text.length() < LineClassifier.SHORT_LINE)) {
            enterFooter(FooterMode.SIGNERS);
            signers.add(text);
            return Decision.CONSUMED;
        }
        if (opensAttachment(line)) {
            phase = Phase.APPENDIX;
            attachments.add(new AttachmentDraft(text));
            return Decision.CONSUMED;
        }
        return Decision.classify(text);
    }

    private Decision routeAppendixLine(SourceLine line) {
        String text = line.text();
        if (isRecipientsMarker(text) || isSignatureMarker(text)) {
            phase = Phase.METADATA;
            routeFooterLine(line);
            return Decision.CONSUMED;
        }
        if (opensAttachment(line)) {
            attachments.add(new AttachmentDraft(text));
        } else {
            attachments.get(attachments.size() - 1).lines.add(text);
        }
        return Decision.CONSUMED;
    }

    private void routeFooterLine(SourceLine line) {
        String text = line.text();
        if (isRecipientsMarker(text)) {
            footerMode = FooterMode.RECIPIENTS;
            recipients.add(text);
            return;
        }
        if (isSignatureMarker(text)) {
            footerMode = FooterMode.SIGNERS;
            signers.add(text);
            return;
        }
        boolean shortLine = text.length() < profile.signerLineLimit();
        if (isDashLine(text)) {
            if (footerMode == FooterMode.RECIPIENTS || !shortLine) {
                recipients.add(text);
            } else {
                signers.add(text);
            }
            return;
        }
        if (shortLine && Character.isUpperCase(text.codePointAt(0))) {
            signers.add(text);
            return;
        }
        if (footerMode == FooterMode.RECIPIENTS) {
            recipients.add(text);
            return;
        }
        discardedLines++;
        logger.debug("Discarded footer line: {}", text);
    }

    /**
     * Anchors, accepted headers and appendix headers return the document to its body.
     */
    private boolean endsFooter(SourceLine line) {
        return classifier.isStructuralHeader(line) || opensAttachment(line);
    }

    private boolean opensAttachment(SourceLine line) {
        String text = line.text();
        return profile.appendixPhase()
                && (line.bold() || text.length() < LineClassifier.SHORT_LINE)
                && patterns.appendix().matcher(text).find()
                && !ReferenceLineGuard.isReferenceLine(text);
    }

    private void enterFooter(FooterMode mode) {
        phase = Phase.METADATA;
        footerMode = mode;
    }

    private boolean isRecipientsMarker(String text) {
        return patterns.recipients().matcher(text).find();
    }

    private boolean isSignatureMarker(String text) {
        return patterns.signature().matcher(text).find();
    }

    private static boolean isDashLine(String text) {
        char first = text.charAt(0);
        return first == '-' || first == '–' || first == '—' || first == '+';
    }

    private static final class AttachmentDraft {
        private final String title;
        private final List<String> lines = new ArrayList<>();

        private AttachmentDraft(String title) {
            this.title = title;
        }

        private Attachment toAttachment() {
            return new Attachment(title, String.join("\n", lines));
        }
    }
}
