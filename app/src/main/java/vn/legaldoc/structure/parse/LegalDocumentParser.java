package vn.legaldoc.structure.parse;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import vn.legaldoc.structure.html.JsoupLineExtractor;
import vn.legaldoc.structure.html.LineExtractor;
import vn.legaldoc.structure.html.SourceLine;
import vn.legaldoc.structure.model.DocumentResult;

/**
 * Entry point of the structure engine. Instances are stateless and may be shared between
 * threads; every call builds its own tree.
 */
public class LegalDocumentParser {

    private static final Logger logger = LoggerFactory.getLogger(LegalDocumentParser.class);

    static final String DEFAULT_TITLE = "Document";

    private final LineExtractor extractor;
    private final DialectProfile profile;
    private final PatternTable patterns;
    private final LineClassifier classifier;
    private final BrokenHeaderRepairer repairer;

    public LegalDocumentParser(DialectProfile profile) {
        this(new JsoupLineExtractor(), profile);
    }

    public LegalDocumentParser(LineExtractor extractor, DialectProfile profile) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
        this.profile = Objects.requireNonNull(profile, "profile");
        this.patterns = PatternTable.get();
        this.classifier = new LineClassifier(profile, patterns);
        this.repairer = new BrokenHeaderRepairer(patterns);
    }

    public static LegalDocumentParser forDocumentType(String documentType) {
        return forDocumentType(documentType, null);
    }

    public static LegalDocumentParser forDocumentType(String documentType, String title) {
        return new LegalDocumentParser(DialectResolver.resolve(documentType, title));
    }

    public DialectProfile profile() {
        return profile;
    }

    /**
     * Parses one HTML document. Empty or malformed HTML yields a document with an empty root.
     */
    public DocumentResult parse(String html, String title) {
        if (html == null || html.isBlank()) {
            return DocumentResult.empty(titleOrDefault(title));
        }
        return parseLines(extractor.extract(html), title);
    }

    public DocumentResult parseLines(List<SourceLine> lines, String title) {
        String rootTitle = titleOrDefault(title);
        List<SourceLine> nonBlank = lines.stream()
                .filter(line -> !line.text().isBlank())
                .collect(Collectors.toList());
        List<SourceLine> source = profile.repairBrokenHeaders() ? repairer.repair(nonBlank) : nonBlank;

        NodeArena arena = new NodeArena(rootTitle, profile.mergeDuplicates());
        PhaseController phases = new PhaseController(profile, classifier, patterns);
        for (SourceLine line : source) {
            PhaseController.Decision decision = phases.route(line);
            switch (decision.kind()) {
                case CLASSIFY -> {
                    Optional<Candidate> candidate = classifier.classify(line, arena.context());
                    if (candidate.isPresent()) {
                        arena.attach(candidate.get());
                    } else {
                        arena.appendContent(decision.text());
                    }
                }
                case APPEND_CONTENT -> arena.appendContent(decision.text());
                case CONSUMED -> {
                    // taken by a side channel
                }
            }
        }

        DocumentResult result = new DocumentResult(arena.freeze(), phases.metadata(), phases.attachments());
        if (logger.isDebugEnabled()) {
            logger.debug("Parsed '{}' as {}: {} nodes ({} merged), {} recipients, {} signers, {} attachments, {} discarded lines",
                    rootTitle, profile.dialect(), arena.nodeCount(), arena.mergedCount(),
                    result.metadata().recipients().size(), result.metadata().signers().size(),
                    result.attachments().size(), phases.discardedLines());
        }
        return result;
    }

    private static String titleOrDefault(String title) {
        return title == null || title.isBlank() ? DEFAULT_TITLE : title.strip();
    }
}
