package vn.legaldoc.structure.batch;

import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import vn.legaldoc.structure.config.Config;
import vn.legaldoc.structure.html.JsoupLineExtractor;
import vn.legaldoc.structure.html.LineExtractor;
import vn.legaldoc.structure.model.DocumentResult;
import vn.legaldoc.structure.output.DocumentJsonWriter;
import vn.legaldoc.structure.output.StructureStatistics;
import vn.legaldoc.structure.parse.DialectProfile;
import vn.legaldoc.structure.parse.DialectResolver;
import vn.legaldoc.structure.parse.LegalDocumentParser;

/**
 * Parses HTML files from disk on a fixed worker pool and writes one JSON file per document.
 * A failing file is logged and reported; the other files are still processed.
 */
public class BatchParseService {

    private static final Logger logger = LoggerFactory.getLogger(BatchParseService.class);
    static final String MDC_DOCUMENT = "document";

    private final LineExtractor extractor;

    public BatchParseService() {
        this(new JsoupLineExtractor());
    }

    public BatchParseService(LineExtractor extractor) {
        this.extractor = Objects.requireNonNull(extractor, "extractor");
    }

    public BatchParseResult run(Config config) {
        Objects.requireNonNull(config, "config");
        List<BatchParseResult.Failure> failures = new ArrayList<>();
        List<Path> files = collectFiles(config, failures);
        logger.info("Parsing {} document(s) with {} thread(s) into {}", files.size(), config.threads(),
                config.outputDirectory());

        DocumentJsonWriter writer = new DocumentJsonWriter(config.prettyPrint());
        OutputFileNamer namer = new OutputFileNamer(config.outputDirectory());
        List<Future<BatchParseResult.ParsedDocument>> futures = new ArrayList<>(files.size());
        ExecutorService pool = Executors.newFixedThreadPool(config.threads());
        try {
            for (Path file : files) {
                Path target = namer.reserve(stem(file));
                futures.add(pool.submit(() -> parseFile(file, target, config, writer)));
            }
            List<BatchParseResult.ParsedDocument> documents = new ArrayList<>(files.size());
            for (int i = 0; i < futures.size(); i++) {
                try {
                    documents.add(futures.get(i).get());
                } catch (ExecutionException ex) {
                    Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
                    logger.warn("Failed to parse {}: {}", files.get(i), cause.getMessage(), cause);
                    failures.add(new BatchParseResult.Failure(files.get(i), cause.getMessage()));
                }
            }
            BatchParseResult result = new BatchParseResult(documents, failures);
            logger.info("Parsed {} document(s), {} failure(s)", documents.size(), failures.size());
            return result;
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            throw new ParseJobException("Interrupted while waiting for parse jobs", ex);
        } finally {
            pool.shutdownNow();
        }
    }

    BatchParseResult.ParsedDocument parseFile(Path file, Path target, Config config, DocumentJsonWriter writer) {
        MDC.put(MDC_DOCUMENT, file.getFileName().toString());
        try {
            String html = read(file);
            String title = config.title()
                    .or(() -> extractor.extractTitle(html))
                    .orElse(stem(file));
            String documentType = config.documentType().orElse(null);
            DialectProfile profile = config.dialect()
                    .map(dialect -> DialectResolver.forDialect(dialect, documentType, title))
                    .orElseGet(() -> DialectResolver.resolve(documentType, title));

            DocumentResult result = new LegalDocumentParser(extractor, profile).parse(html, title);
            ObjectNode output = writer.toTree(result);
            ObjectNode envelope = output.objectNode();
            ObjectNode info = envelope.putObject("document_info");
            info.put("title", title);
            info.put("loai_van_ban", DialectResolver.effectiveType(documentType, title).orElse(""));
            info.put("dialect", profile.dialect().name());
            info.put("source", file.toString());
            envelope.set("parsed_result", output);
            writer.write(envelope, target);

            StructureStatistics statistics = StructureStatistics.of(result.root());
            logger.debug("Wrote {} ({})", target, statistics);
            return new BatchParseResult.ParsedDocument(file, target, title, profile.dialect(), statistics);
        } catch (UncheckedIOException ex) {
            throw new ParseJobException("Failed to write output for " + file, ex);
        } finally {
            MDC.remove(MDC_DOCUMENT);
        }
    }

    private List<Path> collectFiles(Config config, List<BatchParseResult.Failure> failures) {
        List<Path> files = new ArrayList<>();
        for (Path input : config.inputs()) {
            if (Files.isDirectory(input)) {
                try (Stream<Path> walk = Files.walk(input)) {
                    files.addAll(walk.filter(Files::isRegularFile)
                            .filter(config::accepts)
                            .sorted()
                            .collect(Collectors.toList()));
                } catch (IOException ex) {
                    logger.warn("Failed to list {}: {}", input, ex.getMessage());
                    failures.add(new BatchParseResult.Failure(input, ex.getMessage()));
                }
            } else if (Files.isRegularFile(input)) {
                files.add(input);
            } else {
                logger.warn("Input does not exist: {}", input);
                failures.add(new BatchParseResult.Failure(input, "input does not exist"));
            }
        }
        return files;
    }

    private static String read(Path file) {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (IOException ex) {
            throw new ParseJobException("Failed to read " + file, ex);
        }
    }

    private static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
