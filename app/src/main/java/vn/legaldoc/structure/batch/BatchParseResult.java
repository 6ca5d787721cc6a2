package vn.legaldoc.structure.batch;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import vn.legaldoc.structure.model.NodeType;
import vn.legaldoc.structure.output.StructureStatistics;
import vn.legaldoc.structure.parse.Dialect;

/**
 * Outcome of one batch run: the written documents and the files that failed.
 */
public record BatchParseResult(List<ParsedDocument> documents, List<Failure> failures) {

    public BatchParseResult {
        documents = documents == null ? List.of() : List.copyOf(documents);
        failures = failures == null ? List.of() : List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public Map<NodeType, Integer> totalCounts() {
        return documents.stream()
                .map(document -> document.statistics().counts())
                .reduce(Map.of(), StructureStatistics::sum);
    }

    public record ParsedDocument(Path source, Path output, String title, Dialect dialect,
                                 StructureStatistics statistics) {

        public ParsedDocument {
            Objects.requireNonNull(source, "source");
            Objects.requireNonNull(output, "output");
            Objects.requireNonNull(dialect, "dialect");
            Objects.requireNonNull(statistics, "statistics");
        }
    }

    public record Failure(Path source, String reason) {

        public Failure {
            Objects.requireNonNull(source, "source");
            reason = reason == null ? "unknown error" : reason;
        }
    }
}
