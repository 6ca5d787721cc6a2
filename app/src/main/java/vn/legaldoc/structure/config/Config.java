package vn.legaldoc.structure.config;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import vn.legaldoc.structure.parse.Dialect;

/**
 * Immutable run configuration assembled from CLI arguments and environment values.
 *
 * @param documentType declared genre ({@code loai_van_ban}) used to pick the dialect
 * @param dialect      dialect forced for every input, overriding the declared type
 * @param title        title for every input; otherwise taken from each document
 */
public record Config(
        List<Path> inputs,
        Path outputDirectory,
        Optional<String> documentType,
        Optional<Dialect> dialect,
        Optional<String> title,
        int threads,
        boolean prettyPrint,
        LogFormat logFormat,
        boolean verbose,
        Set<String> fileExtensions
) {

    public static final Set<String> DEFAULT_FILE_EXTENSIONS = Set.of("html", "htm");

    public Config {
        if (inputs == null || inputs.isEmpty()) {
            throw new IllegalArgumentException("At least one input file or directory must be provided");
        }
        inputs = List.copyOf(inputs);
        Objects.requireNonNull(outputDirectory, "outputDirectory");
        documentType = documentType == null ? Optional.empty() : documentType.filter(value -> !value.isBlank());
        dialect = dialect == null ? Optional.empty() : dialect;
        title = title == null ? Optional.empty() : title.filter(value -> !value.isBlank());
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be at least 1");
        }
        logFormat = Objects.requireNonNull(logFormat, "logFormat");
        fileExtensions = fileExtensions == null || fileExtensions.isEmpty()
                ? DEFAULT_FILE_EXTENSIONS
                : fileExtensions.stream()
                .map(Config::normalizeExtension)
                .filter(value -> !value.isBlank())
                .collect(Collectors.toUnmodifiableSet());
    }

    public boolean accepts(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 && fileExtensions.contains(name.substring(dot + 1).toLowerCase(Locale.ROOT));
    }

    private static String normalizeExtension(String raw) {
        String normalized = raw.trim();
        if (normalized.startsWith(".")) {
            normalized = normalized.substring(1);
        }
        return normalized.toLowerCase(Locale.ROOT);
    }
}
