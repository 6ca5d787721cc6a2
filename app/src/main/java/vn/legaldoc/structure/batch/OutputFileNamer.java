package vn.legaldoc.structure.batch;

import java.nio.file.Files;
import java.nio.file.Path;
import java.text.Normalizer;
import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Hands out unique JSON file names inside the output directory.
 */
final class OutputFileNamer {

    static final int MAX_NAME_LENGTH = 80;
    private static final String EXTENSION = ".json";

    private final Path directory;
    private final Set<String> reserved = new HashSet<>();

    OutputFileNamer(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    /**
     * Reserves a file for {@code baseName}, appending {@code _1}, {@code _2}, ... when the name is
     * already taken in this run or on disk.
     */
    synchronized Path reserve(String baseName) {
        String stem = sanitize(baseName);
        String candidate = stem;
        int suffix = 1;
        while (reserved.contains(candidate) || Files.exists(directory.resolve(candidate + EXTENSION))) {
            candidate = stem + "_" + suffix++;
        }
        reserved.add(candidate);
        return directory.resolve(candidate + EXTENSION);
    }

    static String sanitize(String raw) {
        String normalized = raw == null ? "" : Normalizer.normalize(raw, Normalizer.Form.NFC);
        String cleaned = normalized
                .replaceAll("[^\\p{L}\\p{N}._-]+", "_")
                .replaceAll("_+", "_")
                .replaceAll("^[._]+|[._]+$", "");
        if (cleaned.length() > MAX_NAME_LENGTH) {
            cleaned = cleaned.substring(0, MAX_NAME_LENGTH).replaceAll("[._]+$", "");
        }
        return cleaned.isEmpty() ? "document" : cleaned;
    }
}
