package vn.legaldoc.structure.config;

import java.util.Optional;

@FunctionalInterface
public interface EnvironmentReader {
    Optional<String> get(String key);

    /**
     * Value of {@code key}, trimmed, or empty when unset or blank.
     */
    default Optional<String> getNonBlank(String key) {
        return get(key)
                .map(String::trim)
                .filter(value -> !value.isEmpty());
    }
}
