package io.arrestx.extractor.config;

import java.util.Map;
import java.util.Optional;

/**
 * Source of environment values; tests substitute a map.
 */
@FunctionalInterface
public interface EnvironmentReader {

    Optional<String> get(String key);

    static EnvironmentReader system() {
        return key -> Optional.ofNullable(System.getenv(key));
    }

    static EnvironmentReader of(Map<String, String> values) {
        Map<String, String> copy = Map.copyOf(values);
        return key -> Optional.ofNullable(copy.get(key));
    }
}
