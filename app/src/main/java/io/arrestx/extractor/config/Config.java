package io.arrestx.extractor.config;

import io.arrestx.extractor.engine.ParserOptions;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable runtime configuration assembled from CLI arguments, environment values and defaults.
 *
 * @param headerPatterns regular expressions for report header and footer lines, matched case-insensitively
 */
public record Config(
        Path input,
        ParserOptions parserOptions,
        List<String> headerPatterns,
        Optional<Path> jsonPath,
        Optional<Path> csvPath,
        Optional<Path> ndjsonPath,
        boolean prettyJson,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(input, "input");
        Objects.requireNonNull(parserOptions, "parserOptions");
        headerPatterns = headerPatterns == null ? List.of() : List.copyOf(headerPatterns);
        jsonPath = jsonPath == null ? Optional.empty() : jsonPath;
        csvPath = csvPath == null ? Optional.empty() : csvPath;
        ndjsonPath = ndjsonPath == null ? Optional.empty() : ndjsonPath;
        Objects.requireNonNull(logFormat, "logFormat");
        if (jsonPath.isEmpty() && csvPath.isEmpty() && ndjsonPath.isEmpty()) {
            throw new IllegalArgumentException("At least one output path must be configured");
        }
    }
}
