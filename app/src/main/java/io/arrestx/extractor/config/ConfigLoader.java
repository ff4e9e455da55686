package io.arrestx.extractor.config;

import io.arrestx.extractor.cli.CliArguments;
import io.arrestx.extractor.engine.ParserOptions;
import io.arrestx.extractor.preprocess.DefaultLinePreprocessor;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 * A value given on the command line always wins over the environment.
 */
public class ConfigLoader {

    static final String ENV_NAME_STRICT = "ARRESTX_NAME_STRICT";
    static final String ENV_TWO_LINE_ID_DATE = "ARRESTX_TWO_LINE_ID_DATE";
    static final String ENV_STALL_CEILING = "ARRESTX_STALL_CEILING";
    static final String ENV_HEADER_PATTERNS = "ARRESTX_HEADER_PATTERNS";
    static final String ENV_JSON_PATH = "ARRESTX_JSON_PATH";
    static final String ENV_CSV_PATH = "ARRESTX_CSV_PATH";
    static final String ENV_NDJSON_PATH = "ARRESTX_NDJSON_PATH";
    static final String ENV_PRETTY_JSON = "ARRESTX_PRETTY_JSON";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final Path DEFAULT_JSON_PATH = Path.of("out", "arrests.json");
    private static final String HEADER_PATTERN_SEPARATOR = ";;";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        if (arguments.input() == null) {
            throw new IllegalArgumentException("An input text dump must be provided");
        }

        boolean strictNames = !arguments.tolerantNames()
                && resolveBoolean(ENV_NAME_STRICT).orElse(true);
        boolean twoLineIdDate = !arguments.noTwoLineIdDate()
                && resolveBoolean(ENV_TWO_LINE_ID_DATE).orElse(true);
        int stallCeiling = resolveStallCeiling(arguments);
        ParserOptions parserOptions = new ParserOptions(strictNames, twoLineIdDate, stallCeiling);

        List<String> headerPatterns = environmentReader.get(ENV_HEADER_PATTERNS)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::parseHeaderPatterns)
                .orElse(DefaultLinePreprocessor.DEFAULT_HEADER_PATTERNS);

        Optional<Path> csvPath = resolvePath(arguments.csvPath(), ENV_CSV_PATH);
        Optional<Path> ndjsonPath = resolvePath(arguments.ndjsonPath(), ENV_NDJSON_PATH);
        Optional<Path> jsonPath = resolvePath(arguments.jsonPath(), ENV_JSON_PATH);
        if (jsonPath.isEmpty() && csvPath.isEmpty() && ndjsonPath.isEmpty()) {
            jsonPath = Optional.of(DEFAULT_JSON_PATH);
        }

        boolean prettyJson = !arguments.compactJson()
                && resolveBoolean(ENV_PRETTY_JSON).orElse(true);

        return new Config(arguments.input(), parserOptions, headerPatterns, jsonPath, csvPath, ndjsonPath,
                prettyJson, resolveLogFormat(arguments));
    }

    private int resolveStallCeiling(CliArguments arguments) {
        Integer cliValue = arguments.stallCeiling();
        if (cliValue != null) {
            if (cliValue < 1) {
                throw new IllegalArgumentException("--stall-ceiling must be at least 1");
            }
            return cliValue;
        }
        return environmentReader.get(ENV_STALL_CEILING)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(ConfigLoader::parseStallCeiling)
                .orElse(ParserOptions.DEFAULT_STALL_CEILING);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.get(ENV_LOG_FORMAT)
                .filter(ConfigLoader::isNotBlank)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(Path::of);
    }

    private Optional<Boolean> resolveBoolean(String envKey) {
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> parseBoolean(envKey, value));
    }

    private static boolean parseBoolean(String key, String raw) {
        String value = raw.trim().toLowerCase(Locale.ROOT);
        return switch (value) {
            case "true", "1", "yes" -> true;
            case "false", "0", "no" -> false;
            default -> throw new IllegalArgumentException(key + " must be true or false but was: " + raw);
        };
    }

    private static int parseStallCeiling(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_STALL_CEILING + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_STALL_CEILING + " must be an integer", ex);
        }
    }

    private static List<String> parseHeaderPatterns(String raw) {
        return Arrays.stream(raw.split(HEADER_PATTERN_SEPARATOR))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(ConfigLoader::validatePattern)
                .toList();
    }

    private static String validatePattern(String pattern) {
        try {
            Pattern.compile(pattern);
            return pattern;
        } catch (PatternSyntaxException ex) {
            throw new IllegalArgumentException(ENV_HEADER_PATTERNS + " contains an invalid pattern: " + pattern, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
