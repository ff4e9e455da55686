package io.arrestx.extractor.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import io.arrestx.extractor.cli.CliArguments;
import io.arrestx.extractor.engine.ParserOptions;
import io.arrestx.extractor.preprocess.DefaultLinePreprocessor;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import picocli.CommandLine;

class ConfigLoaderTest {

    @Test
    void assemblesConfigFromCliArguments() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "report.txt",
                "--json", "out/records.json",
                "--csv", "out/records.csv",
                "--ndjson", "out/records.ndjson",
                "--compact-json",
                "--tolerant-names",
                "--no-two-line-id-date",
                "--stall-ceiling", "25",
                "--log-format", "json");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.input()).isEqualTo(Path.of("report.txt"));
        assertThat(config.jsonPath()).contains(Path.of("out/records.json"));
        assertThat(config.csvPath()).contains(Path.of("out/records.csv"));
        assertThat(config.ndjsonPath()).contains(Path.of("out/records.ndjson"));
        assertThat(config.prettyJson()).isFalse();
        assertThat(config.parserOptions()).isEqualTo(new ParserOptions(false, false, 25));
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
        assertThat(config.headerPatterns()).isEqualTo(DefaultLinePreprocessor.DEFAULT_HEADER_PATTERNS);
    }

    @Test
    void defaultsWhenOnlyInputGiven() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "report.txt");

        Config config = new ConfigLoader(key -> Optional.empty()).load(cliArguments);

        assertThat(config.parserOptions()).isEqualTo(ParserOptions.defaults());
        assertThat(config.jsonPath()).contains(ConfigLoader.DEFAULT_JSON_PATH);
        assertThat(config.csvPath()).isEmpty();
        assertThat(config.ndjsonPath()).isEmpty();
        assertThat(config.prettyJson()).isTrue();
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void fallsBackToEnvironmentValuesWhenCliOmitted() {
        EnvironmentReader environment = EnvironmentReader.of(Map.of(
                ConfigLoader.ENV_NAME_STRICT, "no",
                ConfigLoader.ENV_TWO_LINE_ID_DATE, "0",
                ConfigLoader.ENV_STALL_CEILING, " 40 ",
                ConfigLoader.ENV_HEADER_PATTERNS, "^CONFIDENTIAL;; ^Printed by .*",
                ConfigLoader.ENV_CSV_PATH, "env/records.csv",
                ConfigLoader.ENV_PRETTY_JSON, "false",
                ConfigLoader.ENV_LOG_FORMAT, "JSON"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "report.txt");

        Config config = new ConfigLoader(environment).load(cliArguments);

        assertThat(config.parserOptions()).isEqualTo(new ParserOptions(false, false, 40));
        assertThat(config.headerPatterns()).containsExactly("^CONFIDENTIAL", "^Printed by .*");
        assertThat(config.csvPath()).contains(Path.of("env/records.csv"));
        assertThat(config.jsonPath()).isEmpty();
        assertThat(config.prettyJson()).isFalse();
        assertThat(config.logFormat()).isEqualTo(LogFormat.JSON);
    }

    @Test
    void cliValuesOverrideEnvironment() {
        EnvironmentReader environment = EnvironmentReader.of(Map.of(
                ConfigLoader.ENV_STALL_CEILING, "40",
                ConfigLoader.ENV_JSON_PATH, "env/records.json",
                ConfigLoader.ENV_LOG_FORMAT, "json"));
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "report.txt", "--stall-ceiling", "7", "--json", "cli/records.json", "--log-format", "text");

        Config config = new ConfigLoader(environment).load(cliArguments);

        assertThat(config.parserOptions().stallCeiling()).isEqualTo(7);
        assertThat(config.jsonPath()).contains(Path.of("cli/records.json"));
        assertThat(config.logFormat()).isEqualTo(LogFormat.TEXT);
    }

    @Test
    void rejectsMissingInput() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments());

        Throwable thrown = catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments));

        assertThat(thrown).isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("input");
    }

    @Test
    void rejectsInvalidEnvironmentValues() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(), "report.txt");

        assertThat(catchThrowable(() -> new ConfigLoader(EnvironmentReader.of(Map.of(
                ConfigLoader.ENV_NAME_STRICT, "maybe"))).load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_NAME_STRICT);
        assertThat(catchThrowable(() -> new ConfigLoader(EnvironmentReader.of(Map.of(
                ConfigLoader.ENV_STALL_CEILING, "0"))).load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(catchThrowable(() -> new ConfigLoader(EnvironmentReader.of(Map.of(
                ConfigLoader.ENV_HEADER_PATTERNS, "^(unclosed"))).load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining(ConfigLoader.ENV_HEADER_PATTERNS);
    }

    @Test
    void rejectsNonPositiveStallCeilingOnCommandLine() {
        CliArguments cliArguments = CommandLine.populateCommand(new CliArguments(),
                "report.txt", "--stall-ceiling", "0");

        assertThat(catchThrowable(() -> new ConfigLoader(key -> Optional.empty()).load(cliArguments)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("--stall-ceiling");
    }
}
