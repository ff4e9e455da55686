package io.arrestx.extractor.cli;

import io.arrestx.extractor.config.LogFormat;
import java.nio.file.Path;
import picocli.CommandLine;

@CommandLine.Command(name = "bookin-extractor", mixinStandardHelpOptions = true,
        description = "Extracts arrest records from text dumps of daily book-in reports")
public class CliArguments {

    @CommandLine.Parameters(index = "0", arity = "0..1", description = "Text dump of the report; pages separated by form feeds", paramLabel = "INPUT")
    private Path input;

    @CommandLine.Option(names = "--json", description = "Write records as a JSON array to this file", paramLabel = "FILE")
    private Path jsonPath;

    @CommandLine.Option(names = "--csv", description = "Write one CSV row per charge to this file", paramLabel = "FILE")
    private Path csvPath;

    @CommandLine.Option(names = "--ndjson", description = "Write one JSON record per line to this file", paramLabel = "FILE")
    private Path ndjsonPath;

    @CommandLine.Option(names = "--compact-json", description = "Do not pretty-print JSON output")
    private boolean compactJson;

    @CommandLine.Option(names = "--tolerant-names", description = "Also accept mixed-case names (records get a warning)")
    private boolean tolerantNames;

    @CommandLine.Option(names = "--no-two-line-id-date", description = "Require identifier and book-in date on the same line")
    private boolean noTwoLineIdDate;

    @CommandLine.Option(names = "--stall-ceiling", description = "Iterations without progress before a line is skipped", paramLabel = "COUNT")
    private Integer stallCeiling;

    @CommandLine.Option(names = "--log-format", description = "Log format: text or json", converter = LogFormatConverter.class)
    private LogFormat logFormat;

    public Path input() {
        return input;
    }

    public Path jsonPath() {
        return jsonPath;
    }

    public Path csvPath() {
        return csvPath;
    }

    public Path ndjsonPath() {
        return ndjsonPath;
    }

    public boolean compactJson() {
        return compactJson;
    }

    public boolean tolerantNames() {
        return tolerantNames;
    }

    public boolean noTwoLineIdDate() {
        return noTwoLineIdDate;
    }

    public Integer stallCeiling() {
        return stallCeiling;
    }

    public LogFormat logFormat() {
        return logFormat;
    }
}
