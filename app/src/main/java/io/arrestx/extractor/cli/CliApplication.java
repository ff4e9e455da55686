package io.arrestx.extractor.cli;

import io.arrestx.extractor.config.Config;
import io.arrestx.extractor.config.ConfigLoader;
import io.arrestx.extractor.config.EnvironmentReader;
import io.arrestx.extractor.engine.ExtractionEngine;
import io.arrestx.extractor.input.TextDumpReader;
import io.arrestx.extractor.logging.LoggingConfigurator;
import io.arrestx.extractor.model.ArrestRecord;
import io.arrestx.extractor.model.SourceDocument;
import io.arrestx.extractor.output.CsvRecordWriter;
import io.arrestx.extractor.output.JsonRecordWriter;
import io.arrestx.extractor.output.NdjsonRecordWriter;
import io.arrestx.extractor.output.OutputException;
import io.arrestx.extractor.output.RecordWriter;
import io.arrestx.extractor.preprocess.DefaultLinePreprocessor;
import io.arrestx.extractor.strategy.ExtractionOutcome;
import io.arrestx.extractor.strategy.StrategyChain;
import io.arrestx.extractor.strategy.TextStateMachineStrategy;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader, extraction chain and record writers.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private final ConfigLoader configLoader;
    private final TextDumpReader reader;

    public CliApplication() {
        this(new ConfigLoader(EnvironmentReader.system()), new TextDumpReader());
    }

    CliApplication(ConfigLoader configLoader, TextDumpReader reader) {
        this.configLoader = configLoader;
        this.reader = reader;
    }

    public static void main(String[] args) {
        System.exit(new CliApplication().run(args));
    }

    public int run(String[] args) {
        CliArguments cliArguments = new CliArguments();
        CommandLine commandLine = new CommandLine(cliArguments);

        try {
            commandLine.parseArgs(args);
        } catch (CommandLine.ParameterException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }

        if (commandLine.isUsageHelpRequested()) {
            commandLine.usage(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnUsageHelp();
        }
        if (commandLine.isVersionHelpRequested()) {
            commandLine.printVersionHelp(commandLine.getOut());
            return commandLine.getCommandSpec().exitCodeOnVersionHelp();
        }

        Config config;
        try {
            config = configLoader.load(cliArguments);
        } catch (IllegalArgumentException ex) {
            commandLine.getErr().println(ex.getMessage());
            commandLine.usage(commandLine.getErr());
            return commandLine.getCommandSpec().exitCodeOnInvalidInput();
        }
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Extracting {} (strictNames={}, twoLineIdDate={}, stallCeiling={})", config.input(),
                config.parserOptions().strictNames(), config.parserOptions().allowTwoLineIdDate(),
                config.parserOptions().stallCeiling());

        try {
            SourceDocument document = reader.read(config.input());
            StrategyChain chain = new StrategyChain(List.of(new TextStateMachineStrategy(
                    new DefaultLinePreprocessor(config.headerPatterns()),
                    new ExtractionEngine(config.parserOptions()))));
            ExtractionOutcome outcome = chain.extract(document);
            if (!outcome.succeeded()) {
                LOGGER.warn("No records extracted from {}", config.input());
            }
            writeOutputs(config, outcome.records(), document.sourceName());
            long warned = outcome.records().stream().filter(record -> !record.parseWarnings().isEmpty()).count();
            LOGGER.info("Done: {} record(s), {} with warnings", outcome.records().size(), warned);
            return EXIT_OK;
        } catch (UncheckedIOException ex) {
            LOGGER.error("Failed to read {}", config.input(), ex);
            return EXIT_FAILURE;
        } catch (OutputException ex) {
            LOGGER.error("Failed to write output: {}", ex.getMessage(), ex);
            return EXIT_FAILURE;
        }
    }

    private void writeOutputs(Config config, List<ArrestRecord> records, String sourceName) {
        write(new JsonRecordWriter(config.prettyJson()), config.jsonPath(), records, sourceName);
        write(new CsvRecordWriter(), config.csvPath(), records, sourceName);
        write(new NdjsonRecordWriter(), config.ndjsonPath(), records, sourceName);
    }

    private static void write(RecordWriter writer, Optional<Path> path, List<ArrestRecord> records, String sourceName) {
        path.ifPresent(target -> {
            LOGGER.debug("Writing {} output to {}", writer.format(), target);
            writer.write(records, sourceName, target);
        });
    }
}
