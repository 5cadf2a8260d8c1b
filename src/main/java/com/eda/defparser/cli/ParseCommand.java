package com.eda.defparser.cli;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.eda.defparser.cli.exception.OptionsValidationException;
import com.eda.defparser.cli.model.ParseOptions;
import com.eda.defparser.cli.model.ValidatedParseOptions;
import com.eda.defparser.cli.output.ParseResultsPrinter;
import com.eda.defparser.cli.validation.ParseOptionsValidator;
import com.eda.defparser.config.DefParserConfig;
import com.eda.defparser.model.DefDataset;
import com.eda.defparser.parser.DefFileParser;
import com.eda.defparser.parser.DuplicateNameException;
import com.eda.defparser.progress.LoggingProgressListener;
import com.eda.defparser.report.DatasetReportWriter;
import com.eda.defparser.transform.DefTransformException;

import ch.qos.logback.classic.Level;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

/**
 * CLI command that parses one DEF file and writes its report.
 */
@Command(
        name = "parse-def",
        mixinStandardHelpOptions = true,
        version = "def-netlist-parser 1.0.0",
        description = "Parses a DEF file and extracts component placement and net connectivity."
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    static final int EXIT_OK = 0;
    static final int EXIT_PARSE_FAILED = 1;
    static final int EXIT_INVALID_OPTIONS = 2;

    @Mixin
    private ParseOptions options;

    private final ParseOptionsValidator validator = new ParseOptionsValidator();
    private final ParseResultsPrinter printer = new ParseResultsPrinter();
    private final DatasetReportWriter reportWriter = new DatasetReportWriter();

    @Override
    public Integer call() {
        if (options.isDebug()) {
            enableDebugLogging();
        }

        ValidatedParseOptions validated;
        try {
            validated = validator.validate(options);
        } catch (OptionsValidationException e) {
            e.getErrors().forEach(error -> log.error("{}", error));
            return EXIT_INVALID_OPTIONS;
        }

        printer.printBanner(options, validated);

        ExecutorService executor = options.getThreads() > 1 ? Executors.newFixedThreadPool(options.getThreads()) : null;
        try {
            DefParserConfig config = DefParserConfig.builder()
                    .requiredKeywords(validated.getRequiredSections())
                    .multiLineNets(!options.isSingleLineNets())
                    .duplicateNamePolicy(options.getDuplicatePolicy())
                    .executor(executor)
                    .batchSize(options.getBatchSize())
                    .progressListener(new LoggingProgressListener("Parsing DEF file"))
                    .build();

            DefDataset dataset = new DefFileParser(config).parse(validated.getDefFile());
            log.info("Finished DEF file parsing");

            printer.printHeader(dataset.getHeader());
            if (options.isDebug()) {
                printer.printDebugSample(dataset);
            }

            Path reportFile = null;
            if (!options.isNoReport()) {
                reportFile = reportWriter.write(dataset, validated.getNormalizedOutputDir());
            }
            printer.printSummary(dataset, reportFile);
            return EXIT_OK;

        } catch (IOException | DefTransformException | DuplicateNameException e) {
            printer.printFailure(e.getMessage(), e);
            return EXIT_PARSE_FAILED;
        } finally {
            if (executor != null) {
                executor.shutdownNow();
            }
        }
    }

    private void enableDebugLogging() {
        org.slf4j.Logger appLogger = LoggerFactory.getLogger("com.eda.defparser");
        if (appLogger instanceof ch.qos.logback.classic.Logger logbackLogger) {
            logbackLogger.setLevel(Level.DEBUG);
        }
    }
}
