package ai.afi.extractor.cli;

import ai.afi.extractor.batch.BatchOutcome;
import ai.afi.extractor.batch.BatchRunner;
import ai.afi.extractor.batch.DocumentDiscovery;
import ai.afi.extractor.config.Config;
import ai.afi.extractor.config.ConfigLoader;
import ai.afi.extractor.config.SystemEnvironmentReader;
import ai.afi.extractor.logging.LoggingConfigurator;
import ai.afi.extractor.parse.SectionStateMachine;
import ai.afi.extractor.sink.WorkbookRecordSink;
import ai.afi.extractor.source.DocumentLineSource;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

/**
 * Entry point wiring the command-line parser, configuration loader and batch runner.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);
    static final int EXIT_ABORTED = 1;

    private final ConfigLoader configLoader;
    private final DocumentDiscovery documentDiscovery;
    private final BatchRunner batchRunner;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new DocumentDiscovery(),
                new BatchRunner(new DocumentLineSource(), new SectionStateMachine()));
    }

    CliApplication(ConfigLoader configLoader, DocumentDiscovery documentDiscovery, BatchRunner batchRunner) {
        this.configLoader = configLoader;
        this.documentDiscovery = documentDiscovery;
        this.batchRunner = batchRunner;
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

        Config config = configLoader.load(cliArguments);
        LoggingConfigurator.configure(config.logFormat());
        LOGGER.info("Scanning {} (failFast={}) into {}", config.inputDirectory(), config.failFast(), config.outputWorkbook());

        try {
            List<Path> documents = documentDiscovery.discover(config.inputDirectory());
            BatchOutcome outcome;
            try (WorkbookRecordSink sink = WorkbookRecordSink.openOrCreate(config.outputWorkbook(), config.sheetName())) {
                outcome = batchRunner.run(documents, sink, config.failFast());
                sink.save();
            }
            if (!outcome.failedFiles().isEmpty()) {
                LOGGER.warn("Extraction failed for files: {}", String.join(", ", outcome.failedFiles()));
            }
            LOGGER.info("Done: {} rows -> {}", outcome.recordCount(), config.outputWorkbook());
            return 0;
        } catch (RuntimeException ex) {
            LOGGER.error("Run aborted: {}", ex.getMessage(), ex);
            return EXIT_ABORTED;
        }
    }
}
