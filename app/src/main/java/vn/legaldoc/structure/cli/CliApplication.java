package vn.legaldoc.structure.cli;

import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import vn.legaldoc.structure.batch.BatchParseResult;
import vn.legaldoc.structure.batch.BatchParseService;
import vn.legaldoc.structure.config.Config;
import vn.legaldoc.structure.config.ConfigLoader;
import vn.legaldoc.structure.config.SystemEnvironmentReader;
import vn.legaldoc.structure.logging.LoggingConfigurator;
import vn.legaldoc.structure.model.NodeType;

/**
 * Entry point wiring the command-line parser, configuration loader and batch service.
 */
public final class CliApplication {

    private static final Logger LOGGER = LoggerFactory.getLogger(CliApplication.class);

    static final int EXIT_FAILURES = 1;
    static final int EXIT_CONFIG_ERROR = 2;

    private final ConfigLoader configLoader;
    private final BatchParseService batchParseService;

    public CliApplication() {
        this(new ConfigLoader(new SystemEnvironmentReader()), new BatchParseService());
    }

    CliApplication(ConfigLoader configLoader, BatchParseService batchParseService) {
        this.configLoader = configLoader;
        this.batchParseService = batchParseService;
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
            return EXIT_CONFIG_ERROR;
        }
        LoggingConfigurator.configure(config.logFormat(), config.verbose());
        LOGGER.info("Parsing {} input(s): docType={} dialect={} output={}",
                config.inputs().size(), config.documentType().orElse("<inferred>"),
                config.dialect().map(Enum::name).orElse("<resolved>"), config.outputDirectory());

        BatchParseResult result = batchParseService.run(config);
        LOGGER.info("Parsed {} document(s), {} failure(s); node counts: {}",
                result.documents().size(), result.failures().size(), describe(result.totalCounts()));
        if (result.hasFailures()) {
            result.failures().forEach(failure ->
                    LOGGER.warn("Not parsed: {} ({})", failure.source(), failure.reason()));
            return EXIT_FAILURES;
        }
        return 0;
    }

    private static String describe(Map<NodeType, Integer> counts) {
        if (counts.isEmpty()) {
            return "none";
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.comparingByKey())
                .map(entry -> entry.getKey().wireName() + "=" + entry.getValue())
                .collect(Collectors.joining(", "));
    }
}
