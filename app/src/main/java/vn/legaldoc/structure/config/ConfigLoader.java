package vn.legaldoc.structure.config;

import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import vn.legaldoc.structure.cli.CliArguments;
import vn.legaldoc.structure.parse.Dialect;

/**
 * Builds a {@link Config} by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUTS = "LEGAL_PARSER_INPUTS";
    static final String ENV_OUTPUT_DIR = "LEGAL_PARSER_OUTPUT_DIR";
    static final String ENV_DOC_TYPE = "LEGAL_PARSER_DOC_TYPE";
    static final String ENV_DIALECT = "LEGAL_PARSER_DIALECT";
    static final String ENV_THREADS = "LEGAL_PARSER_THREADS";
    static final String ENV_PRETTY = "LEGAL_PARSER_PRETTY";
    static final String ENV_EXTENSIONS = "LEGAL_PARSER_EXTENSIONS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "LOG_LEVEL";

    private static final String DEFAULT_OUTPUT_DIR = "outputs/structured";
    private static final int DEFAULT_THREADS = 1;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        List<Path> inputs = resolveInputs(arguments);
        Path outputDirectory = Path.of(firstNonBlank(arguments.outputDirectory(), ENV_OUTPUT_DIR, DEFAULT_OUTPUT_DIR));
        Optional<String> documentType = Optional.ofNullable(arguments.documentType())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> environmentReader.getNonBlank(ENV_DOC_TYPE));
        Optional<Dialect> dialect = Optional.ofNullable(arguments.dialect())
                .or(() -> environmentReader.getNonBlank(ENV_DIALECT).map(Dialect::from));
        Optional<String> title = Optional.ofNullable(arguments.title()).filter(ConfigLoader::isNotBlank);
        int threads = resolveThreads(arguments);
        boolean pretty = arguments.prettyPrint() || environmentReader.getNonBlank(ENV_PRETTY)
                .map(ConfigLoader::parseBoolean)
                .orElse(false);
        LogFormat logFormat = resolveLogFormat(arguments);
        boolean verbose = arguments.verbose() || environmentReader.getNonBlank(ENV_LOG_LEVEL)
                .map(value -> value.equalsIgnoreCase("DEBUG") || value.equalsIgnoreCase("TRACE"))
                .orElse(false);
        Set<String> extensions = environmentReader.getNonBlank(ENV_EXTENSIONS)
                .map(ConfigLoader::parseExtensions)
                .orElse(Config.DEFAULT_FILE_EXTENSIONS);

        return new Config(inputs, outputDirectory, documentType, dialect, title, threads, pretty, logFormat,
                verbose, extensions);
    }

    private List<Path> resolveInputs(CliArguments arguments) {
        if (!arguments.inputs().isEmpty()) {
            return arguments.inputs();
        }
        return environmentReader.getNonBlank(ENV_INPUTS)
                .map(raw -> Arrays.stream(raw.split(","))
                        .map(String::trim)
                        .filter(ConfigLoader::isNotBlank)
                        .map(Path::of)
                        .collect(Collectors.toList()))
                .filter(paths -> !paths.isEmpty())
                .orElseThrow(() -> new IllegalArgumentException(
                        "Input files must be provided as arguments or via " + ENV_INPUTS));
    }

    private int resolveThreads(CliArguments arguments) {
        Integer threads = arguments.threads();
        if (threads != null) {
            if (threads < 1) {
                throw new IllegalArgumentException("--threads must be at least 1");
            }
            return threads;
        }
        return environmentReader.getNonBlank(ENV_THREADS)
                .map(ConfigLoader::parseThreads)
                .orElse(DEFAULT_THREADS);
    }

    private LogFormat resolveLogFormat(CliArguments arguments) {
        LogFormat cliFormat = arguments.logFormat();
        if (cliFormat != null) {
            return cliFormat;
        }
        return environmentReader.getNonBlank(ENV_LOG_FORMAT)
                .map(LogFormat::from)
                .orElse(LogFormat.TEXT);
    }

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.getNonBlank(envKey).orElse(defaultValue);
    }

    private static int parseThreads(String raw) {
        try {
            int value = Integer.parseInt(raw);
            if (value < 1) {
                throw new IllegalArgumentException(ENV_THREADS + " must be at least 1");
            }
            return value;
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(ENV_THREADS + " must be an integer", ex);
        }
    }

    private static boolean parseBoolean(String raw) {
        return raw.equalsIgnoreCase("true") || raw.equals("1");
    }

    private static Set<String> parseExtensions(String raw) {
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(ConfigLoader::isNotBlank)
                .map(value -> value.startsWith(".") ? value.substring(1) : value)
                .map(value -> value.toLowerCase(Locale.ROOT))
                .collect(Collectors.toCollection(LinkedHashSet::new));
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
