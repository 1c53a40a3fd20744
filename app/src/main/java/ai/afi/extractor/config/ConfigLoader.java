package ai.afi.extractor.config;

import ai.afi.extractor.cli.CliArguments;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_INPUT_DIR = "AFI_INPUT_DIR";
    static final String ENV_OUTPUT_PATH = "AFI_OUTPUT_PATH";
    static final String ENV_SHEET_NAME = "AFI_SHEET_NAME";
    static final String ENV_FAIL_FAST = "AFI_FAIL_FAST";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";

    static final String DEFAULT_WORKBOOK_NAME = "All_AFIs.xlsx";
    static final String DEFAULT_SHEET_NAME = "Sheet1";

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        Path inputDirectory = resolvePath(arguments.inputDirectory(), ENV_INPUT_DIR)
                .orElseGet(() -> Path.of("").toAbsolutePath());
        Path outputWorkbook = resolvePath(arguments.outputWorkbook(), ENV_OUTPUT_PATH)
                .orElseGet(() -> inputDirectory.resolve(DEFAULT_WORKBOOK_NAME));
        String sheetName = firstNonBlank(arguments.sheetName(), ENV_SHEET_NAME, DEFAULT_SHEET_NAME);
        boolean failFast = resolveFailFast(arguments);
        LogFormat logFormat = resolveLogFormat(arguments);

        return new Config(inputDirectory, outputWorkbook, sheetName, failFast, logFormat);
    }

    private Optional<Path> resolvePath(Path cliValue, String envKey) {
        if (cliValue != null) {
            return Optional.of(cliValue);
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim)
                .map(value -> parsePath(value, envKey));
    }

    private boolean resolveFailFast(CliArguments arguments) {
        if (arguments.failFast()) {
            return true;
        }
        return environmentReader.get(ENV_FAIL_FAST)
                .map(String::trim)
                .map(value -> value.equalsIgnoreCase("true") || value.equals("1"))
                .orElse(false);
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

    private String firstNonBlank(String cliValue, String envKey, String defaultValue) {
        if (isNotBlank(cliValue)) {
            return cliValue;
        }
        return environmentReader.get(envKey)
                .filter(ConfigLoader::isNotBlank)
                .orElse(defaultValue);
    }

    private static Path parsePath(String raw, String envKey) {
        try {
            return Path.of(raw);
        } catch (InvalidPathException ex) {
            throw new IllegalArgumentException(envKey + " is not a valid path: " + raw, ex);
        }
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }
}
