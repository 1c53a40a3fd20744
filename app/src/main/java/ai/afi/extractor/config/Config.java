package ai.afi.extractor.config;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        Path inputDirectory,
        Path outputWorkbook,
        String sheetName,
        boolean failFast,
        LogFormat logFormat
) {

    public Config {
        Objects.requireNonNull(inputDirectory, "inputDirectory");
        Objects.requireNonNull(outputWorkbook, "outputWorkbook");
        sheetName = requireNonBlank(sheetName, "sheetName");
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        if (!outputWorkbook.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".xlsx")) {
            throw new IllegalArgumentException("outputWorkbook must be an .xlsx file: " + outputWorkbook);
        }
    }

    private static String requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be blank");
        }
        return value;
    }
}
