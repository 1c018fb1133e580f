package ai.docsite.richtext.config;

import ai.docsite.richtext.detect.FormatKind;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable representation of the runtime configuration assembled from CLI arguments and environment values.
 */
public record Config(
        boolean detectOnly,
        Optional<FormatKind> sourceFormat,
        FormatKind targetFormat,
        Optional<Path> input,
        Optional<Path> output,
        Optional<String> contentType,
        LogFormat logFormat,
        String logLevel,
        DocumentProperties documentProperties,
        int detectionMinConfidence,
        ExternalConverterConfig externalConverterConfig
) {

    private static final Set<String> LOG_LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR", "OFF");

    public Config {
        sourceFormat = sourceFormat == null ? Optional.empty() : sourceFormat;
        targetFormat = Objects.requireNonNull(targetFormat, "targetFormat");
        input = input == null ? Optional.empty() : input;
        output = output == null ? Optional.empty() : output;
        contentType = contentType == null ? Optional.empty() : contentType.filter(value -> !value.isBlank());
        logFormat = logFormat == null ? LogFormat.TEXT : logFormat;
        logLevel = normalizeLevel(logLevel);
        documentProperties = Objects.requireNonNull(documentProperties, "documentProperties");
        if (detectionMinConfidence < 0 || detectionMinConfidence > 100) {
            throw new IllegalArgumentException("detectionMinConfidence must be between 0 and 100");
        }
        externalConverterConfig = Objects.requireNonNull(externalConverterConfig, "externalConverterConfig");
        if (detectOnly && output.isPresent()) {
            throw new IllegalArgumentException("--output cannot be combined with --detect");
        }
    }

    private static String normalizeLevel(String raw) {
        if (raw == null || raw.isBlank()) {
            return "INFO";
        }
        String level = raw.trim().toUpperCase(Locale.ROOT);
        if (!LOG_LEVELS.contains(level)) {
            throw new IllegalArgumentException("Unsupported log level: " + raw);
        }
        return level;
    }
}
