package ai.docsite.richtext.config;

import ai.docsite.richtext.cli.CliArguments;
import ai.docsite.richtext.detect.FormatKind;
import java.time.Duration;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds a {@link Config} instance by combining CLI arguments with environment variables and defaults.
 */
public class ConfigLoader {

    static final String ENV_FONT_FAMILY = "RICHTEXT_FONT_FAMILY";
    static final String ENV_FONT_SIZE = "RICHTEXT_FONT_SIZE";
    static final String ENV_FONT_COLOR = "RICHTEXT_FONT_COLOR";
    static final String ENV_CHARSET = "RICHTEXT_CHARSET";
    static final String ENV_LANGUAGE = "RICHTEXT_LANGUAGE";
    static final String ENV_PARAGRAPH_SPACING = "RICHTEXT_PARAGRAPH_SPACING";
    static final String ENV_LINE_HEIGHT = "RICHTEXT_LINE_HEIGHT";
    static final String ENV_MARGIN = "RICHTEXT_MARGIN";
    static final String ENV_STYLES = "RICHTEXT_STYLES";
    static final String ENV_LEGACY_UNDERLINE = "RICHTEXT_LEGACY_UNDERLINE";
    static final String ENV_MIN_CONFIDENCE = "RICHTEXT_MIN_CONFIDENCE";
    static final String ENV_TARGET_FORMAT = "RICHTEXT_TARGET_FORMAT";
    static final String ENV_REVERSE_CONVERTER = "REVERSE_CONVERTER";
    static final String ENV_EXTERNAL_CONVERTER_COMMAND = "EXTERNAL_CONVERTER_COMMAND";
    static final String ENV_EXTERNAL_CONVERTER_TIMEOUT_SECONDS = "EXTERNAL_CONVERTER_TIMEOUT_SECONDS";
    static final String ENV_LOG_FORMAT = "LOG_FORMAT";
    static final String ENV_LOG_LEVEL = "LOG_LEVEL";

    private static final int DEFAULT_MIN_CONFIDENCE = 10;
    private static final int DEFAULT_EXTERNAL_TIMEOUT_SECONDS = 20;

    private final EnvironmentReader environmentReader;

    public ConfigLoader(EnvironmentReader environmentReader) {
        this.environmentReader = Objects.requireNonNull(environmentReader, "environmentReader");
    }

    public Config load(CliArguments arguments) {
        Objects.requireNonNull(arguments, "arguments");
        DocumentProperties properties = loadDocumentProperties(arguments);

        FormatKind targetFormat = Optional.ofNullable(arguments.targetFormat())
                .or(() -> env(ENV_TARGET_FORMAT).map(FormatKind::from))
                .orElse(FormatKind.RICH_CONTROL_WORD);

        LogFormat logFormat = Optional.ofNullable(arguments.logFormat())
                .or(() -> env(ENV_LOG_FORMAT).map(LogFormat::from))
                .orElse(LogFormat.TEXT);
        String logLevel = env(ENV_LOG_LEVEL).orElse("INFO");

        int minConfidence = env(ENV_MIN_CONFIDENCE)
                .map(value -> parseInteger(value, ENV_MIN_CONFIDENCE))
                .orElse(DEFAULT_MIN_CONFIDENCE);

        return new Config(arguments.detectOnly(),
                Optional.ofNullable(arguments.sourceFormat()),
                targetFormat,
                Optional.ofNullable(arguments.input()),
                Optional.ofNullable(arguments.output()),
                Optional.ofNullable(arguments.contentType()),
                logFormat,
                logLevel,
                properties,
                minConfidence,
                loadExternalConverterConfig(arguments));
    }

    DocumentProperties loadDocumentProperties(CliArguments arguments) {
        String fontFamily = Optional.ofNullable(arguments.fontFamily())
                .filter(ConfigLoader::isNotBlank)
                .or(() -> env(ENV_FONT_FAMILY))
                .orElse(DocumentProperties.DEFAULT_FONT_FAMILY);
        int fontSize = Optional.ofNullable(arguments.fontSize())
                .or(() -> env(ENV_FONT_SIZE).map(value -> parseInteger(value, ENV_FONT_SIZE)))
                .orElse(DocumentProperties.DEFAULT_FONT_SIZE);
        RgbColor color = env(ENV_FONT_COLOR).map(RgbColor::parse).orElse(RgbColor.BLACK);
        int charset = intEnv(ENV_CHARSET, DocumentProperties.DEFAULT_CHARSET);
        int language = intEnv(ENV_LANGUAGE, DocumentProperties.DEFAULT_LANGUAGE_ID);
        int spacing = intEnv(ENV_PARAGRAPH_SPACING, DocumentProperties.DEFAULT_PARAGRAPH_SPACING);
        int lineHeight = intEnv(ENV_LINE_HEIGHT, DocumentProperties.DEFAULT_LINE_HEIGHT);
        int margin = intEnv(ENV_MARGIN, DocumentProperties.DEFAULT_MARGIN);
        StyleTable styles = env(ENV_STYLES)
                .map(ConfigLoader::parseStyleOverrides)
                .map(StyleTable.defaults()::withOverrides)
                .orElse(StyleTable.defaults());
        boolean legacyUnderline = env(ENV_LEGACY_UNDERLINE).map(ConfigLoader::parseBoolean).orElse(false);

        return new DocumentProperties(fontFamily, fontSize, color, charset, language, spacing, lineHeight, margin,
                styles, legacyUnderline);
    }

    private ExternalConverterConfig loadExternalConverterConfig(CliArguments arguments) {
        ReverseConverterKind kind = Optional.ofNullable(arguments.reverseConverter())
                .or(() -> env(ENV_REVERSE_CONVERTER).map(ReverseConverterKind::from))
                .orElse(ReverseConverterKind.NATIVE);
        List<String> command = env(ENV_EXTERNAL_CONVERTER_COMMAND)
                .map(ConfigLoader::parseCommand)
                .orElse(ExternalConverterConfig.DEFAULT_COMMAND);
        int timeoutSeconds = intEnv(ENV_EXTERNAL_CONVERTER_TIMEOUT_SECONDS, DEFAULT_EXTERNAL_TIMEOUT_SECONDS);
        if (timeoutSeconds < 1) {
            throw new IllegalArgumentException(ENV_EXTERNAL_CONVERTER_TIMEOUT_SECONDS + " must be at least 1");
        }
        return new ExternalConverterConfig(kind, command, Duration.ofSeconds(timeoutSeconds));
    }

    private Optional<String> env(String key) {
        return environmentReader.get(key)
                .filter(ConfigLoader::isNotBlank)
                .map(String::trim);
    }

    private int intEnv(String key, int defaultValue) {
        return env(key).map(value -> parseInteger(value, key)).orElse(defaultValue);
    }

    private static int parseInteger(String raw, String key) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ex) {
            throw new IllegalArgumentException(key + " must be an integer", ex);
        }
    }

    private static boolean parseBoolean(String raw) {
        return raw.equalsIgnoreCase("true") || raw.equals("1") || raw.equalsIgnoreCase("yes");
    }

    private static boolean isNotBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static List<String> parseCommand(String raw) {
        return Arrays.stream(raw.trim().split("\\s+"))
                .filter(ConfigLoader::isNotBlank)
                .collect(Collectors.toList());
    }

    static Map<String, String> parseStyleOverrides(String raw) {
        Map<String, String> overrides = new LinkedHashMap<>();
        for (String entry : raw.split(",")) {
            if (entry.isBlank()) {
                continue;
            }
            int separator = entry.indexOf('=');
            if (separator <= 0) {
                throw new IllegalArgumentException(ENV_STYLES + " entries must use name=controlWord: " + entry);
            }
            overrides.put(entry.substring(0, separator).trim(), entry.substring(separator + 1).trim());
        }
        return overrides;
    }
}
