package ai.docsite.richtext.config;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Settings for the conversion capability used outside the native transpilers.
 *
 * <p>{@code commandTemplate} is the external command line; the {@code {from}} and {@code {to}}
 * placeholders are replaced with the external tool's format names.
 */
public record ExternalConverterConfig(ReverseConverterKind kind, List<String> commandTemplate, Duration timeout) {

    public static final List<String> DEFAULT_COMMAND = List.of("pandoc", "-f", "{from}", "-t", "{to}");
    public static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(20);

    public ExternalConverterConfig {
        kind = Objects.requireNonNull(kind, "kind");
        commandTemplate = commandTemplate == null || commandTemplate.isEmpty()
                ? DEFAULT_COMMAND
                : List.copyOf(commandTemplate);
        if (commandTemplate.get(0).isBlank()) {
            throw new IllegalArgumentException("commandTemplate must start with an executable");
        }
        timeout = timeout == null ? DEFAULT_TIMEOUT : timeout;
        if (timeout.isNegative() || timeout.isZero()) {
            throw new IllegalArgumentException("timeout must be positive");
        }
    }

    public static ExternalConverterConfig nativeOnly() {
        return new ExternalConverterConfig(ReverseConverterKind.NATIVE, DEFAULT_COMMAND, DEFAULT_TIMEOUT);
    }

    public boolean isExternal() {
        return kind == ReverseConverterKind.EXTERNAL;
    }
}
