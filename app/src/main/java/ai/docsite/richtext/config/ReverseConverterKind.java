package ai.docsite.richtext.config;

import java.util.Locale;

/**
 * Implementation used for conversions the engine cannot perform with its own transpilers.
 */
public enum ReverseConverterKind {
    NATIVE,
    EXTERNAL;

    public static ReverseConverterKind from(String value) {
        if (value == null) {
            return NATIVE;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "native", "regex", "" -> NATIVE;
            case "external", "pandoc", "process" -> EXTERNAL;
            default -> throw new IllegalArgumentException("Unsupported reverse converter: " + value);
        };
    }
}
