package ai.docsite.richtext.detect;

import java.util.Locale;
import java.util.Optional;

/**
 * Document formats understood by the conversion engine.
 *
 * <p>The two tabular constants stand for the tabular variant parameterized by its delimiter.
 */
public enum FormatKind {
    RICH_CONTROL_WORD,
    MARKUP_TREE,
    LIGHTWEIGHT_MARKUP,
    OBJECT_NOTATION,
    TABULAR_COMMA,
    TABULAR_TAB,
    GENERIC_MARKUP,
    PLAIN_TEXT;

    public boolean isTabular() {
        return this == TABULAR_COMMA || this == TABULAR_TAB;
    }

    public Optional<Character> delimiter() {
        return switch (this) {
            case TABULAR_COMMA -> Optional.of(',');
            case TABULAR_TAB -> Optional.of('\t');
            default -> Optional.empty();
        };
    }

    public static FormatKind from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Format must be provided");
        }
        String value = raw.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return switch (value) {
            case "rtf", "richcontrolword", "rich_control_word", "richtext" -> RICH_CONTROL_WORD;
            case "html", "htm", "markuptree", "markup_tree" -> MARKUP_TREE;
            case "markdown", "md", "lightweightmarkup", "lightweight_markup" -> LIGHTWEIGHT_MARKUP;
            case "json", "objectnotation", "object_notation" -> OBJECT_NOTATION;
            case "csv", "tabular_comma" -> TABULAR_COMMA;
            case "tsv", "tabular_tab" -> TABULAR_TAB;
            case "xml", "genericmarkup", "generic_markup" -> GENERIC_MARKUP;
            case "text", "txt", "plain", "plaintext", "plain_text" -> PLAIN_TEXT;
            default -> throw new IllegalArgumentException("Unsupported format: " + raw);
        };
    }
}
