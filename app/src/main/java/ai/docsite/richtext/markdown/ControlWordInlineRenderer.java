package ai.docsite.richtext.markdown;

import ai.docsite.richtext.config.StyleTable;
import ai.docsite.richtext.rtf.ControlWordEscaper;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Renders spans as control words. Each styled span is wrapped in its own on/off toggle pairs, so
 * styles never overlap across span boundaries. Text is escaped here and nowhere earlier.
 */
public class ControlWordInlineRenderer implements InlineRenderer {

    private final StyleTable styles;

    public ControlWordInlineRenderer(StyleTable styles) {
        this.styles = Objects.requireNonNull(styles, "styles");
    }

    @Override
    public String render(List<InlineSpan> spans) {
        StringBuilder out = new StringBuilder();
        for (InlineSpan span : spans) {
            List<String> on = new ArrayList<>();
            List<String> off = new ArrayList<>();
            for (SpanStyle style : span.orderedStyles()) {
                addWord(on, onName(style));
                addWord(off, offName(style));
            }
            Collections.reverse(off);
            appendWords(out, on);
            switch (span.kind()) {
                case TEXT, IMAGE -> out.append(ControlWordEscaper.escape(span.text()));
                case CODE -> out.append('{')
                        .append(withDelimiter(styles.controlWord(StyleTable.CODE)))
                        .append(ControlWordEscaper.escape(span.text()))
                        .append('}');
                case LINK -> out.append("{\\field{\\*\\fldinst{HYPERLINK \"")
                        .append(ControlWordEscaper.escape(span.target().replace("\"", "")))
                        .append("\"}}{\\fldrslt{")
                        .append(withDelimiter(styles.controlWord(StyleTable.UNDERLINE)))
                        .append(ControlWordEscaper.escape(span.text()))
                        .append("}}}");
            }
            appendWords(out, off);
        }
        return out.toString();
    }

    private void addWord(List<String> words, String styleName) {
        String word = styles.controlWord(styleName);
        if (!word.isEmpty()) {
            words.add(word);
        }
    }

    private static void appendWords(StringBuilder out, List<String> words) {
        if (!words.isEmpty()) {
            words.forEach(out::append);
            out.append(' ');
        }
    }

    private static String withDelimiter(String word) {
        return word.isEmpty() ? "" : word + " ";
    }

    private static String onName(SpanStyle style) {
        return switch (style) {
            case BOLD -> StyleTable.BOLD;
            case ITALIC -> StyleTable.ITALIC;
            case UNDERLINE -> StyleTable.UNDERLINE;
            case STRIKE -> StyleTable.STRIKE;
        };
    }

    private static String offName(SpanStyle style) {
        return switch (style) {
            case BOLD -> StyleTable.BOLD_OFF;
            case ITALIC -> StyleTable.ITALIC_OFF;
            case UNDERLINE -> StyleTable.UNDERLINE_OFF;
            case STRIKE -> StyleTable.STRIKE_OFF;
        };
    }
}
