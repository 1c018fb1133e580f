package ai.docsite.richtext.convert;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.html.HtmlText;
import ai.docsite.richtext.rtf.ControlWordEmitter;
import ai.docsite.richtext.rtf.ControlWordEscaper;
import java.util.Arrays;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Wraps text without recognised structure. Every source line becomes one paragraph.
 */
public class PlainTextTranspiler {

    private final ControlWordEmitter emitter;

    public PlainTextTranspiler() {
        this(new ControlWordEmitter());
    }

    public PlainTextTranspiler(ControlWordEmitter emitter) {
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    public String toRichControlWord(String text, DocumentProperties properties) {
        StringBuilder body = new StringBuilder();
        for (String line : lines(text)) {
            body.append(ControlWordEscaper.escape(line)).append(ControlWordEmitter.PARAGRAPH_BREAK).append('\n');
        }
        return emitter.emitDocument(properties, body.toString());
    }

    /**
     * Paragraphs separated by blank lines; single line breaks are kept as {@code <br>}.
     */
    public String toMarkupTree(String text) {
        String normalized = normalize(text).strip();
        if (normalized.isEmpty()) {
            return "";
        }
        return Arrays.stream(normalized.split("\\n\\s*\\n"))
                .map(paragraph -> "<p>" + Arrays.stream(paragraph.split("\\n"))
                        .map(HtmlText::escape)
                        .collect(Collectors.joining("<br>")) + "</p>\n")
                .collect(Collectors.joining());
    }

    /**
     * Keeps layout as written, for structured sources such as object notation.
     */
    public String toPreformattedMarkup(String text) {
        return "<pre><code>" + HtmlText.escape(normalize(text).stripTrailing()) + "</code></pre>\n";
    }

    private static String[] lines(String text) {
        String normalized = normalize(text);
        if (normalized.isEmpty()) {
            return new String[0];
        }
        if (normalized.endsWith("\n")) {
            normalized = normalized.substring(0, normalized.length() - 1);
        }
        return normalized.split("\n", -1);
    }

    private static String normalize(String text) {
        return text == null ? "" : text.replace("\r\n", "\n").replace('\r', '\n');
    }
}
