package ai.docsite.richtext.markdown;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.config.StyleTable;
import ai.docsite.richtext.html.HtmlText;
import ai.docsite.richtext.list.ListStateTracker;
import ai.docsite.richtext.rtf.ControlWordEmitter;
import ai.docsite.richtext.rtf.ControlWordEscaper;
import ai.docsite.richtext.rtf.ParagraphBreaks;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Converts lightweight markup into control words or markup-tree elements.
 *
 * <p>Blocks come from a {@link BlockTokenizer}; the text of each block is scanned into inline spans
 * line by line and handed to the renderer for the target format.
 */
public class LightweightMarkupTranspiler {

    private static final int[] HEADING_SIZES = {48, 40, 32, 28, 26, 24};
    private static final Pattern BULLET_RUN = Pattern.compile("(?:<li data-list=\"bullet\"[^>]*>[^\\n]*</li>\\n)+");
    private static final Pattern ORDERED_RUN = Pattern.compile("(?:<li data-list=\"ordered\"[^>]*>[^\\n]*</li>\\n)+");
    private static final String LINE_JOIN = ControlWordEmitter.LINE_BREAK + " ";
    private static final String PARAGRAPH_END = ControlWordEmitter.PARAGRAPH_BREAK + "\n";
    private static final int QUOTE_INDENT = 720;

    private final BlockTokenizer tokenizer;
    private final ControlWordEmitter emitter;

    public LightweightMarkupTranspiler() {
        this(new DefaultBlockTokenizer(), new ControlWordEmitter());
    }

    public LightweightMarkupTranspiler(BlockTokenizer tokenizer, ControlWordEmitter emitter) {
        this.tokenizer = Objects.requireNonNull(tokenizer, "tokenizer");
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    /**
     * Produces a complete control-word document: preamble, paragraph defaults and body.
     */
    public String toRichControlWord(String markdown, DocumentProperties properties) {
        return emitter.emitDocument(properties, toRichControlWordBody(markdown, properties));
    }

    String toRichControlWordBody(String markdown, DocumentProperties properties) {
        InlineSpanProcessor inline = new InlineSpanProcessor(properties.legacyUnderscoreUnderline());
        InlineRenderer renderer = new ControlWordInlineRenderer(properties.styles());
        ListStateTracker lists = new ListStateTracker(emitter, properties);
        StringBuilder body = new StringBuilder();

        for (BlockToken token : tokenizer.tokenize(markdown)) {
            if (token.type() == BlockType.LIST_ITEM) {
                body.append(lists.item(token.listLine().orElseThrow(),
                        renderer.render(inline.parse(token.listLine().get().content()))));
                continue;
            }
            body.append(lists.exit());
            switch (token.type()) {
                case HEADING -> body.append("{\\fs").append(headingSize(token.level())).append(' ')
                        .append(renderer.render(inline.parse(token.text())))
                        .append('}').append(PARAGRAPH_END);
                case PARAGRAPH -> body.append(renderLines(token.lines(), inline, renderer)).append(PARAGRAPH_END);
                case QUOTE -> body.append("\\li").append(QUOTE_INDENT).append(' ')
                        .append(renderLines(token.lines(), inline, renderer)).append(PARAGRAPH_END)
                        .append(emitter.emitParagraphReset(properties));
                case CODE -> {
                    String codeWord = properties.styles().controlWord(StyleTable.CODE);
                    body.append('{').append(codeWord.isEmpty() ? "" : codeWord + " ")
                            .append(token.lines().stream().map(ControlWordEscaper::escape)
                                    .collect(Collectors.joining(LINE_JOIN)))
                            .append('}').append(PARAGRAPH_END);
                }
                case BLANK -> {
                    // every block already ends with a paragraph break
                }
                default -> throw new IllegalStateException("Unexpected block " + token.type());
            }
        }
        body.append(lists.exit());
        return ParagraphBreaks.normalize(body.toString());
    }

    /**
     * Produces markup-tree elements; list items of one kind are merged into a single list element,
     * nested items carry an indent class.
     */
    public String toMarkupTree(String markdown, DocumentProperties properties) {
        InlineSpanProcessor inline = new InlineSpanProcessor(properties.legacyUnderscoreUnderline());
        InlineRenderer renderer = new MarkupInlineRenderer();
        StringBuilder out = new StringBuilder();

        for (BlockToken token : tokenizer.tokenize(markdown)) {
            switch (token.type()) {
                case HEADING -> out.append("<h").append(token.level()).append('>')
                        .append(renderer.render(inline.parse(token.text())))
                        .append("</h").append(token.level()).append(">\n");
                case PARAGRAPH -> out.append("<p>").append(renderMarkupLines(token.lines(), inline, renderer)).append("</p>\n");
                case QUOTE -> out.append("<blockquote>").append(renderMarkupLines(token.lines(), inline, renderer))
                        .append("</blockquote>\n");
                case CODE -> out.append("<pre><code>")
                        .append(token.lines().stream().map(HtmlText::escape).collect(Collectors.joining("\n")))
                        .append("</code></pre>\n");
                case LIST_ITEM -> {
                    var line = token.listLine().orElseThrow();
                    out.append("<li data-list=\"").append(line.kind().name().toLowerCase(Locale.ROOT)).append('"');
                    if (line.level() > 0) {
                        out.append(" class=\"ql-indent-").append(line.level()).append('"');
                    }
                    out.append('>').append(renderer.render(inline.parse(line.content()))).append("</li>\n");
                }
                case BLANK -> {
                    // blank runs only separate blocks
                }
                default -> throw new IllegalStateException("Unexpected block " + token.type());
            }
        }
        return mergeListRuns(mergeListRuns(out.toString(), BULLET_RUN, "ul", "bullet"), ORDERED_RUN, "ol", "ordered");
    }

    /**
     * Font size in half-points for a heading level; levels outside 1 to 6 are clamped.
     */
    public static int headingSize(int level) {
        int clamped = Math.max(1, Math.min(HEADING_SIZES.length, level));
        return HEADING_SIZES[clamped - 1];
    }

    private static String renderLines(List<String> lines, InlineSpanProcessor inline, InlineRenderer renderer) {
        return lines.stream()
                .map(line -> renderer.render(inline.parse(line)))
                .collect(Collectors.joining(LINE_JOIN));
    }

    private static String renderMarkupLines(List<String> lines, InlineSpanProcessor inline, InlineRenderer renderer) {
        return lines.stream()
                .map(line -> renderer.render(inline.parse(line)))
                .collect(Collectors.joining("<br>"));
    }

    private static String mergeListRuns(String markup, Pattern run, String listTag, String kind) {
        Matcher matcher = run.matcher(markup);
        StringBuilder merged = new StringBuilder(markup.length() + 32);
        while (matcher.find()) {
            String items = matcher.group().replace(" data-list=\"" + kind + "\"", "");
            matcher.appendReplacement(merged, Matcher.quoteReplacement("<" + listTag + ">\n" + items + "</" + listTag + ">\n"));
        }
        matcher.appendTail(merged);
        return merged.toString();
    }
}
