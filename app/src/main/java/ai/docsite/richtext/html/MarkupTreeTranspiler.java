package ai.docsite.richtext.html;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.config.StyleTable;
import ai.docsite.richtext.list.ListStateTracker;
import ai.docsite.richtext.rtf.ControlWordEmitter;
import ai.docsite.richtext.rtf.ControlWordEscaper;
import ai.docsite.richtext.rtf.ListKind;
import ai.docsite.richtext.rtf.ParagraphBreaks;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

/**
 * Converts the supported markup-tree subset into a control-word document.
 *
 * <p>Handles paragraphs and divisions, headings, character styles, code, preformatted blocks,
 * links, quotes and lists including the flat indent-class lists written by the editor. The input is
 * parsed with jsoup, which decodes entities and closes unclosed elements. Unknown elements are dropped
 * and their text kept; head, style and script content is removed.
 */
public class MarkupTreeTranspiler {

    private static final String DROPPED_ELEMENTS = "head, style, script, noscript, template";
    private static final Pattern TEXT_ALIGN = Pattern.compile("(?i)text-align\\s*:\\s*(left|center|right|justify)");
    private static final Pattern QUILL_ALIGN = Pattern.compile("\\bql-align-(left|center|right|justify)\\b");
    private static final Pattern QUILL_INDENT = Pattern.compile("\\bql-indent-(\\d{1,2})\\b");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final int QUOTE_INDENT = 720;
    private static final int MAX_LIST_LEVEL = 8;

    private final ControlWordEmitter emitter;

    public MarkupTreeTranspiler() {
        this(new ControlWordEmitter());
    }

    public MarkupTreeTranspiler(ControlWordEmitter emitter) {
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    public String toRichControlWord(String html, DocumentProperties properties) {
        Objects.requireNonNull(properties, "properties");
        return emitter.emitDocument(properties, toRichControlWordBody(html, properties));
    }

    String toRichControlWordBody(String html, DocumentProperties properties) {
        if (html == null || html.isBlank()) {
            return "";
        }
        Document document = Jsoup.parse(html.replace("\r\n", "\n").replace('\r', '\n'));
        document.select(DROPPED_ELEMENTS).remove();
        Conversion conversion = new Conversion(properties);
        NodeTraversor.traverse(conversion, document.body());
        return ParagraphBreaks.normalize(conversion.finish());
    }

    static Optional<String> alignment(Element element) {
        Matcher style = TEXT_ALIGN.matcher(element.attr("style"));
        if (style.find()) {
            return Optional.of(style.group(1).toLowerCase(Locale.ROOT));
        }
        String align = element.attr("align").trim().toLowerCase(Locale.ROOT);
        if (!align.isEmpty()) {
            return Optional.of(align);
        }
        Matcher quill = QUILL_ALIGN.matcher(element.className());
        return quill.find() ? Optional.of(quill.group(1)) : Optional.empty();
    }

    static int indentLevel(Element element, int fallback) {
        Matcher indent = QUILL_INDENT.matcher(element.className());
        return Math.min(MAX_LIST_LEVEL, indent.find() ? Integer.parseInt(indent.group(1)) : fallback);
    }

    /**
     * State of one conversion call.
     */
    private final class Conversion implements NodeVisitor {

        private final DocumentProperties properties;
        private final StyleTable styles;
        private final ListStateTracker lists;
        private final StringBuilder out = new StringBuilder();
        private final Deque<ListKind> listStack = new ArrayDeque<>();
        private final Deque<String> groups = new ArrayDeque<>();
        private final Map<String, Integer> styleDepth = new HashMap<>();
        private StringBuilder item;
        private ListKind itemKind;
        private int itemLevel;
        private boolean pendingContent;
        private boolean alignedParagraph;
        private int preformatted;

        private Conversion(DocumentProperties properties) {
            this.properties = properties;
            this.styles = properties.styles();
            this.lists = new ListStateTracker(emitter, properties);
        }

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                text(textNode.getWholeText());
            } else if (node instanceof Element element) {
                open(element.normalName(), element);
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (node instanceof Element element) {
                close(element.normalName());
            }
        }

        private StringBuilder sink() {
            return item != null ? item : out;
        }

        void text(String decoded) {
            if (decoded.isEmpty()) {
                return;
            }
            if (preformatted > 0) {
                startContent();
                sink().append(ControlWordEscaper.escape(decoded));
                return;
            }
            if (decoded.isBlank() && (decoded.indexOf('\n') >= 0 || !pendingContent && item == null)) {
                return;
            }
            String collapsed = WHITESPACE.matcher(decoded).replaceAll(" ");
            if (item != null ? item.length() == 0 : !pendingContent) {
                collapsed = collapsed.stripLeading();
            }
            startContent();
            sink().append(ControlWordEscaper.escape(collapsed));
        }

        void open(String name, Element element) {
            switch (name) {
                case "br" -> {
                    startContent();
                    sink().append(ControlWordEmitter.LINE_BREAK).append(' ');
                }
                case "p", "div", "h3", "h4", "h5", "h6" -> startBlock(element);
                case "h1", "h2" -> {
                    startBlock(element);
                    int size = name.equals("h1")
                            ? DocumentProperties.halfPoints(properties.fontSize() * 2)
                            : properties.fontSize() * 3;
                    openGroup(name, "{\\fs" + size + styles.controlWord(StyleTable.BOLD) + " ");
                }
                case "strong", "b" -> toggleOn(StyleTable.BOLD);
                case "em", "i" -> toggleOn(StyleTable.ITALIC);
                case "u", "ins" -> toggleOn(StyleTable.UNDERLINE);
                case "s", "strike", "del" -> toggleOn(StyleTable.STRIKE);
                case "code" -> {
                    startContent();
                    openGroup(name, "{" + word(StyleTable.CODE));
                }
                case "pre" -> {
                    startBlock(element);
                    preformatted++;
                    openGroup(name, "{" + word(StyleTable.CODE));
                }
                case "a" -> {
                    startContent();
                    String href = element.attr("href").replace("\"", "");
                    openGroup(name, "{\\field{\\*\\fldinst{HYPERLINK \"" + ControlWordEscaper.escape(href)
                            + "\"}}{\\fldrslt{" + word(StyleTable.UNDERLINE));
                }
                case "img" -> {
                    String alt = element.attr("alt");
                    if (!alt.isEmpty()) {
                        startContent();
                        sink().append(ControlWordEscaper.escape(alt));
                    }
                }
                case "blockquote" -> {
                    startBlock(element);
                    out.append("\\li").append(QUOTE_INDENT).append(' ');
                    alignedParagraph = true;
                }
                case "hr" -> {
                    endParagraph();
                    out.append(ControlWordEmitter.PARAGRAPH_BREAK).append('\n');
                }
                case "ul" -> {
                    flushItem();
                    listStack.push(ListKind.BULLET);
                }
                case "ol" -> {
                    flushItem();
                    listStack.push(ListKind.ORDERED);
                }
                case "li" -> startItem(element);
                default -> {
                    // unsupported element, text is kept
                }
            }
        }

        void close(String name) {
            switch (name) {
                case "p", "div", "h3", "h4", "h5", "h6", "blockquote" -> {
                    if (item == null && (name.equals("p") || pendingContent)) {
                        endParagraph();
                    }
                }
                case "h1", "h2" -> {
                    closeGroup(name);
                    endParagraph();
                }
                case "strong", "b" -> toggleOff(StyleTable.BOLD, StyleTable.BOLD_OFF);
                case "em", "i" -> toggleOff(StyleTable.ITALIC, StyleTable.ITALIC_OFF);
                case "u", "ins" -> toggleOff(StyleTable.UNDERLINE, StyleTable.UNDERLINE_OFF);
                case "s", "strike", "del" -> toggleOff(StyleTable.STRIKE, StyleTable.STRIKE_OFF);
                case "code", "a" -> closeGroup(name);
                case "pre" -> {
                    closeGroup(name);
                    preformatted = Math.max(0, preformatted - 1);
                    endParagraph();
                }
                case "li" -> flushItem();
                case "ul", "ol" -> {
                    flushItem();
                    if (!listStack.isEmpty()) {
                        listStack.pop();
                    }
                    if (listStack.isEmpty()) {
                        out.append(lists.exit());
                    }
                }
                case "td", "th" -> sink().append("\\tab ");
                case "tr" -> endParagraph();
                default -> {
                    // unsupported element
                }
            }
        }

        String finish() {
            flushItem();
            while (!groups.isEmpty()) {
                closeGroup(groups.peek());
            }
            if (pendingContent) {
                endParagraph();
            }
            out.append(lists.exit());
            return out.toString();
        }

        private void startBlock(Element element) {
            if (item != null) {
                return;
            }
            if (listStack.isEmpty()) {
                out.append(lists.exit());
            }
            if (pendingContent) {
                endParagraph();
            }
            Optional<String> align = alignment(element);
            if (align.isPresent() && !align.get().equals("left")) {
                out.append(styles.alignment(align.get())).append(' ');
                alignedParagraph = true;
            }
        }

        private void startContent() {
            if (item == null && !pendingContent && listStack.isEmpty()) {
                out.append(lists.exit());
            }
            pendingContent = true;
        }

        private void endParagraph() {
            if (item != null) {
                return;
            }
            out.append(ControlWordEmitter.PARAGRAPH_BREAK).append('\n');
            if (alignedParagraph) {
                out.append(emitter.emitParagraphReset(properties));
                alignedParagraph = false;
            }
            pendingContent = false;
        }

        private void startItem(Element element) {
            flushItem();
            if (pendingContent) {
                endParagraph();
            }
            String dataList = element.attr("data-list");
            if (dataList.equals("ordered")) {
                itemKind = ListKind.ORDERED;
            } else if (!dataList.isEmpty()) {
                itemKind = ListKind.BULLET;
            } else {
                itemKind = listStack.isEmpty() ? ListKind.BULLET : listStack.peek();
            }
            itemLevel = indentLevel(element, Math.max(0, listStack.size() - 1));
            item = new StringBuilder();
        }

        private void flushItem() {
            if (item == null) {
                return;
            }
            String body = item.toString().strip();
            item = null;
            out.append(lists.item(itemKind, itemLevel, body));
            pendingContent = false;
        }

        private void openGroup(String name, String opening) {
            sink().append(opening);
            groups.push(name);
        }

        private void closeGroup(String name) {
            if (!groups.contains(name)) {
                return;
            }
            while (!groups.isEmpty()) {
                String open = groups.pop();
                sink().append(open.equals("a") ? "}}}" : "}");
                if (open.equals(name)) {
                    return;
                }
            }
        }

        private void toggleOn(String style) {
            startContent();
            int depth = styleDepth.merge(style, 1, Integer::sum);
            String word = styles.controlWord(style);
            if (depth == 1 && !word.isEmpty()) {
                sink().append(word).append(' ');
            }
        }

        private void toggleOff(String style, String offStyle) {
            Integer depth = styleDepth.get(style);
            if (depth == null || depth == 0) {
                return;
            }
            styleDepth.put(style, depth - 1);
            String word = styles.controlWord(offStyle);
            if (depth == 1 && !word.isEmpty()) {
                sink().append(word).append(' ');
            }
        }

        private String word(String style) {
            String word = styles.controlWord(style);
            return word.isEmpty() ? "" : word + " ";
        }
    }
}
