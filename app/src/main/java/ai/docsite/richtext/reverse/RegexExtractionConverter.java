package ai.docsite.richtext.reverse;

import ai.docsite.richtext.detect.FormatKind;
import ai.docsite.richtext.html.HtmlText;
import ai.docsite.richtext.markdown.SpanStyle;
import ai.docsite.richtext.rtf.ListKind;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process reverse converter. Extracts the text of control-word documents and renders it as plain
 * text, lightweight markup or markup-tree elements; strips markup-tree and lightweight-markup
 * documents down to plain text.
 */
public class RegexExtractionConverter implements ExternalConverter {

    private static final Logger LOGGER = LoggerFactory.getLogger(RegexExtractionConverter.class);

    private static final int[] HEADING_SIZES = {48, 40, 32, 28, 26, 24};
    private static final String DROPPED_ELEMENTS = "head, style, script, noscript, template";
    private static final Set<String> BLOCK_ELEMENTS = Set.of(
            "p", "div", "h1", "h2", "h3", "h4", "h5", "h6", "li", "tr", "blockquote", "pre");
    private static final Pattern EXTRA_BLANK_LINES = Pattern.compile("\\n{3,}");
    private static final Pattern MD_HEADING = Pattern.compile("(?m)^ {0,3}#{1,6}[ \\t]+");
    private static final Pattern MD_QUOTE = Pattern.compile("(?m)^ {0,3}>[ \\t]?");
    private static final Pattern MD_FENCE = Pattern.compile("(?m)^ {0,3}(`{3,}|~{3,}).*\\n?");
    private static final Pattern MD_IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern MD_LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]*\\)");
    private static final Pattern MD_EMPHASIS = Pattern.compile("(\\*\\*|__|~~)(\\S(?:.*?\\S)?)\\1|(?<![*\\w])\\*(?!\\*)(\\S(?:[^*]*?\\S)?)\\*(?![*\\w])");
    private static final Pattern MD_CODE = Pattern.compile("`([^`]+)`");

    @Override
    public String convert(FormatKind from, FormatKind to, String content) {
        String text = content == null ? "" : content;
        if (from == FormatKind.RICH_CONTROL_WORD) {
            List<ExtractedParagraph> paragraphs;
            try {
                paragraphs = ControlWordReader.read(text);
            } catch (RuntimeException ex) {
                throw new ExternalConversionException("Could not read control words: " + ex.getMessage(), ex);
            }
            LOGGER.debug("Extracted {} paragraphs from control words", paragraphs.size());
            return switch (to) {
                case PLAIN_TEXT -> renderLines(paragraphs, false);
                case LIGHTWEIGHT_MARKUP -> renderLines(paragraphs, true);
                case MARKUP_TREE -> renderMarkup(paragraphs);
                default -> throw unsupported(from, to);
            };
        }
        if (from == FormatKind.MARKUP_TREE && to == FormatKind.PLAIN_TEXT) {
            return stripMarkup(text);
        }
        if (from == FormatKind.LIGHTWEIGHT_MARKUP && to == FormatKind.PLAIN_TEXT) {
            return stripLightweightMarkup(text);
        }
        throw unsupported(from, to);
    }

    private static ExternalConversionException unsupported(FormatKind from, FormatKind to) {
        return new ExternalConversionException("No native conversion from " + from + " to " + to);
    }

    /**
     * One line per paragraph. Lightweight markup separates blocks with a blank line, keeps list items
     * on consecutive lines and drops empty paragraphs.
     */
    private static String renderLines(List<ExtractedParagraph> paragraphs, boolean markdown) {
        StringBuilder out = new StringBuilder();
        List<Integer> counters = new ArrayList<>();
        ExtractedParagraph previous = null;
        for (ExtractedParagraph paragraph : paragraphs) {
            boolean listItem = paragraph.listKind().isPresent();
            if (!listItem) {
                counters.clear();
                if (markdown && paragraph.isBlank()) {
                    continue;
                }
            }
            if (markdown && previous != null && !(listItem && previous.listKind().isPresent())) {
                out.append('\n');
            }
            previous = paragraph;
            if (listItem) {
                int level = paragraph.listLevel();
                out.append("  ".repeat(level)).append(listMarker(paragraph.listKind().get(), level, counters)).append(' ');
                out.append(markdown ? markdownRuns(paragraph) : paragraph.plainText().strip()).append('\n');
                continue;
            }
            int heading = headingLevel(paragraph.fontSize());
            if (markdown && heading > 0) {
                out.append("#".repeat(heading)).append(' ');
            }
            out.append(markdown ? markdownRuns(paragraph) : paragraph.plainText()).append('\n');
        }
        return out.toString();
    }

    private static String renderMarkup(List<ExtractedParagraph> paragraphs) {
        StringBuilder out = new StringBuilder();
        ListKind openList = null;
        for (ExtractedParagraph paragraph : paragraphs) {
            ListKind kind = paragraph.listKind().orElse(null);
            if (openList != null && kind != openList) {
                out.append(openList == ListKind.ORDERED ? "</ol>\n" : "</ul>\n");
                openList = null;
            }
            if (kind != null) {
                if (openList == null) {
                    out.append(kind == ListKind.ORDERED ? "<ol>\n" : "<ul>\n");
                    openList = kind;
                }
                out.append("<li");
                if (paragraph.listLevel() > 0) {
                    out.append(" class=\"ql-indent-").append(paragraph.listLevel()).append('"');
                }
                out.append('>').append(markupRuns(paragraph).strip()).append("</li>\n");
                continue;
            }
            if (paragraph.isBlank()) {
                continue;
            }
            int heading = headingLevel(paragraph.fontSize());
            String tag = heading > 0 ? "h" + heading : "p";
            out.append('<').append(tag).append('>').append(markupRuns(paragraph)).append("</").append(tag).append(">\n");
        }
        if (openList != null) {
            out.append(openList == ListKind.ORDERED ? "</ol>\n" : "</ul>\n");
        }
        return out.toString();
    }

    private static String markdownRuns(ExtractedParagraph paragraph) {
        StringBuilder out = new StringBuilder();
        List<ExtractedParagraph.Run> runs = paragraph.runs();
        for (int i = 0; i < runs.size(); i++) {
            ExtractedParagraph.Run run = runs.get(i);
            if (!run.href().isEmpty()) {
                StringBuilder label = new StringBuilder(run.text());
                while (i + 1 < runs.size() && runs.get(i + 1).href().equals(run.href())) {
                    label.append(runs.get(++i).text());
                }
                out.append('[').append(label).append("](").append(run.href()).append(')');
                continue;
            }
            String marker = (run.styles().contains(SpanStyle.BOLD) ? "**" : "")
                    + (run.styles().contains(SpanStyle.ITALIC) ? "*" : "")
                    + (run.styles().contains(SpanStyle.STRIKE) ? "~~" : "");
            out.append(wrap(run.text(), marker, new StringBuilder(marker).reverse().toString()));
        }
        return out.toString();
    }

    private static String markupRuns(ExtractedParagraph paragraph) {
        StringBuilder out = new StringBuilder();
        List<ExtractedParagraph.Run> runs = paragraph.runs();
        for (int i = 0; i < runs.size(); i++) {
            ExtractedParagraph.Run run = runs.get(i);
            if (!run.href().isEmpty()) {
                StringBuilder label = new StringBuilder(run.text());
                while (i + 1 < runs.size() && runs.get(i + 1).href().equals(run.href())) {
                    label.append(runs.get(++i).text());
                }
                out.append("<a href=\"").append(HtmlText.escape(run.href())).append("\">")
                        .append(HtmlText.escape(label.toString())).append("</a>");
                continue;
            }
            StringBuilder open = new StringBuilder();
            StringBuilder close = new StringBuilder();
            for (SpanStyle style : SpanStyle.values()) {
                if (run.styles().contains(style)) {
                    String tag = switch (style) {
                        case BOLD -> "strong";
                        case ITALIC -> "em";
                        case UNDERLINE -> "u";
                        case STRIKE -> "s";
                    };
                    open.append('<').append(tag).append('>');
                    close.insert(0, "</" + tag + ">");
                }
            }
            String escaped = HtmlText.escape(run.text()).replace("\n", "<br>");
            out.append(wrap(escaped, open.toString(), close.toString()));
        }
        return out.toString();
    }

    /**
     * Wraps the non-blank core of a run so that markers never sit next to whitespace.
     */
    private static String wrap(String text, String open, String close) {
        if (open.isEmpty() || text.isBlank()) {
            return text;
        }
        String core = text.strip();
        int start = text.indexOf(core);
        return text.substring(0, start) + open + core + close + text.substring(start + core.length());
    }

    private static String listMarker(ListKind kind, int level, List<Integer> counters) {
        if (kind == ListKind.BULLET) {
            return "-";
        }
        while (counters.size() > level + 1) {
            counters.remove(counters.size() - 1);
        }
        while (counters.size() < level + 1) {
            counters.add(0);
        }
        counters.set(level, counters.get(level) + 1);
        return counters.get(level) + ".";
    }

    static int headingLevel(int fontSize) {
        for (int i = 0; i < HEADING_SIZES.length; i++) {
            if (HEADING_SIZES[i] == fontSize) {
                return i + 1;
            }
        }
        return 0;
    }

    static String stripMarkup(String html) {
        Document document = Jsoup.parse(html.replace("\r\n", "\n"));
        document.select(DROPPED_ELEMENTS).remove();
        TextCollector collector = new TextCollector();
        NodeTraversor.traverse(collector, document.body());
        return EXTRA_BLANK_LINES.matcher(collector.text().strip()).replaceAll("\n\n") + "\n";
    }

    /**
     * Collects decoded text, breaking lines at {@code br} and after block elements.
     */
    private static final class TextCollector implements NodeVisitor {

        private final StringBuilder out = new StringBuilder();

        @Override
        public void head(Node node, int depth) {
            if (node instanceof TextNode textNode) {
                out.append(textNode.getWholeText());
            } else if (node instanceof Element element && element.normalName().equals("br")) {
                out.append('\n');
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (node instanceof Element element && BLOCK_ELEMENTS.contains(element.normalName())) {
                out.append('\n');
            }
        }

        String text() {
            return out.toString();
        }
    }

    static String stripLightweightMarkup(String markdown) {
        String text = markdown.replace("\r\n", "\n");
        text = MD_FENCE.matcher(text).replaceAll("");
        text = MD_HEADING.matcher(text).replaceAll("");
        text = MD_QUOTE.matcher(text).replaceAll("");
        text = MD_IMAGE.matcher(text).replaceAll("$1");
        text = MD_LINK.matcher(text).replaceAll("$1");
        text = MD_CODE.matcher(text).replaceAll("$1");
        String previous;
        do {
            previous = text;
            text = MD_EMPHASIS.matcher(text).replaceAll(match -> Matcher.quoteReplacement(
                    match.group(2) != null ? match.group(2) : match.group(3)));
        } while (!text.equals(previous));
        return text;
    }
}
