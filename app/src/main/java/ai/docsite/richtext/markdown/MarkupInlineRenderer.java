package ai.docsite.richtext.markdown;

import ai.docsite.richtext.html.HtmlText;
import java.util.List;

/**
 * Renders spans as markup-tree elements.
 */
public class MarkupInlineRenderer implements InlineRenderer {

    @Override
    public String render(List<InlineSpan> spans) {
        StringBuilder out = new StringBuilder();
        for (InlineSpan span : spans) {
            for (SpanStyle style : span.orderedStyles()) {
                out.append('<').append(tag(style)).append('>');
            }
            switch (span.kind()) {
                case TEXT -> out.append(HtmlText.escape(span.text()));
                case CODE -> out.append("<code>").append(HtmlText.escape(span.text())).append("</code>");
                case LINK -> out.append("<a href=\"").append(HtmlText.escape(span.target())).append("\">")
                        .append(HtmlText.escape(span.text())).append("</a>");
                case IMAGE -> out.append("<img src=\"").append(HtmlText.escape(span.target()))
                        .append("\" alt=\"").append(HtmlText.escape(span.text())).append("\">");
            }
            SpanStyle[] ordered = span.orderedStyles().toArray(new SpanStyle[0]);
            for (int i = ordered.length - 1; i >= 0; i--) {
                out.append("</").append(tag(ordered[i])).append('>');
            }
        }
        return out.toString();
    }

    private static String tag(SpanStyle style) {
        return switch (style) {
            case BOLD -> "strong";
            case ITALIC -> "em";
            case UNDERLINE -> "u";
            case STRIKE -> "s";
        };
    }
}
