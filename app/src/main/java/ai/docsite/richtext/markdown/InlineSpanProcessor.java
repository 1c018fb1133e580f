package ai.docsite.richtext.markdown;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Scans one line of lightweight markup into typed inline spans.
 *
 * <p>At every position a double delimiter is tried before a single one, so {@code **x**} is bold
 * and never two italics. A single {@code *} or {@code _} only opens or closes emphasis when it is
 * not adjacent to a second copy of itself. Underscore delimiters do not act inside words. Code span
 * content and link labels are taken literally. Delimiters without a partner stay in the text.
 */
public class InlineSpanProcessor {

    private static final String ESCAPABLE = "\\`*_~[]()#!";

    private final boolean legacyUnderscoreUnderline;

    public InlineSpanProcessor() {
        this(false);
    }

    /**
     * @param legacyUnderscoreUnderline read {@code __x__} as underline instead of bold
     */
    public InlineSpanProcessor(boolean legacyUnderscoreUnderline) {
        this.legacyUnderscoreUnderline = legacyUnderscoreUnderline;
    }

    public List<InlineSpan> parse(String line) {
        List<InlineSpan> spans = new ArrayList<>();
        if (line == null || line.isEmpty()) {
            return spans;
        }
        scan(line, EnumSet.noneOf(SpanStyle.class), spans);
        return merge(spans);
    }

    private void scan(String text, EnumSet<SpanStyle> styles, List<InlineSpan> out) {
        StringBuilder literal = new StringBuilder();
        int i = 0;
        while (i < text.length()) {
            char ch = text.charAt(i);
            if (ch == '\\' && i + 1 < text.length() && ESCAPABLE.indexOf(text.charAt(i + 1)) >= 0) {
                literal.append(text.charAt(i + 1));
                i += 2;
                continue;
            }
            if (ch == '`') {
                int close = text.indexOf('`', i + 1);
                if (close > i + 1) {
                    flush(literal, styles, out);
                    out.add(new InlineSpan(InlineSpan.Kind.CODE, text.substring(i + 1, close), styles, ""));
                    i = close + 1;
                    continue;
                }
            }
            if (ch == '!' && i + 1 < text.length() && text.charAt(i + 1) == '[') {
                Reference image = reference(text, i + 1);
                if (image != null) {
                    flush(literal, styles, out);
                    out.add(new InlineSpan(InlineSpan.Kind.IMAGE, image.label(), styles, image.target()));
                    i = image.end();
                    continue;
                }
            }
            if (ch == '[') {
                Reference link = reference(text, i);
                if (link != null && !link.label().isEmpty()) {
                    flush(literal, styles, out);
                    out.add(new InlineSpan(InlineSpan.Kind.LINK, link.label(), styles, link.target()));
                    i = link.end();
                    continue;
                }
            }
            if (ch == '*' || ch == '_' || ch == '~') {
                Delimited delimited = delimited(text, i);
                if (delimited != null) {
                    flush(literal, styles, out);
                    EnumSet<SpanStyle> inner = EnumSet.copyOf(styles);
                    inner.add(delimited.style());
                    scan(delimited.content(), inner, out);
                    i = delimited.end();
                    continue;
                }
                int run = runLength(text, i, ch);
                literal.append(text, i, i + run);
                i += run;
                continue;
            }
            literal.append(ch);
            i++;
        }
        flush(literal, styles, out);
    }

    private Delimited delimited(String text, int start) {
        char ch = text.charAt(start);
        int run = runLength(text, start, ch);
        if (ch == '_' && start > 0 && Character.isLetterOrDigit(text.charAt(start - 1))) {
            return null;
        }
        if (run >= 2) {
            SpanStyle style = switch (ch) {
                case '*' -> SpanStyle.BOLD;
                case '_' -> legacyUnderscoreUnderline ? SpanStyle.UNDERLINE : SpanStyle.BOLD;
                default -> SpanStyle.STRIKE;
            };
            for (int k = start + 2; k + 1 < text.length(); k++) {
                if (text.charAt(k) == ch && text.charAt(k + 1) == ch
                        && (k + 2 >= text.length() || text.charAt(k + 2) != ch)
                        && closes(text, start + 2, k, k + 2, ch)) {
                    return new Delimited(style, text.substring(start + 2, k), k + 2);
                }
            }
            return null;
        }
        SpanStyle style = ch == '~' ? SpanStyle.UNDERLINE : SpanStyle.ITALIC;
        for (int k = start + 1; k < text.length(); k++) {
            if (text.charAt(k) == ch && text.charAt(k - 1) != ch
                    && (k + 1 >= text.length() || text.charAt(k + 1) != ch)
                    && closes(text, start + 1, k, k + 1, ch)) {
                return new Delimited(style, text.substring(start + 1, k), k + 1);
            }
        }
        return null;
    }

    private static boolean closes(String text, int contentStart, int contentEnd, int after, char ch) {
        if (contentEnd <= contentStart) {
            return false;
        }
        if (Character.isWhitespace(text.charAt(contentStart)) || Character.isWhitespace(text.charAt(contentEnd - 1))) {
            return false;
        }
        return ch != '_' || after >= text.length() || !Character.isLetterOrDigit(text.charAt(after));
    }

    private static Reference reference(String text, int open) {
        int labelEnd = text.indexOf(']', open + 1);
        if (labelEnd < 0 || labelEnd + 1 >= text.length() || text.charAt(labelEnd + 1) != '(') {
            return null;
        }
        int targetEnd = text.indexOf(')', labelEnd + 2);
        if (targetEnd < 0) {
            return null;
        }
        String target = text.substring(labelEnd + 2, targetEnd).trim();
        int space = target.indexOf(' ');
        if (space > 0) {
            target = target.substring(0, space);
        }
        if (target.isEmpty()) {
            return null;
        }
        return new Reference(text.substring(open + 1, labelEnd), target, targetEnd + 1);
    }

    private static int runLength(String text, int start, char ch) {
        int end = start;
        while (end < text.length() && text.charAt(end) == ch) {
            end++;
        }
        return end - start;
    }

    private static void flush(StringBuilder literal, Set<SpanStyle> styles, List<InlineSpan> out) {
        if (literal.length() > 0) {
            out.add(InlineSpan.text(literal.toString(), styles));
            literal.setLength(0);
        }
    }

    private static List<InlineSpan> merge(List<InlineSpan> spans) {
        List<InlineSpan> merged = new ArrayList<>(spans.size());
        for (InlineSpan span : spans) {
            int last = merged.size() - 1;
            if (last >= 0 && span.kind() == InlineSpan.Kind.TEXT
                    && merged.get(last).kind() == InlineSpan.Kind.TEXT
                    && merged.get(last).styles().equals(span.styles())) {
                merged.set(last, InlineSpan.text(merged.get(last).text() + span.text(), span.styles()));
            } else {
                merged.add(span);
            }
        }
        return merged;
    }

    private record Delimited(SpanStyle style, String content, int end) {
    }

    private record Reference(String label, String target, int end) {
    }
}
