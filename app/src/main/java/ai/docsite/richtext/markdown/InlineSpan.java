package ai.docsite.richtext.markdown;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * A typed inline token produced by {@link InlineSpanProcessor}.
 *
 * @param kind what the span represents
 * @param text literal text, link label or image alt text
 * @param styles character styles in effect for the span
 * @param target link or image destination; empty for text and code spans
 */
public record InlineSpan(Kind kind, String text, Set<SpanStyle> styles, String target) {

    public enum Kind {
        TEXT,
        CODE,
        LINK,
        IMAGE
    }

    public InlineSpan {
        Objects.requireNonNull(kind, "kind");
        text = text == null ? "" : text;
        styles = styles == null || styles.isEmpty()
                ? Set.of()
                : Set.copyOf(EnumSet.copyOf(styles));
        target = target == null ? "" : target;
    }

    public static InlineSpan text(String text, Set<SpanStyle> styles) {
        return new InlineSpan(Kind.TEXT, text, styles, "");
    }

    public boolean has(SpanStyle style) {
        return styles.contains(style);
    }

    /**
     * Styles in declaration order.
     */
    public EnumSet<SpanStyle> orderedStyles() {
        return styles.isEmpty() ? EnumSet.noneOf(SpanStyle.class) : EnumSet.copyOf(styles);
    }
}
