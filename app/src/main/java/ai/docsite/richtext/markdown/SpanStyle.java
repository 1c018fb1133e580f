package ai.docsite.richtext.markdown;

/**
 * Character styles an inline span can carry. Declaration order is the nesting order used by renderers.
 */
public enum SpanStyle {
    BOLD,
    ITALIC,
    UNDERLINE,
    STRIKE
}
