package ai.docsite.richtext.markdown;

/**
 * Block-level classification of lightweight-markup lines.
 */
public enum BlockType {
    HEADING,
    LIST_ITEM,
    QUOTE,
    CODE,
    PARAGRAPH,
    BLANK
}
