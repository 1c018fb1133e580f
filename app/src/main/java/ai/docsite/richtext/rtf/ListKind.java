package ai.docsite.richtext.rtf;

/**
 * List flavours with their control-word template and list identifiers.
 *
 * <p>Bullet and ordered lists never share an identifier, so their table definitions cannot collide.
 */
public enum ListKind {
    BULLET(1, 1),
    ORDERED(2, 2);

    private final int templateId;
    private final int listId;

    ListKind(int templateId, int listId) {
        this.templateId = templateId;
        this.listId = listId;
    }

    public int templateId() {
        return templateId;
    }

    public int listId() {
        return listId;
    }

    /**
     * Index used by {@code \ls} to bind a paragraph to the override entry of this kind.
     */
    public int overrideIndex() {
        return listId;
    }
}
