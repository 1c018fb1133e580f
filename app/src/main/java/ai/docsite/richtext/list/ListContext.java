package ai.docsite.richtext.list;

import ai.docsite.richtext.rtf.ListKind;

/**
 * Current list run observed by a {@link ListStateTracker}; {@code kind} is null only while idle.
 */
public record ListContext(ListKind kind, int level, int listId, boolean active) {

    private static final ListContext IDLE = new ListContext(null, 0, 0, false);

    public ListContext {
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative");
        }
        if (active && kind == null) {
            throw new IllegalArgumentException("an active list needs a kind");
        }
    }

    public static ListContext idle() {
        return IDLE;
    }

    public static ListContext of(ListKind kind, int level) {
        return new ListContext(kind, level, kind.listId(), true);
    }
}
