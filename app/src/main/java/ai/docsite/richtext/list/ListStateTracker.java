package ai.docsite.richtext.list;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.rtf.ControlWordEmitter;
import ai.docsite.richtext.rtf.ListKind;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Tracks list state across consecutive lines of one document and emits the list control words.
 *
 * <p>States are idle, in a bullet run and in an ordered run. Entering a run emits the list table and
 * override definitions for its kind once; a later item of another kind at a nested level defines that
 * kind within the same run, a kind change at the top level closes the run and starts a new one.
 * Leaving the run emits the paragraph reset that closes the list. A tracker belongs to a single
 * conversion and is not thread-safe.
 */
public final class ListStateTracker {

    private final ControlWordEmitter emitter;
    private final DocumentProperties properties;
    private final Set<ListKind> definedInRun = EnumSet.noneOf(ListKind.class);
    private final List<Integer> counters = new ArrayList<>();
    private ListContext context = ListContext.idle();
    private ListKind runKind;
    private int tableDefinitions;

    public ListStateTracker(ControlWordEmitter emitter, DocumentProperties properties) {
        this.emitter = Objects.requireNonNull(emitter, "emitter");
        this.properties = Objects.requireNonNull(properties, "properties");
    }

    public String item(ListLine line, String renderedBody) {
        return item(line.kind(), line.level(), renderedBody);
    }

    /**
     * Emits one list item whose body is already rendered as control words.
     */
    public String item(ListKind kind, int level, String renderedBody) {
        Objects.requireNonNull(kind, "kind");
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative");
        }
        StringBuilder out = new StringBuilder();
        if (context.active() && runKind != kind && level == 0) {
            out.append(exit());
        }
        if (!context.active() || level == 0) {
            runKind = kind;
        }
        if (!definedInRun.contains(kind)) {
            out.append(emitter.emitListTable(kind)).append(emitter.emitListOverride(kind));
            definedInRun.add(kind);
            tableDefinitions++;
        }
        context = ListContext.of(kind, level);

        out.append("{\\listtext ").append(marker(kind, level)).append("\\tab}")
                .append("\\ls").append(kind.overrideIndex())
                .append("\\ilvl").append(level)
                .append(level == 0 ? "\\fi-360\\li720" : "\\fi-360\\li" + emitter.leftIndent(level))
                .append(' ')
                .append(renderedBody == null ? "" : renderedBody)
                .append(ControlWordEmitter.PARAGRAPH_BREAK)
                .append('\n');
        return out.toString();
    }

    /**
     * Leaves the current run; returns the list-close marker, or nothing when no list is open.
     */
    public String exit() {
        if (!context.active()) {
            return "";
        }
        context = ListContext.idle();
        runKind = null;
        definedInRun.clear();
        counters.clear();
        return emitter.emitParagraphReset(properties);
    }

    public ListContext context() {
        return context;
    }

    public boolean isActive() {
        return context.active();
    }

    /**
     * Number of list table definitions emitted so far by this tracker.
     */
    public int tableDefinitions() {
        return tableDefinitions;
    }

    private String marker(ListKind kind, int level) {
        if (kind == ListKind.BULLET) {
            return emitter.bulletGlyph(level);
        }
        while (counters.size() > level + 1) {
            counters.remove(counters.size() - 1);
        }
        while (counters.size() < level + 1) {
            counters.add(0);
        }
        int next = counters.get(level) + 1;
        counters.set(level, next);
        return next + ".";
    }
}
