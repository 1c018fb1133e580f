package ai.docsite.richtext.list;

import ai.docsite.richtext.rtf.ListKind;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A single list item line: its kind, nesting level and the item text after the marker.
 *
 * <p>The level is derived from indentation only, in units of two columns; a tab counts as
 * {@value #TAB_WIDTH} columns.
 */
public record ListLine(ListKind kind, int level, String content) {

    public static final int TAB_WIDTH = 4;
    static final int COLUMNS_PER_LEVEL = 2;

    private static final Pattern BULLET = Pattern.compile("^([ \\t]*)[-*+\u2022][ \\t]+(\\S.*)$");
    private static final Pattern ORDERED = Pattern.compile("^([ \\t]*)\\d{1,9}[.)][ \\t]+(\\S.*)$");

    public ListLine {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(content, "content");
        if (level < 0) {
            throw new IllegalArgumentException("level must not be negative");
        }
    }

    public static Optional<ListLine> parse(String line) {
        if (line == null || line.isBlank()) {
            return Optional.empty();
        }
        Matcher bullet = BULLET.matcher(line);
        if (bullet.matches()) {
            return Optional.of(new ListLine(ListKind.BULLET, levelOf(bullet.group(1)), bullet.group(2).stripTrailing()));
        }
        Matcher ordered = ORDERED.matcher(line);
        if (ordered.matches()) {
            return Optional.of(new ListLine(ListKind.ORDERED, levelOf(ordered.group(1)), ordered.group(2).stripTrailing()));
        }
        return Optional.empty();
    }

    static int levelOf(String indentation) {
        int columns = 0;
        for (int i = 0; i < indentation.length(); i++) {
            columns += indentation.charAt(i) == '\t' ? TAB_WIDTH : 1;
        }
        return columns / COLUMNS_PER_LEVEL;
    }
}
