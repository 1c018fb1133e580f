package ai.docsite.richtext.markdown;

import ai.docsite.richtext.list.ListLine;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * One block of a lightweight-markup document.
 *
 * @param type block classification
 * @param level heading level for headings, nesting level for list items, otherwise zero
 * @param lines text lines of the block with their block markers removed
 * @param listLine the parsed list line for list items
 * @param startLine zero-based index of the first source line
 */
public record BlockToken(BlockType type, int level, List<String> lines, Optional<ListLine> listLine, int startLine) {

    public BlockToken {
        Objects.requireNonNull(type, "type");
        lines = List.copyOf(Objects.requireNonNull(lines, "lines"));
        listLine = listLine == null ? Optional.empty() : listLine;
        if (level < 0 || startLine < 0) {
            throw new IllegalArgumentException("Invalid block token position");
        }
        if (type == BlockType.LIST_ITEM && listLine.isEmpty()) {
            throw new IllegalArgumentException("list items need a parsed list line");
        }
    }

    static BlockToken heading(int level, String text, int startLine) {
        return new BlockToken(BlockType.HEADING, level, List.of(text), Optional.empty(), startLine);
    }

    static BlockToken listItem(ListLine line, int startLine) {
        return new BlockToken(BlockType.LIST_ITEM, line.level(), List.of(line.content()), Optional.of(line), startLine);
    }

    static BlockToken of(BlockType type, List<String> lines, int startLine) {
        return new BlockToken(type, 0, lines, Optional.empty(), startLine);
    }

    public String text() {
        return String.join("\n", lines);
    }
}
