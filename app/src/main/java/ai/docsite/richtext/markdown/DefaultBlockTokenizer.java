package ai.docsite.richtext.markdown;

import ai.docsite.richtext.list.ListLine;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Default implementation grouping consecutive lines into typed blocks.
 *
 * <p>Paragraph, quote and blank lines merge with neighbours of the same type; headings and list
 * items always form their own block. An unterminated fence runs to the end of the input.
 */
public class DefaultBlockTokenizer implements BlockTokenizer {

    private static final Pattern HEADING = Pattern.compile("^ {0,3}(#+)[ \\t]+(.*?)(?:[ \\t]+#+)?[ \\t]*$");
    private static final Pattern QUOTE = Pattern.compile("^ {0,3}>[ \\t]?(.*)$");
    private static final Pattern FENCE = Pattern.compile("^ {0,3}(`{3,}|~{3,}).*$");
    private static final int MAX_HEADING_LEVEL = 6;

    @Override
    public List<BlockToken> tokenize(String markdown) {
        if (markdown == null || markdown.isEmpty()) {
            return Collections.emptyList();
        }
        String[] lines = normalizeLineEndings(markdown).split("\n", -1);
        int lineCount = lines.length;
        if (lineCount > 0 && lines[lineCount - 1].isEmpty()) {
            lineCount--;
        }

        List<BlockToken> tokens = new ArrayList<>();
        int index = 0;
        while (index < lineCount) {
            String line = lines[index];
            int start = index;

            Matcher fence = FENCE.matcher(line);
            if (fence.matches()) {
                String marker = fence.group(1);
                List<String> code = new ArrayList<>();
                index++;
                while (index < lineCount && !isClosingFence(lines[index], marker)) {
                    code.add(lines[index]);
                    index++;
                }
                index++;
                tokens.add(BlockToken.of(BlockType.CODE, code, start));
                continue;
            }

            if (line.isBlank()) {
                List<String> blanks = new ArrayList<>();
                while (index < lineCount && lines[index].isBlank()) {
                    blanks.add("");
                    index++;
                }
                tokens.add(BlockToken.of(BlockType.BLANK, blanks, start));
                continue;
            }

            Matcher heading = HEADING.matcher(line);
            if (heading.matches() && !heading.group(2).isEmpty()) {
                int level = Math.min(MAX_HEADING_LEVEL, heading.group(1).length());
                tokens.add(BlockToken.heading(level, heading.group(2), start));
                index++;
                continue;
            }

            Optional<ListLine> listLine = ListLine.parse(line);
            if (listLine.isPresent()) {
                tokens.add(BlockToken.listItem(listLine.get(), start));
                index++;
                continue;
            }

            if (QUOTE.matcher(line).matches()) {
                List<String> quoted = new ArrayList<>();
                Matcher quote;
                while (index < lineCount && (quote = QUOTE.matcher(lines[index])).matches()) {
                    quoted.add(quote.group(1));
                    index++;
                }
                tokens.add(BlockToken.of(BlockType.QUOTE, quoted, start));
                continue;
            }

            List<String> paragraph = new ArrayList<>();
            while (index < lineCount && classify(lines[index]) == BlockType.PARAGRAPH) {
                paragraph.add(lines[index].strip());
                index++;
            }
            tokens.add(BlockToken.of(BlockType.PARAGRAPH, paragraph, start));
        }
        return tokens;
    }

    static String normalizeLineEndings(String text) {
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private BlockType classify(String line) {
        if (line.isBlank()) {
            return BlockType.BLANK;
        }
        if (FENCE.matcher(line).matches()) {
            return BlockType.CODE;
        }
        Matcher heading = HEADING.matcher(line);
        if (heading.matches() && !heading.group(2).isEmpty()) {
            return BlockType.HEADING;
        }
        if (ListLine.parse(line).isPresent()) {
            return BlockType.LIST_ITEM;
        }
        if (QUOTE.matcher(line).matches()) {
            return BlockType.QUOTE;
        }
        return BlockType.PARAGRAPH;
    }

    private static boolean isClosingFence(String line, String marker) {
        String trimmed = line.strip();
        return trimmed.length() >= marker.length()
                && trimmed.chars().allMatch(ch -> ch == marker.charAt(0));
    }
}
