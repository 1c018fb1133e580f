package ai.docsite.richtext.tabular;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.config.StyleTable;
import ai.docsite.richtext.html.HtmlText;
import ai.docsite.richtext.rtf.ControlWordEmitter;
import ai.docsite.richtext.rtf.ControlWordEscaper;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts delimiter-separated rows into table rows. The first row is treated as the header.
 */
public class TabularTranspiler {

    static final int PAGE_WIDTH = 12240;
    private static final int CELL_GAP = 108;

    private final ControlWordEmitter emitter;

    public TabularTranspiler() {
        this(new ControlWordEmitter());
    }

    public TabularTranspiler(ControlWordEmitter emitter) {
        this.emitter = Objects.requireNonNull(emitter, "emitter");
    }

    public String toRichControlWord(String text, char delimiter, DocumentProperties properties) {
        Objects.requireNonNull(properties, "properties");
        List<List<String>> rows = parse(text, delimiter);
        int columns = rows.stream().mapToInt(List::size).max().orElse(0);
        StringBuilder body = new StringBuilder();
        if (columns > 0) {
            int width = Math.max(1, (PAGE_WIDTH - 2 * properties.margin()) / columns);
            String bold = properties.styles().controlWord(StyleTable.BOLD);
            String boldOff = properties.styles().controlWord(StyleTable.BOLD_OFF);
            for (int r = 0; r < rows.size(); r++) {
                List<String> row = rows.get(r);
                body.append("\\trowd\\trgaph").append(CELL_GAP);
                for (int c = 0; c < columns; c++) {
                    body.append("\\cellx").append(width * (c + 1));
                }
                body.append(' ');
                for (int c = 0; c < columns; c++) {
                    String cell = c < row.size() ? ControlWordEscaper.escape(row.get(c)) : "";
                    body.append("\\pard\\intbl ");
                    if (r == 0 && !bold.isEmpty()) {
                        body.append(bold).append(' ').append(cell).append(boldOff).append(' ');
                    } else {
                        body.append(cell);
                    }
                    body.append("\\cell ");
                }
                body.append("\\row\n");
            }
            body.append(emitter.emitParagraphReset(properties));
        }
        return emitter.emitDocument(properties, body.toString());
    }

    public String toMarkupTree(String text, char delimiter) {
        List<List<String>> rows = parse(text, delimiter);
        if (rows.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder("<table>\n");
        for (int r = 0; r < rows.size(); r++) {
            String cellTag = r == 0 ? "th" : "td";
            out.append("<tr>");
            for (String cell : rows.get(r)) {
                out.append('<').append(cellTag).append('>').append(HtmlText.escape(cell))
                        .append("</").append(cellTag).append('>');
            }
            out.append("</tr>\n");
        }
        return out.append("</table>\n").toString();
    }

    /**
     * Splits rows and cells. Quoted cells may contain the delimiter, line breaks and doubled quotes.
     * Blank lines are skipped.
     */
    public static List<List<String>> parse(String text, char delimiter) {
        List<List<String>> rows = new ArrayList<>();
        if (text == null || text.isBlank()) {
            return rows;
        }
        List<String> row = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        boolean rowHasContent = false;
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            if (quoted) {
                if (ch == '"') {
                    if (i + 1 < text.length() && text.charAt(i + 1) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(ch);
                }
                continue;
            }
            if (ch == '"' && cell.length() == 0) {
                quoted = true;
                rowHasContent = true;
            } else if (ch == delimiter) {
                row.add(cell.toString());
                cell.setLength(0);
                rowHasContent = true;
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                if (rowHasContent || cell.length() > 0) {
                    row.add(cell.toString());
                    rows.add(row);
                }
                row = new ArrayList<>();
                cell.setLength(0);
                rowHasContent = false;
            } else {
                cell.append(ch);
                rowHasContent = true;
            }
        }
        if (rowHasContent || cell.length() > 0) {
            row.add(cell.toString());
            rows.add(row);
        }
        return rows;
    }
}
