package ai.docsite.richtext.reverse;

import ai.docsite.richtext.markdown.SpanStyle;
import ai.docsite.richtext.rtf.ListKind;
import java.nio.charset.Charset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the text content of a control-word document into paragraphs of styled runs.
 *
 * <p>Destinations such as font, color and list tables are skipped. Hex and unicode escapes are
 * decoded, hyperlink fields become linked runs and list membership is taken from the {@code \ls}
 * and {@code \ilvl} paragraph words.
 */
final class ControlWordReader {

    private static final Set<String> SKIPPED_DESTINATIONS = Set.of(
            "fonttbl", "colortbl", "stylesheet", "info", "listtable", "listoverridetable", "listtext",
            "pict", "header", "footer", "generator", "themedata", "xmlnstbl", "latentstyles", "datastore");
    private static final Set<String> FIELD_WORDS = Set.of("field", "fldinst", "fldrslt");
    private static final Pattern HYPERLINK = Pattern.compile("HYPERLINK\\s+\"([^\"]*)\"");
    private static final Charset ANSI = Charset.forName("windows-1252");
    private static final int MAX_PARAMETER_DIGITS = 10;
    private static final int MAX_LIST_LEVEL = 8;

    private final List<ExtractedParagraph> paragraphs = new ArrayList<>();
    private final Deque<GroupState> stack = new ArrayDeque<>();
    private List<ExtractedParagraph.Run> runs = new ArrayList<>();
    private final StringBuilder text = new StringBuilder();
    private GroupState current = new GroupState();
    private Set<SpanStyle> textStyles = EnumSet.noneOf(SpanStyle.class);
    private String textHref = "";
    private int paragraphFontSize;
    private int baseFontSize;
    private ListKind listKind;
    private int listLevel;
    private int unicodeSkip = 1;

    static List<ExtractedParagraph> read(String document) {
        ControlWordReader reader = new ControlWordReader();
        reader.scan(document == null ? "" : document);
        return reader.paragraphs;
    }

    private void scan(String doc) {
        int i = 0;
        while (i < doc.length()) {
            char ch = doc.charAt(i);
            switch (ch) {
                case '{' -> {
                    stack.push(current);
                    current = current.copy();
                    i++;
                }
                case '}' -> {
                    if (!stack.isEmpty()) {
                        current = stack.pop();
                    }
                    i++;
                }
                case '\\' -> i = controlSymbol(doc, i);
                case '\r', '\n' -> i++;
                default -> {
                    append(ch);
                    i++;
                }
            }
        }
        endParagraph(false);
    }

    private int controlSymbol(String doc, int start) {
        if (start + 1 >= doc.length()) {
            return start + 1;
        }
        char next = doc.charAt(start + 1);
        if (next == '\\' || next == '{' || next == '}') {
            append(next);
            return start + 2;
        }
        if (next == '\'') {
            if (isHex(doc, start + 2)) {
                int value = Integer.parseInt(doc.substring(start + 2, start + 4), 16);
                append(new String(new byte[] {(byte) value}, ANSI).charAt(0));
                return start + 4;
            }
            return start + 2;
        }
        if (next == '*') {
            current.skip = true;
            return start + 2;
        }
        if (next == '~') {
            append(' ');
            return start + 2;
        }
        if (next == '_') {
            append('-');
            return start + 2;
        }
        if (next == '\n' || next == '\r') {
            endParagraph(true);
            return start + 2;
        }
        if (!Character.isLetter(next)) {
            return start + 2;
        }
        int end = start + 1;
        while (end < doc.length() && Character.isLetter(doc.charAt(end))) {
            end++;
        }
        String word = doc.substring(start + 1, end);
        int paramStart = end;
        if (end < doc.length() && doc.charAt(end) == '-') {
            end++;
        }
        while (end < doc.length() && Character.isDigit(doc.charAt(end))) {
            end++;
        }
        Integer parameter = null;
        if (end > paramStart && !(end == paramStart + 1 && doc.charAt(paramStart) == '-')) {
            parameter = parameter(doc.substring(paramStart, end));
        } else {
            end = paramStart;
        }
        if (end < doc.length() && doc.charAt(end) == ' ') {
            end++;
        }
        return word(word, parameter, doc, end);
    }

    private int word(String word, Integer parameter, String doc, int next) {
        if (SKIPPED_DESTINATIONS.contains(word)) {
            current.skip = true;
            return next;
        }
        if (current.skip && !FIELD_WORDS.contains(word)) {
            return next;
        }
        switch (word) {
            case "field" -> current.field = new StringBuilder();
            case "fldinst" -> current.instruction = true;
            case "fldrslt" -> {
                current.skip = false;
                current.instruction = false;
                if (current.field != null) {
                    Matcher matcher = HYPERLINK.matcher(current.field);
                    current.href = matcher.find() ? matcher.group(1) : "";
                }
            }
            case "par" -> endParagraph(true);
            case "line" -> append('\n');
            case "tab", "cell" -> append('\t');
            case "row" -> endParagraph(true);
            case "pard" -> {
                listKind = null;
                listLevel = 0;
            }
            case "ls" -> listKind = parameter != null && parameter == ListKind.ORDERED.overrideIndex()
                    ? ListKind.ORDERED : ListKind.BULLET;
            case "ilvl" -> listLevel = parameter == null ? 0 : Math.max(0, Math.min(MAX_LIST_LEVEL, parameter));
            case "fs" -> {
                current.fontSize = parameter == null ? current.fontSize : parameter;
                if (baseFontSize == 0 && stack.size() <= 1) {
                    baseFontSize = current.fontSize;
                }
            }
            case "b" -> toggle(SpanStyle.BOLD, parameter);
            case "i" -> toggle(SpanStyle.ITALIC, parameter);
            case "ul" -> toggle(SpanStyle.UNDERLINE, parameter);
            case "ulnone" -> current.styles.remove(SpanStyle.UNDERLINE);
            case "strike" -> toggle(SpanStyle.STRIKE, parameter);
            case "plain" -> current.styles.clear();
            case "uc" -> unicodeSkip = parameter == null ? 1 : Math.max(0, parameter);
            case "u" -> {
                if (parameter != null && parameter >= Short.MIN_VALUE && parameter <= Character.MAX_VALUE) {
                    int value = parameter < 0 ? parameter + 65536 : parameter;
                    append((char) value);
                    return skipFallback(doc, next);
                }
            }
            default -> {
                // formatting words without a text counterpart
            }
        }
        return next;
    }

    /**
     * Numeric parameters carry at most ten digits; longer or out-of-range values saturate.
     */
    static int parameter(String raw) {
        boolean negative = raw.startsWith("-");
        String digits = negative ? raw.substring(1) : raw;
        if (digits.length() > MAX_PARAMETER_DIGITS) {
            return negative ? Integer.MIN_VALUE : Integer.MAX_VALUE;
        }
        long value = Long.parseLong(raw);
        return (int) Math.max(Integer.MIN_VALUE, Math.min(Integer.MAX_VALUE, value));
    }

    private int skipFallback(String doc, int position) {
        int index = position;
        for (int skipped = 0; skipped < unicodeSkip && index < doc.length(); skipped++) {
            char ch = doc.charAt(index);
            if (ch == '\\' && index + 1 < doc.length() && doc.charAt(index + 1) == '\'' && isHex(doc, index + 2)) {
                index += 4;
            } else if (ch == '{' || ch == '}' || ch == '\\') {
                break;
            } else {
                index++;
            }
        }
        return index;
    }

    private void toggle(SpanStyle style, Integer parameter) {
        if (parameter != null && parameter == 0) {
            current.styles.remove(style);
        } else {
            current.styles.add(style);
        }
    }

    private void append(char ch) {
        if (current.instruction && current.field != null) {
            current.field.append(ch);
            return;
        }
        if (current.skip) {
            return;
        }
        Set<SpanStyle> styles = current.styles.isEmpty() ? Set.of() : EnumSet.copyOf(current.styles);
        if (text.length() > 0 && (!styles.equals(textStyles) || !current.href.equals(textHref))) {
            flushRun();
        }
        if (runs.isEmpty() && text.length() == 0) {
            paragraphFontSize = current.fontSize == baseFontSize ? 0 : current.fontSize;
        }
        textStyles = styles;
        textHref = current.href;
        text.append(ch);
    }

    private void flushRun() {
        if (text.length() > 0) {
            runs.add(new ExtractedParagraph.Run(text.toString(), textStyles, textHref));
            text.setLength(0);
        }
    }

    private void endParagraph(boolean explicit) {
        flushRun();
        if (!explicit && runs.isEmpty()) {
            return;
        }
        paragraphs.add(new ExtractedParagraph(runs, Optional.ofNullable(listKind), listLevel, paragraphFontSize));
        runs = new ArrayList<>();
        paragraphFontSize = 0;
    }

    private static boolean isHex(String doc, int index) {
        return index + 1 < doc.length()
                && Character.digit(doc.charAt(index), 16) >= 0
                && Character.digit(doc.charAt(index + 1), 16) >= 0;
    }

    private static final class GroupState {
        private boolean skip;
        private boolean instruction;
        private StringBuilder field;
        private String href = "";
        private int fontSize;
        private Set<SpanStyle> styles = EnumSet.noneOf(SpanStyle.class);

        GroupState copy() {
            GroupState copy = new GroupState();
            copy.skip = skip;
            copy.instruction = instruction;
            copy.field = field;
            copy.href = href;
            copy.fontSize = fontSize;
            copy.styles = EnumSet.noneOf(SpanStyle.class);
            copy.styles.addAll(styles);
            return copy;
        }
    }
}
