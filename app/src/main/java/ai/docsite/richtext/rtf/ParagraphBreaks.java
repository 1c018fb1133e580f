package ai.docsite.richtext.rtf;

import java.util.regex.Pattern;

/**
 * Removes line breaks that sit directly before or after a paragraph break.
 */
public final class ParagraphBreaks {

    private static final Pattern LINE_BEFORE_PAR = Pattern.compile("(?<!\\\\)\\\\line ?(\\s*\\\\par(?![a-z]))");
    private static final Pattern LINE_AFTER_PAR = Pattern.compile("((?<!\\\\)\\\\par(?![a-z]) ?\\s*)\\\\line(?![a-z]) ?");

    private ParagraphBreaks() {
    }

    public static String normalize(String body) {
        if (body == null || body.isEmpty()) {
            return "";
        }
        String previous;
        String current = body;
        do {
            previous = current;
            current = LINE_BEFORE_PAR.matcher(current).replaceAll("$1");
            current = LINE_AFTER_PAR.matcher(current).replaceAll("$1");
        } while (!current.equals(previous));
        return current;
    }
}
