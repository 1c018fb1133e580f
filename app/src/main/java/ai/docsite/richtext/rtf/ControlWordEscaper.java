package ai.docsite.richtext.rtf;

/**
 * Escapes literal text for inclusion in a control-word document.
 */
public final class ControlWordEscaper {

    private ControlWordEscaper() {
    }

    /**
     * Escapes group markers and backslashes, turns tabs and newlines into their control words and
     * writes every non-ASCII UTF-16 unit as a {@code \\uN?} escape.
     */
    public static String escape(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(text.length() + 16);
        for (int i = 0; i < text.length(); i++) {
            char ch = text.charAt(i);
            switch (ch) {
                case '\\' -> builder.append("\\\\");
                case '{' -> builder.append("\\{");
                case '}' -> builder.append("\\}");
                case '\t' -> builder.append("\\tab ");
                case '\n' -> builder.append("\\line ");
                case '\r' -> {
                    // CR is only ever part of a line ending here
                }
                default -> {
                    if (ch > 0x7F) {
                        builder.append("\\u").append((int) (short) ch).append('?');
                    } else if (ch < 0x20) {
                        builder.append(' ');
                    } else {
                        builder.append(ch);
                    }
                }
            }
        }
        return builder.toString();
    }
}
