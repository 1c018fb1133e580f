package ai.docsite.richtext.rtf;

import java.util.regex.Pattern;

/**
 * Markers whose presence indicates a control-word document.
 */
public enum StructuralSignature {
    FONT_TABLE("\\{\\\\fonttbl"),
    COLOR_TABLE("\\{\\\\colortbl"),
    PARAGRAPH_RESET("\\\\pard(?![a-z])"),
    FONT_SIZE("\\\\fs\\d+"),
    COLOR_REFERENCE("\\\\cf\\d+"),
    FONT_REFERENCE("\\\\f\\d+(?![a-z])"),
    BOLD("\\\\b0?(?![a-z])"),
    ITALIC("\\\\i0?(?![a-z])"),
    UNDERLINE("\\\\ul(?:none)?(?![a-z])"),
    STRIKE("\\\\strike0?(?![a-z])"),
    PARAGRAPH_BREAK("\\\\par(?![a-z])"),
    LINE_BREAK("\\\\line(?![a-z])"),
    ALIGNMENT("\\\\q[lcrj](?![a-z])"),
    HEX_ESCAPE("\\\\'[0-9a-fA-F]{2}"),
    UNICODE_ESCAPE("\\\\u-?\\d+"),
    GROUP("\\{[^{}]*\\}"),
    CONTROL_WORD("\\\\[a-z]{1,32}-?\\d*");

    private final Pattern pattern;

    StructuralSignature(String regex) {
        this.pattern = Pattern.compile(regex);
    }

    public boolean matches(String candidate) {
        return pattern.matcher(candidate).find();
    }
}
