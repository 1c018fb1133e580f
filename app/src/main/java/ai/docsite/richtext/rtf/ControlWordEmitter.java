package ai.docsite.richtext.rtf;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.config.RgbColor;
import java.util.Objects;

/**
 * Emits the fixed structural parts of a control-word document.
 */
public final class ControlWordEmitter {

    public static final String DOCUMENT_MARKER = "{\\rtf1";
    public static final String PARAGRAPH_BREAK = "\\par";
    public static final String LINE_BREAK = "\\line";
    public static final String PARAGRAPH_RESET = "\\pard";

    static final int LEVEL_COUNT = 9;
    static final int LEVEL_INDENT = 720;
    static final int HANGING_INDENT = -360;

    private static final String[] BULLET_GLYPHS = {"\\u8226 ?", "\\u9702 ?", "\\u9642 ?"};

    /**
     * Version, charset, default font and language, the one-entry font and color tables and the
     * view/paragraph/color/font/size run. The font table close also closes the {@code \rtf1} group,
     * so the preamble is balanced on its own and body content follows at the top level.
     */
    public String emitPreamble(DocumentProperties properties) {
        Objects.requireNonNull(properties, "properties");
        RgbColor color = properties.fontColor();
        return DOCUMENT_MARKER + "\\ansi\\deff0\\nouicompat\\deflang" + properties.languageId()
                + "{\\fonttbl{\\f0\\fnil\\fcharset" + properties.charset() + ' ' + properties.fontFamily() + ";}}}"
                + "{\\colortbl ;\\red" + color.red() + "\\green" + color.green() + "\\blue" + color.blue() + ";}"
                + "\\viewkind4\\uc1\\pard\\cf1\\f0\\fs" + properties.fontSizeHalfPoints();
    }

    /**
     * Margin and paragraph spacing words that follow the preamble, terminated by a delimiter space.
     */
    public String emitParagraphDefaults(DocumentProperties properties) {
        Objects.requireNonNull(properties, "properties");
        int margin = properties.margin();
        return "\\margl" + margin + "\\margr" + margin + "\\margt" + margin + "\\margb" + margin
                + spacing(properties) + ' ';
    }

    /**
     * Resets paragraph formatting back to the document defaults; also closes an open list.
     */
    public String emitParagraphReset(DocumentProperties properties) {
        return PARAGRAPH_RESET + spacing(properties) + ' ';
    }

    public String emitDocument(DocumentProperties properties, String body) {
        return emitPreamble(properties) + emitParagraphDefaults(properties) + (body == null ? "" : body)
                + emitDocumentEnd();
    }

    /**
     * Nothing is left open by {@link #emitPreamble(DocumentProperties)}; the document needs no closing marker.
     */
    public String emitDocumentEnd() {
        return "";
    }

    /**
     * Reusable bullet template; concrete lists bind to it through {@link #emitListOverride(ListKind)}.
     */
    public String emitListTableSkeleton() {
        return emitListTable(ListKind.BULLET);
    }

    public String emitListTable(ListKind kind) {
        Objects.requireNonNull(kind, "kind");
        StringBuilder builder = new StringBuilder(1024);
        builder.append("{\\*\\listtable{\\list\\listtemplateid").append(kind.templateId()).append("\\listhybrid");
        for (int level = 0; level < LEVEL_COUNT; level++) {
            builder.append(levelDefinition(kind, level));
        }
        builder.append("{\\listname ;}\\listid").append(kind.listId()).append("}}");
        return builder.toString();
    }

    public String emitListOverride(ListKind kind) {
        Objects.requireNonNull(kind, "kind");
        return "{\\*\\listoverridetable{\\listoverride\\listid" + kind.listId()
                + "\\listoverridecount0\\ls" + kind.overrideIndex() + "}}";
    }

    /**
     * Glyph drawn in front of a bullet item at the given nesting level.
     */
    public String bulletGlyph(int level) {
        return BULLET_GLYPHS[Math.max(0, level) % BULLET_GLYPHS.length];
    }

    public int leftIndent(int level) {
        return LEVEL_INDENT * (Math.max(0, level) + 1);
    }

    private String levelDefinition(ListKind kind, int level) {
        int indent = leftIndent(level);
        int levelTemplateId = kind.templateId() * 100 + level + 1;
        String numbering = kind == ListKind.ORDERED ? "\\levelnfc0\\levelnfcn0" : "\\levelnfc23\\levelnfcn23";
        String text = kind == ListKind.ORDERED
                ? "{\\leveltext\\leveltemplateid" + levelTemplateId + "\\'02\\'0" + level + ".;}{\\levelnumbers\\'01;}"
                : "{\\leveltext\\leveltemplateid" + levelTemplateId + "\\'01" + bulletGlyph(level) + ";}{\\levelnumbers;}";
        return "{\\listlevel" + numbering + "\\leveljc0\\leveljcn0\\levelfollow0\\levelstartat1\\levelspace360\\levelindent0"
                + text + "\\fi" + HANGING_INDENT + "\\li" + indent + "\\lin" + indent + " }";
    }

    private static String spacing(DocumentProperties properties) {
        return "\\sa" + properties.paragraphSpacing() + "\\sl" + properties.lineHeight() + "\\slmult1";
    }
}
