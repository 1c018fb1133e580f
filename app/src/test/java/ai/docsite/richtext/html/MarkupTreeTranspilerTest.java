package ai.docsite.richtext.html;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.rtf.StructuralValidator;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.junit.jupiter.api.Test;

class MarkupTreeTranspilerTest {

    private final MarkupTreeTranspiler transpiler = new MarkupTreeTranspiler();
    private final DocumentProperties properties = DocumentProperties.defaults();

    @Test
    void convertsParagraphWithInlineStyles() {
        assertThat(transpiler.toRichControlWordBody("<p>Hello <strong>world</strong> and <em>you</em></p>", properties))
                .isEqualTo("Hello \\b world\\b0  and \\i you\\i0 \\par\n");
    }

    @Test
    void headingsUseLargerBoldGroups() {
        assertThat(transpiler.toRichControlWordBody("<h1>Big</h1><h2>Less</h2>", properties))
                .isEqualTo("{\\fs44\\b Big}\\par\n{\\fs33\\b Less}\\par\n");
    }

    @Test
    void lineBreaksStayInsideParagraph() {
        assertThat(transpiler.toRichControlWordBody("<p>a<br>b</p>", properties)).isEqualTo("a\\line b\\par\n");
    }

    @Test
    void convertsNestedListsAndClosesTheRun() {
        String body = transpiler.toRichControlWordBody("<ul><li>a<ul><li>b</li></ul></li></ul><p>after</p>", properties);

        assertThat(body).contains("\\ls1\\ilvl0\\fi-360\\li720 a\\par");
        assertThat(body).contains("\\ls1\\ilvl1\\fi-360\\li1440 b\\par");
        assertThat(body).endsWith("\\pard\\sa200\\sl276\\slmult1 after\\par\n");
    }

    @Test
    void readsFlatEditorListsFromDataAttributes() {
        String body = transpiler.toRichControlWordBody(
                "<ol><li data-list=\"ordered\">first</li>"
                        + "<li data-list=\"bullet\" class=\"ql-indent-1\">note</li>"
                        + "<li data-list=\"ordered\">second</li></ol>", properties);

        assertThat(body).contains("{\\listtext 1.\\tab}\\ls2\\ilvl0\\fi-360\\li720 first");
        assertThat(body).contains("\\ls1\\ilvl1\\fi-360\\li1440 note");
        assertThat(body).contains("{\\listtext 2.\\tab}\\ls2\\ilvl0\\fi-360\\li720 second");
    }

    @Test
    void linksBecomeHyperlinkFields() {
        assertThat(transpiler.toRichControlWordBody("<a href=\"https://example.com\">site</a>", properties))
                .isEqualTo("{\\field{\\*\\fldinst{HYPERLINK \"https://example.com\"}}{\\fldrslt{\\ul site}}}\\par\n");
    }

    @Test
    void alignmentIsAppliedAndReset() {
        assertThat(transpiler.toRichControlWordBody("<p style=\"text-align: center\">Hi</p>", properties))
                .isEqualTo("\\qc Hi\\par\n\\pard\\sa200\\sl276\\slmult1 ");
        assertThat(transpiler.toRichControlWordBody("<p class=\"ql-align-right\">Hi</p>", properties))
                .startsWith("\\qr Hi");
        assertThat(transpiler.toRichControlWordBody("<p align=\"left\">Hi</p>", properties)).isEqualTo("Hi\\par\n");
    }

    @Test
    void decodesEntitiesAndEscapesGroupMarkers() {
        assertThat(transpiler.toRichControlWordBody("<p>a &amp; b &lt;c&gt; {x}</p>", properties))
                .isEqualTo("a & b <c> \\{x\\}\\par\n");
    }

    @Test
    void dropsHeadStyleScriptAndComments() {
        String html = "<html><head><title>T</title></head><style>p { color: red }</style>"
                + "<script>var x = 1;</script><body><!-- note --><p>x</p></body></html>";

        assertThat(transpiler.toRichControlWordBody(html, properties)).isEqualTo("x\\par\n");
    }

    @Test
    void preformattedTextKeepsLineBreaks() {
        assertThat(transpiler.toRichControlWordBody("<pre>a\n  b</pre>", properties))
                .isEqualTo("{\\f0 a\\line   b}\\par\n");
    }

    @Test
    void unclosedElementsStillProduceBalancedDocument() {
        String document = transpiler.toRichControlWord("<p><b>bold <code>x <a href=\"y\">z", properties);

        assertThat(new StructuralValidator().validate(document).isValid()).isTrue();
        assertThat(document).contains("\\b bold ");
    }

    @Test
    void decodesNamedAndNumericEntitiesBeyondTheBasicSet() {
        assertThat(transpiler.toRichControlWordBody("<p>&copy; caf&eacute; &euro;5</p>", properties))
                .isEqualTo("\\u169? caf\\u233? \\u8364?5\\par\n");
        assertThat(transpiler.toRichControlWordBody("<p>&#39;s&#x41; a&nbsp;b&hellip;</p>", properties))
                .isEqualTo("'sA a\\u160?b\\u8230?\\par\n");
    }

    @Test
    void keepsUnknownEntitiesAsWritten() {
        assertThat(transpiler.toRichControlWordBody("<p>&bogus; &amp; done</p>", properties))
                .isEqualTo("&bogus; & done\\par\n");
    }

    @Test
    void readsAlignmentFromStyleAttributeAndEditorClass() {
        Element justified = Jsoup.parse("<p align=Justify>x</p>").selectFirst("p");
        Element styled = Jsoup.parse("<p style='color: red; TEXT-ALIGN: Right'>x</p>").selectFirst("p");
        Element quill = Jsoup.parse("<p class=\"ql-align-center\">x</p>").selectFirst("p");
        Element plain = Jsoup.parse("<p>x</p>").selectFirst("p");

        assertThat(MarkupTreeTranspiler.alignment(justified)).contains("justify");
        assertThat(MarkupTreeTranspiler.alignment(styled)).contains("right");
        assertThat(MarkupTreeTranspiler.alignment(quill)).contains("center");
        assertThat(MarkupTreeTranspiler.alignment(plain)).isEmpty();
    }

    @Test
    void clampsEditorIndentClasses() {
        Element nested = Jsoup.parse("<ol><li class=\"ql-indent-2\">x</li></ol>").selectFirst("li");
        Element deep = Jsoup.parse("<ol><li class=\"ql-indent-99\">x</li></ol>").selectFirst("li");
        Element huge = Jsoup.parse("<ol><li class=\"ql-indent-99999999999\">x</li></ol>").selectFirst("li");

        assertThat(MarkupTreeTranspiler.indentLevel(nested, 0)).isEqualTo(2);
        assertThat(MarkupTreeTranspiler.indentLevel(deep, 0)).isEqualTo(8);
        assertThat(MarkupTreeTranspiler.indentLevel(huge, 3)).isEqualTo(3);
        assertThat(new StructuralValidator().validate(transpiler.toRichControlWord(
                "<ol><li data-list=\"bullet\" class=\"ql-indent-99999999999\">x</li></ol>", properties)).isValid())
                .isTrue();
    }
}
