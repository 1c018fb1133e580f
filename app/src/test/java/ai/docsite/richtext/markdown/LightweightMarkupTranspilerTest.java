package ai.docsite.richtext.markdown;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.detect.FormatDetector;
import ai.docsite.richtext.detect.FormatKind;
import ai.docsite.richtext.rtf.StructuralValidator;
import org.junit.jupiter.api.Test;

class LightweightMarkupTranspilerTest {

    private final LightweightMarkupTranspiler transpiler = new LightweightMarkupTranspiler();
    private final DocumentProperties properties = DocumentProperties.defaults();

    @Test
    void convertsHeadingParagraphAndListIntoValidDocument() {
        String markdown = "# Title\n\nThis is **bold** and *italic*.\n\n- item one\n- item two\n";

        String document = transpiler.toRichControlWord(markdown, properties);

        assertThat(document).startsWith("{\\rtf1");
        assertThat(document).endsWith("item two\\par\n\\pard\\sa200\\sl276\\slmult1 ");
        assertThat(occurrences(document, "\\listtable")).isEqualTo(1);
        assertThat(occurrences(document, "{\\listtext")).isEqualTo(2);
        assertThat(occurrences(document, "\\b ")).isEqualTo(1);
        assertThat(occurrences(document, "\\b0 ")).isEqualTo(1);
        assertThat(document).contains("{\\fs48 Title}\\par");
        assertThat(document).contains("item one\\par").contains("item two\\par");
        assertThat(new StructuralValidator().validate(document).isValid()).isTrue();
        assertThat(new FormatDetector().detectFormat(document)).isEqualTo(FormatKind.RICH_CONTROL_WORD);
    }

    @Test
    void listRunIsClosedBeforeFollowingParagraph() {
        String body = transpiler.toRichControlWordBody("- one\n- two\nafter", properties);

        assertThat(body).endsWith("two\\par\n\\pard\\sa200\\sl276\\slmult1 after\\par\n");
    }

    @Test
    void separateListRunsDefineTheirOwnTables() {
        String body = transpiler.toRichControlWordBody("- one\n\n- two", properties);

        assertThat(occurrences(body, "\\listtable")).isEqualTo(2);
    }

    @Test
    void blankLineRunBecomesASingleParagraphBreak() {
        String body = transpiler.toRichControlWordBody("alpha\n\nbeta", properties);
        String longRun = transpiler.toRichControlWordBody("alpha\n\n\n\nbeta\n\n", properties);

        assertThat(body).isEqualTo("alpha\\par\nbeta\\par\n");
        assertThat(occurrences(body, "\\par")).isEqualTo(2);
        assertThat(longRun).isEqualTo(body);
    }

    @Test
    void paragraphLinesJoinWithLineBreaks() {
        assertThat(transpiler.toRichControlWordBody("line one\nline two", properties))
                .isEqualTo("line one\\line line two\\par\n");
    }

    @Test
    void quotesIndentAndResetAfterwards() {
        assertThat(transpiler.toRichControlWordBody("> quoted", properties))
                .isEqualTo("\\li720 quoted\\par\n\\pard\\sa200\\sl276\\slmult1 ");
    }

    @Test
    void codeBlocksKeepTheirTextLiteral() {
        assertThat(transpiler.toRichControlWordBody("```\nint a = {**b**};\n```", properties))
                .isEqualTo("{\\f0 int a = \\{**b**\\};}\\par\n");
    }

    @Test
    void headingSizesDecreaseWithLevel() {
        for (int level = 1; level < 6; level++) {
            assertThat(LightweightMarkupTranspiler.headingSize(level))
                    .isGreaterThan(LightweightMarkupTranspiler.headingSize(level + 1));
        }
        assertThat(LightweightMarkupTranspiler.headingSize(0)).isEqualTo(48);
        assertThat(LightweightMarkupTranspiler.headingSize(9)).isEqualTo(24);
    }

    @Test
    void nonAsciiTextIsEscaped() {
        assertThat(transpiler.toRichControlWordBody("café", properties)).isEqualTo("caf\\u233?\\par\n");
    }

    @Test
    void rendersMarkupTreeWithMergedLists() {
        String markup = transpiler.toMarkupTree("# T *x*\n\na < b\n\n- a\n- b\n\n1. x\n  2. y\n", properties);

        assertThat(markup).isEqualTo("<h1>T <em>x</em></h1>\n"
                + "<p>a &lt; b</p>\n"
                + "<ul>\n<li>a</li>\n<li>b</li>\n</ul>\n"
                + "<ol>\n<li>x</li>\n<li class=\"ql-indent-1\">y</li>\n</ol>\n");
    }

    @Test
    void rendersQuotesAndCodeAsMarkup() {
        assertThat(transpiler.toMarkupTree("> one\n> two\n\n```\n<tag>\n```", properties))
                .isEqualTo("<blockquote>one<br>two</blockquote>\n<pre><code>&lt;tag&gt;</code></pre>\n");
    }

    private static int occurrences(String text, String needle) {
        int count = 0;
        int index = text.indexOf(needle);
        while (index >= 0) {
            count++;
            index = text.indexOf(needle, index + needle.length());
        }
        return count;
    }
}
