package ai.docsite.richtext.tabular;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.richtext.config.DocumentProperties;
import ai.docsite.richtext.rtf.StructuralValidator;
import java.util.List;
import org.junit.jupiter.api.Test;

class TabularTranspilerTest {

    private final TabularTranspiler transpiler = new TabularTranspiler();

    @Test
    void parsesQuotedCellsAndSkipsBlankLines() {
        List<List<String>> rows = TabularTranspiler.parse("name,quote\r\n\r\n\"Ada, L\",\"said \"\"hi\"\"\"\n", ',');

        assertThat(rows).containsExactly(
                List.of("name", "quote"),
                List.of("Ada, L", "said \"hi\""));
    }

    @Test
    void keepsEmptyCellsAndQuotedLineBreaks() {
        assertThat(TabularTranspiler.parse("a\t\tc\n\"multi\nline\"\tx", '\t')).containsExactly(
                List.of("a", "", "c"),
                List.of("multi\nline", "x"));
    }

    @Test
    void emitsTableRowsWithBoldHeader() {
        String document = transpiler.toRichControlWord("name,age\nAda,36\n", ',', DocumentProperties.defaults());

        assertThat(document).contains("\\trowd\\trgaph108\\cellx4680\\cellx9360 "
                + "\\pard\\intbl \\b name\\b0 \\cell \\pard\\intbl \\b age\\b0 \\cell \\row\n");
        assertThat(document).contains("\\pard\\intbl Ada\\cell \\pard\\intbl 36\\cell \\row\n");
        assertThat(document).endsWith("\\row\n\\pard\\sa200\\sl276\\slmult1 }");
        assertThat(new StructuralValidator().validate(document).isValid()).isTrue();
    }

    @Test
    void shortRowsArePaddedToWidestRow() {
        String document = transpiler.toRichControlWord("a\tb\tc\nd", '\t', DocumentProperties.defaults());

        assertThat(document).contains("\\pard\\intbl d\\cell \\pard\\intbl \\cell \\pard\\intbl \\cell \\row");
    }

    @Test
    void emptyInputStillYieldsDocument() {
        String document = transpiler.toRichControlWord("", ',', DocumentProperties.defaults());

        assertThat(document).startsWith("{\\rtf1").doesNotContain("\\trowd").endsWith("\\slmult1 ");
    }

    @Test
    void rendersMarkupTable() {
        assertThat(transpiler.toMarkupTree("h1,h2\n<a>,b", ','))
                .isEqualTo("<table>\n<tr><th>h1</th><th>h2</th></tr>\n<tr><td>&lt;a&gt;</td><td>b</td></tr>\n</table>\n");
    }
}
