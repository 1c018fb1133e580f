package ai.docsite.richtext.rtf;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ParagraphBreaksTest {

    @Test
    void dropsLineBreaksNextToParagraphBreaks() {
        assertThat(ParagraphBreaks.normalize("a\\line \\par\n")).isEqualTo("a\\par\n");
        assertThat(ParagraphBreaks.normalize("\\par \\line b")).isEqualTo("\\par b");
        assertThat(ParagraphBreaks.normalize("a\\line \\line \\par\n")).isEqualTo("a\\par\n");
    }

    @Test
    void keepsLineBreaksInsideParagraphs() {
        assertThat(ParagraphBreaks.normalize("a\\line b\\par\n")).isEqualTo("a\\line b\\par\n");
        assertThat(ParagraphBreaks.normalize("a\\line \\pard b")).isEqualTo("a\\line \\pard b");
    }

    @Test
    void ignoresEscapedBackslashes() {
        assertThat(ParagraphBreaks.normalize("a\\\\line \\par")).isEqualTo("a\\\\line \\par");
    }
}
