package ai.docsite.richtext.rtf;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ControlWordEscaperTest {

    @Test
    void escapesGroupMarkersAndBackslash() {
        assertThat(ControlWordEscaper.escape("a{b}c\\d")).isEqualTo("a\\{b\\}c\\\\d");
    }

    @Test
    void turnsLayoutCharactersIntoControlWords() {
        assertThat(ControlWordEscaper.escape("a\tb\r\nc")).isEqualTo("a\\tab b\\line c");
    }

    @Test
    void writesNonAsciiAsSignedUnicodeEscapes() {
        assertThat(ControlWordEscaper.escape("café")).isEqualTo("caf\\u233?");
        assertThat(ControlWordEscaper.escape("\uFF01")).isEqualTo("\\u-255?");
    }

    @Test
    void handlesEmptyInput() {
        assertThat(ControlWordEscaper.escape(null)).isEmpty();
        assertThat(ControlWordEscaper.escape("")).isEmpty();
    }
}
