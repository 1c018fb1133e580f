package ai.docsite.richtext.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.Map;
import org.junit.jupiter.api.Test;

class StyleTableTest {

    @Test
    void defaultsCoverToggleAndAlignmentWords() {
        StyleTable table = StyleTable.defaults();

        assertThat(table.controlWord(StyleTable.BOLD)).isEqualTo("\\b");
        assertThat(table.controlWord(StyleTable.BOLD_OFF)).isEqualTo("\\b0");
        assertThat(table.controlWord(StyleTable.UNDERLINE_OFF)).isEqualTo("\\ulnone");
        assertThat(table.controlWord(StyleTable.STRIKE)).isEqualTo("\\strike");
        assertThat(table.alignment("justify")).isEqualTo("\\qj");
        assertThat(table.alignment("sideways")).isEqualTo("\\ql");
    }

    @Test
    void overridesReturnANewTable() {
        StyleTable defaults = StyleTable.defaults();

        StyleTable custom = defaults.withOverrides(Map.of("Code", "\\f1\\fs18"));

        assertThat(custom.controlWord(StyleTable.CODE)).isEqualTo("\\f1\\fs18");
        assertThat(defaults.controlWord(StyleTable.CODE)).isEqualTo("\\f0");
        assertThat(custom).isNotEqualTo(defaults);
    }

    @Test
    void rejectsUnknownNamesAndGroups() {
        assertThatThrownBy(() -> StyleTable.defaults().withOverrides(Map.of("shadow", "\\shad")))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("shadow");
        assertThatThrownBy(() -> StyleTable.defaults().withOverrides(Map.of("bold", "\\b}")))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> StyleTable.defaults().controlWord("missing"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void documentPropertiesRejectFontNamesThatBreakTheFontTable() {
        assertThatThrownBy(() -> DocumentProperties.defaults().withFontFamily("Evil;}"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> DocumentProperties.defaults().withFontSize(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
