package ai.docsite.richtext.rtf;

import static org.assertj.core.api.Assertions.assertThat;

import ai.docsite.richtext.config.DocumentProperties;
import org.junit.jupiter.api.Test;

class StructuralValidatorTest {

    private final StructuralValidator validator = new StructuralValidator();

    @Test
    void acceptsGeneratedDocument() {
        String document = new ControlWordEmitter().emitDocument(DocumentProperties.defaults(), "\\b Hi\\b0 \\par\n");

        ValidationVerdict verdict = validator.validate(document);

        assertThat(verdict.isValid()).isTrue();
        assertThat(verdict.isBalanced()).isTrue();
        assertThat(verdict.signatures()).contains(StructuralSignature.FONT_TABLE, StructuralSignature.COLOR_TABLE,
                StructuralSignature.BOLD, StructuralSignature.PARAGRAPH_BREAK);
        assertThat(verdict.confidence()).isEqualTo(verdict.signatures().size() * 100 / StructuralSignature.values().length);
    }

    @Test
    void rejectsUnclosedGroup() {
        ValidationVerdict verdict = validator.validate("{\\rtf1\\ansi{\\fonttbl{\\f0 Arial;}}\\par Hello");

        assertThat(verdict.isValid()).isFalse();
        assertThat(verdict.balanceDelta()).isEqualTo(1);
    }

    @Test
    void closeBeforeOpenIsRejectedEvenWhenCountsMatch() {
        StructuralValidator.BalanceScan scan = StructuralValidator.scanBalance("}\\par\\b{");

        assertThat(scan.delta()).isZero();
        assertThat(scan.wentNegative()).isTrue();
        assertThat(validator.validate("}\\par\\b{").isValid()).isFalse();
    }

    @Test
    void escapedMarkersDoNotCount() {
        assertThat(StructuralValidator.scanBalance("{\\rtf1 a \\{ b \\} c \\\\}").balanced()).isTrue();
        assertThat(StructuralValidator.scanBalance("{\\rtf1 \\\\{}").delta()).isEqualTo(1);
    }

    @Test
    void needsAtLeastTwoSignatures() {
        assertThat(validator.validate("{plain}").isValid()).isFalse();
        assertThat(validator.validate("").isValid()).isFalse();
        assertThat(validator.validate(null).confidence()).isZero();
    }
}
