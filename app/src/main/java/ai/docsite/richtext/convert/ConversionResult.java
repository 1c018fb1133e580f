package ai.docsite.richtext.convert;

import ai.docsite.richtext.detect.FormatKind;
import java.util.Objects;

/**
 * Outcome of a conversion.
 *
 * @param text converted text, or the original text when the conversion did not happen
 * @param sourceFormat format the text was converted from
 * @param targetFormat requested format
 * @param state final state of the conversion
 * @param softFailure whether a delegated conversion failed and the original text was returned
 */
public record ConversionResult(String text, FormatKind sourceFormat, FormatKind targetFormat,
                               ConversionState state, boolean softFailure) {

    public ConversionResult {
        text = text == null ? "" : text;
        Objects.requireNonNull(sourceFormat, "sourceFormat");
        Objects.requireNonNull(targetFormat, "targetFormat");
        Objects.requireNonNull(state, "state");
    }

    static ConversionResult unchanged(String text, FormatKind sourceFormat, FormatKind targetFormat) {
        return new ConversionResult(text, sourceFormat, targetFormat, ConversionState.CONVERTED, false);
    }

    static ConversionResult softFailure(String text, FormatKind sourceFormat, FormatKind targetFormat) {
        return new ConversionResult(text, sourceFormat, targetFormat, ConversionState.UNCONVERTED, true);
    }

    public boolean isRejected() {
        return state == ConversionState.REJECTED;
    }
}
