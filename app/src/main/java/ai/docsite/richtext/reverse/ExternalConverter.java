package ai.docsite.richtext.reverse;

import ai.docsite.richtext.detect.FormatKind;

/**
 * Converter for format pairs the native transpilers do not cover, most notably control words back
 * into text, lightweight markup or markup trees.
 */
public interface ExternalConverter {

    /**
     * @throws ExternalConversionException when the pair is unsupported or the conversion fails
     */
    String convert(FormatKind from, FormatKind to, String content);
}
