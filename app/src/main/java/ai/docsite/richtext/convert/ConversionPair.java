package ai.docsite.richtext.convert;

import ai.docsite.richtext.detect.FormatKind;
import java.util.Objects;

/**
 * Registry key for a native transpiler.
 */
record ConversionPair(FormatKind from, FormatKind to) {

    ConversionPair {
        Objects.requireNonNull(from, "from");
        Objects.requireNonNull(to, "to");
    }

    static ConversionPair of(FormatKind from, FormatKind to) {
        return new ConversionPair(from, to);
    }
}
