package ai.docsite.richtext.detect;

import java.util.Objects;

/**
 * Classification of a piece of text together with a confidence between 0 and 100.
 */
public record DetectionResult(FormatKind kind, int confidence) {

    public DetectionResult {
        Objects.requireNonNull(kind, "kind");
        if (confidence < 0 || confidence > 100) {
            throw new IllegalArgumentException("confidence must be between 0 and 100");
        }
    }

    public static DetectionResult plainText() {
        return new DetectionResult(FormatKind.PLAIN_TEXT, 100);
    }
}
