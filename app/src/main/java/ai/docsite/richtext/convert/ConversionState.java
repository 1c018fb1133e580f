package ai.docsite.richtext.convert;

/**
 * Lifecycle of one conversion call.
 */
public enum ConversionState {
    UNCONVERTED,
    DETECTING,
    CONVERTING,
    CONVERTED,
    VALIDATED,
    REJECTED
}
