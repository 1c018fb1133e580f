package ai.docsite.richtext.reverse;

/**
 * Runtime exception used to propagate failures of a delegated conversion.
 */
public class ExternalConversionException extends RuntimeException {

    public ExternalConversionException(String message) {
        super(message);
    }

    public ExternalConversionException(String message, Throwable cause) {
        super(message, cause);
    }
}
