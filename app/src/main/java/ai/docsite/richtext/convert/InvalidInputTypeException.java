package ai.docsite.richtext.convert;

/**
 * Raised when a conversion receives something other than text.
 */
public class InvalidInputTypeException extends RuntimeException {

    public InvalidInputTypeException(String message) {
        super(message);
    }
}
