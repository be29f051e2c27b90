package slidewriter.core.model.common;

/**
 * Client input that cannot be processed.
 */
public final class ValidationException extends SlideWriterException {

    private ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
    }

    public static ValidationException invalidConfig(String detail) {
        return new ValidationException(ErrorCode.INVALID_CONFIG, detail);
    }

    public static ValidationException malformedRequest(String detail) {
        return new ValidationException(ErrorCode.MALFORMED_REQUEST, detail);
    }
}
