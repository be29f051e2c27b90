package slidewriter.core.model.common;

/**
 * Base class for every failure the service reports to clients.
 *
 * <p>Each subclass groups one family of failures; the {@link ErrorCode}
 * determines the HTTP status and the stable code sent to the client.
 */
public abstract class SlideWriterException extends RuntimeException {

    private final ErrorCode errorCode;

    protected SlideWriterException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected SlideWriterException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode errorCode() {
        return errorCode;
    }
}
