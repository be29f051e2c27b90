package slidewriter.core.model.common;

/**
 * The key/value backend could not serve a request.
 */
public final class StorageException extends SlideWriterException {

    private StorageException(String message, Throwable cause) {
        super(ErrorCode.BACKEND_UNAVAILABLE, message, cause);
    }

    public static StorageException backendUnavailable(String operation, Throwable cause) {
        return new StorageException("Storage backend unavailable during " + operation, cause);
    }
}
