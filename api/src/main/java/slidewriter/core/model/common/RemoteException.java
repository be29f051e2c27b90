package slidewriter.core.model.common;

import java.util.Optional;

/**
 * Failures talking to the remote presentation API.
 *
 * <p>{@link #presentationId()} is present once the presentation has been created,
 * so the client can locate a deck whose batch update outcome is unknown.
 */
public final class RemoteException extends SlideWriterException {

    private final String presentationId;

    private RemoteException(ErrorCode errorCode, String message, String presentationId, Throwable cause) {
        super(errorCode, message, cause);
        this.presentationId = presentationId;
    }

    public static RemoteException unavailable(String detail, Throwable cause) {
        return new RemoteException(ErrorCode.REMOTE_UNAVAILABLE, detail, null, cause);
    }

    public static RemoteException rejected(String detail) {
        return new RemoteException(ErrorCode.REMOTE_REJECTED, detail, null, null);
    }

    public static RemoteException rejected(String detail, String presentationId) {
        return new RemoteException(ErrorCode.REMOTE_REJECTED, detail, presentationId, null);
    }

    public static RemoteException partialApplyUnknown(String presentationId, Throwable cause) {
        return new RemoteException(
                ErrorCode.PARTIAL_APPLY_UNKNOWN,
                "Slide creation outcome is unknown; retrying may duplicate slides",
                presentationId,
                cause);
    }

    public Optional<String> presentationId() {
        return Optional.ofNullable(presentationId);
    }

    public boolean retryMayDuplicate() {
        return errorCode() == ErrorCode.PARTIAL_APPLY_UNKNOWN;
    }
}
