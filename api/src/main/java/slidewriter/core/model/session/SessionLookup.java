package slidewriter.core.model.session;

/**
 * Outcome of resolving a session ID.
 */
public sealed interface SessionLookup {

    /**
     * A live session.
     */
    record Found(SessionToken token) implements SessionLookup {}

    /**
     * The session exists but its expiry has passed. Never usable.
     */
    record Expired(SessionToken token) implements SessionLookup {}

    /**
     * No session is stored under this ID.
     */
    record NotFound(String sessionId) implements SessionLookup {}
}
