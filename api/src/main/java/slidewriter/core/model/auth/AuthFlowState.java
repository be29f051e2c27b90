package slidewriter.core.model.auth;

import slidewriter.core.model.session.SessionToken;

/**
 * Session-establishment state of a single browser.
 *
 * <p>Legal transitions:
 * <pre>
 * NoSession     --start(state)-------&gt; Pending
 * Pending       --complete(session)--&gt; Authenticated
 * Pending       --reject()-----------&gt; NoSession
 * Authenticated --expire()-----------&gt; NoSession
 * </pre>
 * Every other transition throws {@link IllegalStateException}.
 */
public sealed interface AuthFlowState {

    String name();

    default Pending start(String stateToken) {
        throw illegal("start");
    }

    default Authenticated complete(SessionToken session) {
        throw illegal("complete");
    }

    default AuthFlowState reject() {
        throw illegal("reject");
    }

    default AuthFlowState expire() {
        throw illegal("expire");
    }

    private IllegalStateException illegal(String transition) {
        return new IllegalStateException("Cannot " + transition + " from state " + name());
    }

    static AuthFlowState initial() {
        return new NoSession();
    }

    record NoSession() implements AuthFlowState {
        @Override
        public String name() {
            return "NO_SESSION";
        }

        @Override
        public Pending start(String stateToken) {
            return new Pending(stateToken);
        }
    }

    record Pending(String stateToken) implements AuthFlowState {
        public Pending {
            if (stateToken == null || stateToken.isBlank()) {
                throw new IllegalArgumentException("State token cannot be null or blank");
            }
        }

        @Override
        public String name() {
            return "PENDING";
        }

        @Override
        public Authenticated complete(SessionToken session) {
            return new Authenticated(session);
        }

        @Override
        public AuthFlowState reject() {
            return new NoSession();
        }
    }

    record Authenticated(SessionToken session) implements AuthFlowState {
        public Authenticated {
            if (session == null) {
                throw new IllegalArgumentException("Session cannot be null");
            }
        }

        public String sessionId() {
            return session.sessionId();
        }

        @Override
        public String name() {
            return "AUTHENTICATED";
        }

        @Override
        public AuthFlowState expire() {
            return new NoSession();
        }
    }
}
