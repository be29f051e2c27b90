package slidewriter.core.model.auth;

import java.util.Optional;

/**
 * Tokens returned by a successful code exchange.
 *
 * @param accessToken  access token used against the Slides API
 * @param refreshToken refresh token, if granted (never used)
 * @param tokenType    token type, typically "Bearer"
 * @param expiresIn    seconds until the access token expires
 * @param scope        granted scopes
 */
public record OAuthTokenExchangeResponse(
        String accessToken, Optional<String> refreshToken, String tokenType, long expiresIn, Optional<String> scope) {

    private static final long DEFAULT_EXPIRES_IN_SECONDS = 3600L;

    public OAuthTokenExchangeResponse {
        if (accessToken == null || accessToken.isBlank()) {
            throw new IllegalArgumentException("Access token is required");
        }
        if (tokenType == null || tokenType.isBlank()) {
            tokenType = "Bearer";
        }
        if (expiresIn <= 0) {
            expiresIn = DEFAULT_EXPIRES_IN_SECONDS;
        }
        if (refreshToken == null) {
            refreshToken = Optional.empty();
        }
        if (scope == null) {
            scope = Optional.empty();
        }
    }

    @Override
    public String toString() {
        return "OAuthTokenExchangeResponse[tokenType=" + tokenType + ", expiresIn=" + expiresIn + "]";
    }
}
