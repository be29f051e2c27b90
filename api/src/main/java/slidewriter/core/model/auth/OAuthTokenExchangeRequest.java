package slidewriter.core.model.auth;

/**
 * Parameters for exchanging an authorization code at the provider's token endpoint.
 *
 * @param authorizationCode code received on the callback
 * @param codeVerifier      PKCE verifier stored with the authorization state
 * @param redirectUri       redirect URI used in the authorization request
 * @param tokenEndpoint     provider token endpoint URL
 * @param clientId          OAuth client ID
 * @param clientSecret      OAuth client secret
 * @param clientAuthMethod  how the client authenticates
 */
public record OAuthTokenExchangeRequest(
        String authorizationCode,
        String codeVerifier,
        String redirectUri,
        String tokenEndpoint,
        String clientId,
        String clientSecret,
        ClientAuthMethod clientAuthMethod) {

    public OAuthTokenExchangeRequest {
        if (authorizationCode == null || authorizationCode.isBlank()) {
            throw new IllegalArgumentException("Authorization code is required");
        }
        if (codeVerifier == null || codeVerifier.isBlank()) {
            throw new IllegalArgumentException("Code verifier is required");
        }
        if (tokenEndpoint == null || tokenEndpoint.isBlank()) {
            throw new IllegalArgumentException("Token endpoint is required");
        }
        if (clientId == null || clientId.isBlank()) {
            throw new IllegalArgumentException("Client ID is required");
        }
        if (clientAuthMethod == null) {
            clientAuthMethod = ClientAuthMethod.CLIENT_SECRET_POST;
        }
    }

    @Override
    public String toString() {
        return "OAuthTokenExchangeRequest[tokenEndpoint=" + tokenEndpoint + ", clientId=" + clientId
                + ", clientAuthMethod=" + clientAuthMethod + "]";
    }

    /**
     * Client authentication methods for the token endpoint.
     */
    public enum ClientAuthMethod {
        /**
         * client_id:client_secret in an HTTP Basic Authorization header.
         */
        CLIENT_SECRET_BASIC,

        /**
         * client_id and client_secret as form parameters.
         */
        CLIENT_SECRET_POST;

        public static ClientAuthMethod fromConfig(String value) {
            if (value == null || value.isBlank()) {
                return CLIENT_SECRET_POST;
            }
            return valueOf(value.trim().toUpperCase(java.util.Locale.ROOT));
        }
    }
}
