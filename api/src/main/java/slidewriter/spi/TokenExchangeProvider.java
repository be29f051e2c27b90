package slidewriter.spi;

import io.smallrye.mutiny.Uni;

import slidewriter.core.model.auth.OAuthTokenExchangeRequest;
import slidewriter.core.model.auth.OAuthTokenExchangeResponse;

/**
 * SPI for authorization code exchange implementations.
 *
 * <p>The built-in {@code default} provider (priority 100) performs a standard
 * RFC 6749 code exchange with the PKCE {@code code_verifier}. A provider is
 * chosen by {@code slidewriter.oauth.token-exchange-provider}, falling back to
 * the highest priority available provider.
 *
 * <h2>Custom Implementation Example</h2>
 * <pre>{@code
 * @ApplicationScoped
 * public class BrokeredTokenExchangeProvider implements TokenExchangeProvider {
 *
 *     @Override
 *     public String name() {
 *         return "brokered";
 *     }
 *
 *     @Override
 *     public int priority() {
 *         return 150;
 *     }
 *
 *     @Override
 *     public Uni<OAuthTokenExchangeResponse> exchange(OAuthTokenExchangeRequest request) {
 *         // exchange through a token broker
 *     }
 * }
 * }</pre>
 */
public interface TokenExchangeProvider {

    /**
     * @return Provider name (e.g., "default")
     */
    String name();

    /**
     * @return Priority value (higher = more preferred)
     */
    default int priority() {
        return 0;
    }

    /**
     * @return true if the provider can be used
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Exchange an authorization code for tokens.
     *
     * <p>Any failure (transport, timeout, non-200 status, missing access token)
     * must be reported as {@link slidewriter.core.model.common.AuthException} with
     * code {@code token_exchange_failed}.
     *
     * @param request The token exchange request parameters
     * @return Token exchange response
     */
    Uni<OAuthTokenExchangeResponse> exchange(OAuthTokenExchangeRequest request);
}
