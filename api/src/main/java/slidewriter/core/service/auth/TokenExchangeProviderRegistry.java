package slidewriter.core.service.auth;

import java.util.Comparator;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import slidewriter.core.config.OAuthConfig;
import slidewriter.spi.TokenExchangeProvider;

/**
 * Registry for token exchange providers.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (slidewriter.oauth.token-exchange-provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class TokenExchangeProviderRegistry {

    private static final Logger LOG = Logger.getLogger(TokenExchangeProviderRegistry.class);

    private final Instance<TokenExchangeProvider> providers;
    private final OAuthConfig config;

    private volatile TokenExchangeProvider selectedProvider;

    @Inject
    public TokenExchangeProviderRegistry(Instance<TokenExchangeProvider> providers, OAuthConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Get the selected token exchange provider.
     *
     * @return Selected provider
     * @throws IllegalStateException if no providers are available
     */
    public synchronized TokenExchangeProvider getProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private TokenExchangeProvider selectProvider() {
        final var configuredProvider = config.tokenExchangeProvider();
        final var availableProviders = providers.stream()
                .filter(TokenExchangeProvider::isAvailable)
                .sorted(Comparator.comparingInt(TokenExchangeProvider::priority).reversed())
                .toList();

        LOG.debugf(
                "Available token exchange providers: %s",
                availableProviders.stream().map(TokenExchangeProvider::name).toList());

        Optional<TokenExchangeProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured token exchange provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("default")) {
            LOG.warnf("Configured token exchange provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof("Using token exchange provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No token exchange providers available");
    }
}
