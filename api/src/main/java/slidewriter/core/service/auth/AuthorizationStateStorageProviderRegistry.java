package slidewriter.core.service.auth;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import slidewriter.core.config.OAuthConfig;
import slidewriter.core.port.out.AuthorizationStateRepository;
import slidewriter.spi.AuthorizationStateStorageProvider;

/**
 * Registry for authorization state storage providers.
 *
 * <p>Discovers available providers via CDI and selects the appropriate one
 * based on configuration and availability.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (slidewriter.oauth.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class AuthorizationStateStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(AuthorizationStateStorageProviderRegistry.class);

    private final Instance<AuthorizationStateStorageProvider> providers;
    private final OAuthConfig config;

    private volatile AuthorizationStateStorageProvider selectedProvider;
    private volatile AuthorizationStateRepository repository;

    @Inject
    public AuthorizationStateStorageProviderRegistry(
            Instance<AuthorizationStateStorageProvider> providers, OAuthConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider at startup, on a worker thread, instead of on the
     * first callback where the event loop must not block.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Authorization state storage provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the repository from the selected provider.
     *
     * @return Authorization state repository instance
     */
    public synchronized AuthorizationStateRepository getRepository() {
        if (repository == null) {
            repository = getSelectedProvider().createRepository();
        }
        return repository;
    }

    /**
     * Get the selected storage provider.
     *
     * @return Selected provider
     */
    public synchronized AuthorizationStateStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private AuthorizationStateStorageProvider selectProvider() {
        final var configuredProvider = config.storage().provider();
        final var availableProviders = providers.stream()
                .filter(AuthorizationStateStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(AuthorizationStateStorageProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available authorization state storage providers: %s",
                availableProviders.stream()
                        .map(AuthorizationStateStorageProvider::name)
                        .toList());

        Optional<AuthorizationStateStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured authorization state storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf(
                    "Configured authorization state storage provider '%s' is not available, falling back",
                    configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            final var provider = availableProviders.get(0);
            LOG.infof(
                    "Using authorization state storage provider: %s (priority: %d)",
                    provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No authorization state storage providers available");
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return List of available providers
     */
    public List<AuthorizationStateStorageProvider> getAvailableProviders() {
        return providers.stream()
                .filter(AuthorizationStateStorageProvider::isAvailable)
                .toList();
    }
}
