package slidewriter.core.service.session;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;

import io.quarkus.runtime.StartupEvent;
import org.jboss.logging.Logger;

import slidewriter.core.config.SessionConfig;
import slidewriter.core.port.out.SessionTokenRepository;
import slidewriter.spi.SessionStorageProvider;

/**
 * Registry for session storage providers.
 *
 * <p>Selection order:
 * <ol>
 *   <li>Configured provider (slidewriter.session.storage.provider)</li>
 *   <li>Highest priority available provider</li>
 * </ol>
 */
@ApplicationScoped
public class SessionStorageProviderRegistry {

    private static final Logger LOG = Logger.getLogger(SessionStorageProviderRegistry.class);

    private final Instance<SessionStorageProvider> providers;
    private final SessionConfig config;

    private volatile SessionStorageProvider selectedProvider;
    private volatile SessionTokenRepository repository;

    @Inject
    public SessionStorageProviderRegistry(Instance<SessionStorageProvider> providers, SessionConfig config) {
        this.providers = providers;
        this.config = config;
    }

    /**
     * Select the provider during startup rather than lazily during the first
     * request, which may run on the Vert.x event loop where blocking is forbidden.
     */
    void onStart(@Observes StartupEvent event) {
        getSelectedProvider();
        LOG.infof("Session storage provider initialized: %s", selectedProvider.name());
    }

    /**
     * Get the session token repository from the selected provider.
     *
     * @return Session token repository instance
     */
    public synchronized SessionTokenRepository getRepository() {
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
    public synchronized SessionStorageProvider getSelectedProvider() {
        if (selectedProvider == null) {
            selectedProvider = selectProvider();
        }
        return selectedProvider;
    }

    private SessionStorageProvider selectProvider() {
        String configuredProvider = config.storage().provider();
        List<SessionStorageProvider> availableProviders = providers.stream()
                .filter(SessionStorageProvider::isAvailable)
                .sorted(Comparator.comparingInt(SessionStorageProvider::priority)
                        .reversed())
                .toList();

        LOG.debugf(
                "Available session storage providers: %s",
                availableProviders.stream().map(SessionStorageProvider::name).toList());

        Optional<SessionStorageProvider> configured = availableProviders.stream()
                .filter(p -> p.name().equals(configuredProvider))
                .findFirst();

        if (configured.isPresent()) {
            LOG.infof("Using configured session storage provider: %s", configuredProvider);
            return configured.get();
        }

        if (!configuredProvider.equals("memory")) {
            LOG.warnf("Configured session storage provider '%s' is not available, falling back", configuredProvider);
        }

        if (!availableProviders.isEmpty()) {
            SessionStorageProvider provider = availableProviders.get(0);
            LOG.infof("Using session storage provider: %s (priority: %d)", provider.name(), provider.priority());
            return provider;
        }

        throw new IllegalStateException("No session storage providers available");
    }

    /**
     * Get all available providers (for health checks).
     *
     * @return List of available providers
     */
    public List<SessionStorageProvider> getAvailableProviders() {
        return providers.stream().filter(SessionStorageProvider::isAvailable).toList();
    }
}
