package slidewriter.adapter.out.storage;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import slidewriter.core.port.out.AuthorizationStateRepository;
import slidewriter.core.service.auth.AuthorizationStateStorageProviderRegistry;

/**
 * CDI producer for the authorization state repository.
 *
 * <p>Delegates to the {@link AuthorizationStateStorageProviderRegistry}, which
 * selects a {@link slidewriter.spi.AuthorizationStateStorageProvider} by
 * configuration and availability.
 */
@ApplicationScoped
public class AuthorizationStateRepositoryProducer {

    private final AuthorizationStateStorageProviderRegistry registry;

    @Inject
    public AuthorizationStateRepositoryProducer(AuthorizationStateStorageProviderRegistry registry) {
        this.registry = registry;
    }

    @Produces
    @ApplicationScoped
    public AuthorizationStateRepository authorizationStateRepository() {
        return registry.getRepository();
    }
}
