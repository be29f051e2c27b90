package slidewriter.adapter.in.health;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.eclipse.microprofile.health.HealthCheck;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.eclipse.microprofile.health.HealthCheckResponseBuilder;
import org.eclipse.microprofile.health.Readiness;

import slidewriter.core.service.auth.AuthorizationStateStorageProviderRegistry;
import slidewriter.core.service.session.SessionStorageProviderRegistry;

/**
 * Readiness of the selected session and authorization state stores.
 *
 * <p>DOWN when either selected provider reports DOWN. Providers without their
 * own check count as UP.
 */
@Readiness
@ApplicationScoped
public class StorageHealthCheck implements HealthCheck {

    private final SessionStorageProviderRegistry sessionRegistry;
    private final AuthorizationStateStorageProviderRegistry stateRegistry;

    @Inject
    public StorageHealthCheck(
            SessionStorageProviderRegistry sessionRegistry, AuthorizationStateStorageProviderRegistry stateRegistry) {
        this.sessionRegistry = sessionRegistry;
        this.stateRegistry = stateRegistry;
    }

    @Override
    public HealthCheckResponse call() {
        final var sessionProvider = sessionRegistry.getSelectedProvider();
        final var stateProvider = stateRegistry.getSelectedProvider();

        final boolean sessionUp = isUp(sessionProvider.healthCheck());
        final boolean stateUp = isUp(stateProvider.healthCheck());

        HealthCheckResponseBuilder builder = HealthCheckResponse.builder()
                .name("storage")
                .withData("session.provider", sessionProvider.name())
                .withData("session.up", sessionUp)
                .withData("oauth-state.provider", stateProvider.name())
                .withData("oauth-state.up", stateUp);

        return builder.status(sessionUp && stateUp).build();
    }

    private static boolean isUp(Optional<HealthCheckResponse> response) {
        return response.map(r -> r.getStatus() == HealthCheckResponse.Status.UP)
                .orElse(true);
    }
}
