package slidewriter.adapter.in.health;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.util.Optional;

import org.eclipse.microprofile.health.HealthCheckResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import slidewriter.core.service.auth.AuthorizationStateStorageProviderRegistry;
import slidewriter.core.service.session.SessionStorageProviderRegistry;
import slidewriter.spi.AuthorizationStateStorageProvider;
import slidewriter.spi.SessionStorageProvider;

@DisplayName("StorageHealthCheck")
class StorageHealthCheckTest {

    private SessionStorageProvider sessionProvider;
    private AuthorizationStateStorageProvider stateProvider;
    private StorageHealthCheck healthCheck;

    @BeforeEach
    void setUp() {
        sessionProvider = mock(SessionStorageProvider.class);
        stateProvider = mock(AuthorizationStateStorageProvider.class);
        when(sessionProvider.name()).thenReturn("redis");
        when(stateProvider.name()).thenReturn("redis");
        when(sessionProvider.healthCheck()).thenReturn(Optional.empty());
        when(stateProvider.healthCheck()).thenReturn(Optional.empty());

        SessionStorageProviderRegistry sessionRegistry = mock(SessionStorageProviderRegistry.class);
        AuthorizationStateStorageProviderRegistry stateRegistry = mock(AuthorizationStateStorageProviderRegistry.class);
        when(sessionRegistry.getSelectedProvider()).thenReturn(sessionProvider);
        when(stateRegistry.getSelectedProvider()).thenReturn(stateProvider);

        healthCheck = new StorageHealthCheck(sessionRegistry, stateRegistry);
    }

    @Test
    @DisplayName("should be UP when providers report nothing")
    void shouldBeUpWithoutChecks() {
        HealthCheckResponse response = healthCheck.call();

        assertEquals("storage", response.getName());
        assertEquals(HealthCheckResponse.Status.UP, response.getStatus());
        assertEquals("redis", response.getData().orElseThrow().get("session.provider"));
    }

    @Test
    @DisplayName("should be DOWN when a selected provider is DOWN")
    void shouldBeDownWhenProviderDown() {
        when(sessionProvider.healthCheck())
                .thenReturn(Optional.of(
                        HealthCheckResponse.named("session-storage-redis").down().build()));

        HealthCheckResponse response = healthCheck.call();

        assertEquals(HealthCheckResponse.Status.DOWN, response.getStatus());
        assertEquals(false, response.getData().orElseThrow().get("session.up"));
        assertEquals(true, response.getData().orElseThrow().get("oauth-state.up"));
    }
}
