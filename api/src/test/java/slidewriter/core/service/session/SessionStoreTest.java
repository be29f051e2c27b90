package slidewriter.core.service.session;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import slidewriter.adapter.out.storage.memory.InMemorySessionTokenRepository;
import slidewriter.core.config.SessionConfig;
import slidewriter.core.model.session.SessionLookup;
import slidewriter.core.model.session.SessionToken;
import slidewriter.core.port.out.SessionTokenRepository;

@DisplayName("SessionStore")
class SessionStoreTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemorySessionTokenRepository repository;
    private SessionStorageProviderRegistry registry;
    private SessionIdGenerator idGenerator;
    private SessionStore store;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionTokenRepository();
        registry = mock(SessionStorageProviderRegistry.class);
        when(registry.getRepository()).thenReturn(repository);

        SessionConfig config = mock(SessionConfig.class);
        SessionConfig.IdGenerationConfig idGeneration = mock(SessionConfig.IdGenerationConfig.class);
        when(config.idGeneration()).thenReturn(idGeneration);
        when(idGeneration.maxRetries()).thenReturn(3);

        idGenerator = new SessionIdGenerator();
        store = new SessionStore(registry, idGenerator, config);
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    @Nested
    @DisplayName("create()")
    class CreateTests {

        @Test
        @DisplayName("should store a token that can be resolved")
        void shouldCreateAndResolve() {
            var token = store.create("access-1", Duration.ofHours(1)).await().atMost(TIMEOUT);

            var lookup = store.get(token.sessionId()).await().atMost(TIMEOUT);

            var found = assertInstanceOf(SessionLookup.Found.class, lookup);
            assertEquals("access-1", found.token().accessToken());
            assertTrue(token.expiresAt().isAfter(Instant.now().plus(Duration.ofMinutes(59))));
        }

        @Test
        @DisplayName("should issue a different ID for every session")
        void shouldUseUniqueIds() {
            var first = store.create("a", Duration.ofHours(1)).await().atMost(TIMEOUT);
            var second = store.create("a", Duration.ofHours(1)).await().atMost(TIMEOUT);

            assertNotEquals(first.sessionId(), second.sessionId());
        }

        @Test
        @DisplayName("should retry with a new ID on collision")
        void shouldRetryOnCollision() {
            SessionIdGenerator fixed = mock(SessionIdGenerator.class);
            when(fixed.generate()).thenReturn("taken", "free");
            var retrying = new SessionStore(registry, fixed, configWithRetries(3));
            store.put(new SessionToken("taken", "x", Instant.now().plusSeconds(60)), Duration.ofMinutes(1))
                    .await()
                    .atMost(TIMEOUT);

            var token = retrying.create("access", Duration.ofHours(1)).await().atMost(TIMEOUT);

            assertEquals("free", token.sessionId());
            verify(fixed, times(2)).generate();
        }

        @Test
        @DisplayName("should give up after the configured number of collisions")
        void shouldFailAfterRetries() {
            SessionTokenRepository full = mock(SessionTokenRepository.class);
            when(full.saveIfAbsent(any(), any())).thenReturn(Uni.createFrom().item(false));
            SessionStorageProviderRegistry fullRegistry = mock(SessionStorageProviderRegistry.class);
            when(fullRegistry.getRepository()).thenReturn(full);
            var exhausted = new SessionStore(fullRegistry, idGenerator, configWithRetries(2));

            assertThrows(
                    IllegalStateException.class,
                    () -> exhausted.create("access", Duration.ofHours(1)).await().atMost(TIMEOUT));
            verify(full, times(2)).saveIfAbsent(any(), any());
        }

        @Test
        @DisplayName("should reject a non-positive TTL")
        void shouldRejectZeroTtl() {
            assertThrows(
                    IllegalArgumentException.class,
                    () -> store.create("access", Duration.ZERO).await().atMost(TIMEOUT));
        }
    }

    @Nested
    @DisplayName("get()")
    class GetTests {

        @Test
        @DisplayName("should report a missing cookie as not found")
        void shouldHandleNullId() {
            assertInstanceOf(SessionLookup.NotFound.class, store.get(null).await().atMost(TIMEOUT));
            assertInstanceOf(SessionLookup.NotFound.class, store.get("  ").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report an unknown ID as not found")
        void shouldHandleUnknownId() {
            assertInstanceOf(SessionLookup.NotFound.class, store.get("unknown").await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should report an expired token and delete it")
        void shouldExpireAndDelete() {
            SessionTokenRepository stale = mock(SessionTokenRepository.class);
            var expired = new SessionToken("old", "x", Instant.now().minusSeconds(1));
            when(stale.findById("old")).thenReturn(Uni.createFrom().item(Optional.of(expired)));
            when(stale.delete("old")).thenReturn(Uni.createFrom().voidItem());
            SessionStorageProviderRegistry staleRegistry = mock(SessionStorageProviderRegistry.class);
            when(staleRegistry.getRepository()).thenReturn(stale);
            var staleStore = new SessionStore(staleRegistry, idGenerator, configWithRetries(3));

            var lookup = staleStore.get("old").await().atMost(TIMEOUT);

            var result = assertInstanceOf(SessionLookup.Expired.class, lookup);
            assertEquals("old", result.token().sessionId());
            verify(stale, timeout(1000)).delete("old");
        }
    }

    @Nested
    @DisplayName("invalidate()")
    class InvalidateTests {

        @Test
        @DisplayName("should make the session unresolvable")
        void shouldDelete() {
            var token = store.create("access", Duration.ofHours(1)).await().atMost(TIMEOUT);

            store.invalidate(token.sessionId()).await().atMost(TIMEOUT);

            assertInstanceOf(
                    SessionLookup.NotFound.class, store.get(token.sessionId()).await().atMost(TIMEOUT));
        }

        @Test
        @DisplayName("should ignore a missing session ID")
        void shouldIgnoreNull() {
            SessionTokenRepository untouched = mock(SessionTokenRepository.class);
            SessionStorageProviderRegistry untouchedRegistry = mock(SessionStorageProviderRegistry.class);
            when(untouchedRegistry.getRepository()).thenReturn(untouched);

            new SessionStore(untouchedRegistry, idGenerator, configWithRetries(3))
                    .invalidate(null)
                    .await()
                    .atMost(TIMEOUT);

            verify(untouched, never()).delete(anyString());
        }
    }

    private static SessionConfig configWithRetries(int retries) {
        SessionConfig config = mock(SessionConfig.class);
        SessionConfig.IdGenerationConfig idGeneration = mock(SessionConfig.IdGenerationConfig.class);
        when(config.idGeneration()).thenReturn(idGeneration);
        when(idGeneration.maxRetries()).thenReturn(retries);
        return config;
    }
}
