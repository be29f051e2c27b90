package slidewriter.adapter.out.storage.memory;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import slidewriter.core.model.session.SessionToken;

@DisplayName("InMemorySessionTokenRepository")
class InMemorySessionTokenRepositoryTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(5);

    private InMemorySessionTokenRepository repository;

    @BeforeEach
    void setUp() {
        repository = new InMemorySessionTokenRepository();
    }

    @AfterEach
    void tearDown() {
        repository.shutdown();
    }

    private static SessionToken token(String id, String accessToken) {
        return new SessionToken(id, accessToken, Instant.now().plus(Duration.ofHours(1)));
    }

    @Nested
    @DisplayName("saveIfAbsent()")
    class SaveTests {

        @Test
        @DisplayName("should store a new session")
        void shouldStore() {
            assertTrue(repository.saveIfAbsent(token("a", "t1"), Duration.ofHours(1)).await().atMost(TIMEOUT));
            assertEquals(1, repository.getSessionCount());
        }

        @Test
        @DisplayName("should keep the existing session on collision")
        void shouldNotOverwrite() {
            repository.saveIfAbsent(token("a", "t1"), Duration.ofHours(1)).await().atMost(TIMEOUT);

            assertFalse(repository.saveIfAbsent(token("a", "t2"), Duration.ofHours(1)).await().atMost(TIMEOUT));
            assertEquals(
                    "t1",
                    repository.findById("a").await().atMost(TIMEOUT).orElseThrow().accessToken());
        }

        @Test
        @DisplayName("should reuse an ID whose retention has passed")
        void shouldReplaceGoneEntry() throws InterruptedException {
            repository.saveIfAbsent(token("a", "t1"), Duration.ofMillis(10)).await().atMost(TIMEOUT);
            Thread.sleep(30);

            assertTrue(repository.saveIfAbsent(token("a", "t2"), Duration.ofHours(1)).await().atMost(TIMEOUT));
        }
    }

    @Test
    @DisplayName("findById() should hide entries past retention")
    void shouldHideExpired() throws InterruptedException {
        repository.saveIfAbsent(token("a", "t1"), Duration.ofMillis(10)).await().atMost(TIMEOUT);
        Thread.sleep(30);

        assertTrue(repository.findById("a").await().atMost(TIMEOUT).isEmpty());
    }

    @Test
    @DisplayName("delete() should remove the session")
    void shouldDelete() {
        repository.saveIfAbsent(token("a", "t1"), Duration.ofHours(1)).await().atMost(TIMEOUT);

        repository.delete("a").await().atMost(TIMEOUT);

        assertTrue(repository.findById("a").await().atMost(TIMEOUT).isEmpty());
        assertEquals(0, repository.getSessionCount());
    }
}
