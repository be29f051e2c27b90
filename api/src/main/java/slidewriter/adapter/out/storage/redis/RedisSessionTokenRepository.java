package slidewriter.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.config.SessionConfig;
import slidewriter.core.model.session.SessionToken;
import slidewriter.core.port.out.SessionTokenRepository;

/**
 * Redis implementation of SessionTokenRepository.
 *
 * <p>Tokens are stored as JSON under {@code <prefix><sessionId>} with a Redis TTL.
 * Inserts use {@code SET NX EX} so an existing session is never overwritten.
 */
public class RedisSessionTokenRepository implements SessionTokenRepository {

    private static final Logger LOG = Logger.getLogger(RedisSessionTokenRepository.class);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSessionTokenRepository(
            ReactiveRedisDataSource redisDataSource,
            ObjectMapper objectMapper,
            SessionConfig config,
            RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.objectMapper = objectMapper;
        this.keyPrefix = config.storage().redis().keyPrefix();
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> saveIfAbsent(SessionToken token, Duration ttl) {
        String key = keyPrefix + token.sessionId();
        String value = serialize(token);

        // SET ... NX replies nil when the key exists
        var operation = redisDataSource
                .execute("SET", key, value, "NX", "EX", String.valueOf(Math.max(1, ttl.toSeconds())))
                .map(response -> {
                    if (response != null) {
                        LOG.debugf("Session stored in Redis: %s", token.sessionId());
                        return true;
                    }
                    LOG.debugf("Session ID collision in Redis: %s", token.sessionId());
                    return false;
                });
        return timeoutHelper.withTimeout(operation, "saveIfAbsent");
    }

    @Override
    public Uni<Optional<SessionToken>> findById(String sessionId) {
        String key = keyPrefix + sessionId;

        var operation = valueCommands.get(key).map(value -> {
            if (value == null) {
                return Optional.<SessionToken>empty();
            }
            return Optional.of(deserialize(value));
        });
        return timeoutHelper.withTimeout(operation, "findById");
    }

    @Override
    public Uni<Void> delete(String sessionId) {
        var operation = keyCommands.del(keyPrefix + sessionId).replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "delete");
    }

    private String serialize(SessionToken token) {
        try {
            return objectMapper.writeValueAsString(new StoredSession(
                    token.sessionId(), token.accessToken(), token.expiresAt().toEpochMilli()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize session " + token.sessionId(), e);
        }
    }

    private SessionToken deserialize(String value) {
        try {
            final var stored = objectMapper.readValue(value, StoredSession.class);
            return new SessionToken(stored.sessionId(), stored.accessToken(), Instant.ofEpochMilli(stored.expiresAt()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid session format", e);
        }
    }

    record StoredSession(
            @JsonProperty("session_id") String sessionId,
            @JsonProperty("access_token") String accessToken,
            @JsonProperty("expires_at") long expiresAt) {}
}
