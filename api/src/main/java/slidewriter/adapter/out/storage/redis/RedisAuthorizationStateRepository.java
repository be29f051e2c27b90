package slidewriter.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.config.OAuthConfig;
import slidewriter.core.model.auth.AuthorizationState;
import slidewriter.core.port.out.AuthorizationStateRepository;

/**
 * Redis implementation of authorization state storage.
 *
 * <p>States are stored as JSON with automatic TTL expiration. {@link #consume}
 * uses GETDEL so each state can be read at most once.
 */
public class RedisAuthorizationStateRepository implements AuthorizationStateRepository {

    private static final Logger LOG = Logger.getLogger(RedisAuthorizationStateRepository.class);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ObjectMapper objectMapper;
    private final String keyPrefix;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisAuthorizationStateRepository(
            ReactiveRedisDataSource redisDataSource,
            ObjectMapper objectMapper,
            OAuthConfig config,
            RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.objectMapper = objectMapper;
        this.keyPrefix = config.storage().redis().keyPrefix();
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> store(AuthorizationState state, Duration retention) {
        final var key = keyPrefix + state.stateToken();

        var operation = redisDataSource
                .execute(
                        "SET",
                        key,
                        serialize(state),
                        "NX",
                        "EX",
                        String.valueOf(Math.max(1, retention.toSeconds())))
                .map(response -> {
                    boolean stored = response != null;
                    if (stored) {
                        LOG.debugf("Stored authorization state: %s with retention: %s", state.stateToken(), retention);
                    }
                    return stored;
                });
        return timeoutHelper.withTimeout(operation, "store");
    }

    @Override
    public Uni<Optional<AuthorizationState>> consume(String stateToken) {
        if (stateToken == null || stateToken.isBlank()) {
            return Uni.createFrom().item(Optional.empty());
        }
        final var key = keyPrefix + stateToken;

        // GETDEL (Redis 6.2+) makes retrieve-and-delete atomic
        var operation = valueCommands.getdel(key).map(value -> {
            if (value == null) {
                LOG.debugf("No authorization state found for: %s", stateToken);
                return Optional.<AuthorizationState>empty();
            }
            LOG.debugf("Consumed authorization state: %s", stateToken);
            return Optional.of(deserialize(value));
        });
        return timeoutHelper.withTimeout(operation, "consume");
    }

    private String serialize(AuthorizationState state) {
        try {
            return objectMapper.writeValueAsString(new StoredState(
                    state.stateToken(), state.codeVerifier(), state.createdAt().toEpochMilli()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize authorization state", e);
        }
    }

    private AuthorizationState deserialize(String value) {
        try {
            final var stored = objectMapper.readValue(value, StoredState.class);
            return new AuthorizationState(
                    stored.stateToken(), stored.codeVerifier(), Instant.ofEpochMilli(stored.createdAt()));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Invalid authorization state format", e);
        }
    }

    record StoredState(
            @JsonProperty("state_token") String stateToken,
            @JsonProperty("code_verifier") String codeVerifier,
            @JsonProperty("created_at") long createdAt) {}
}
