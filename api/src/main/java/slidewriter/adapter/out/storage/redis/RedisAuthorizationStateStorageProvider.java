package slidewriter.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import slidewriter.core.config.OAuthConfig;
import slidewriter.core.config.StorageConfig;
import slidewriter.core.port.out.AuthorizationStateRepository;
import slidewriter.core.port.out.Metrics;
import slidewriter.spi.AuthorizationStateStorageProvider;

/**
 * Redis-based authorization state storage provider.
 *
 * <p>Recommended for production: any instance can serve the callback for an
 * attempt started on another instance.
 */
@ApplicationScoped
public class RedisAuthorizationStateStorageProvider implements AuthorizationStateStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisAuthorizationStateStorageProvider.class);
    private static final int PRIORITY = 100;

    private enum AvailabilityState {
        CHECKING,
        AVAILABLE,
        UNAVAILABLE
    }

    private final ReactiveRedisDataSource redisDataSource;
    private final ObjectMapper objectMapper;
    private final OAuthConfig oauthConfig;
    private final StorageConfig storageConfig;
    private final Metrics metrics;

    private volatile RedisAuthorizationStateRepository repository;
    private final AtomicReference<AvailabilityState> availabilityState =
            new AtomicReference<>(AvailabilityState.CHECKING);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisAuthorizationStateStorageProvider(
            ReactiveRedisDataSource redisDataSource,
            ObjectMapper objectMapper,
            OAuthConfig oauthConfig,
            StorageConfig storageConfig,
            Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.objectMapper = objectMapper;
        this.oauthConfig = oauthConfig;
        this.storageConfig = storageConfig;
        this.metrics = metrics;
    }

    @PostConstruct
    void checkAvailability() {
        redisDataSource
                .key(String.class)
                .exists("test-connection")
                .ifNoItem()
                .after(Duration.ofSeconds(5))
                .fail()
                .subscribe()
                .with(
                        result -> {
                            availabilityState.set(AvailabilityState.AVAILABLE);
                            checkLatch.countDown();
                            LOG.info("Redis authorization state storage is available");
                        },
                        error -> {
                            availabilityState.set(AvailabilityState.UNAVAILABLE);
                            checkLatch.countDown();
                            LOG.warnf("Redis authorization state storage is not available: %s", error.getMessage());
                        });
    }

    @Override
    public String name() {
        return "redis";
    }

    @Override
    public int priority() {
        return PRIORITY;
    }

    @Override
    public boolean isAvailable() {
        try {
            if (!checkLatch.await(6, TimeUnit.SECONDS)) {
                LOG.warn("Redis availability check timed out");
                return false;
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return availabilityState.get() == AvailabilityState.AVAILABLE;
    }

    @Override
    public synchronized AuthorizationStateRepository createRepository() {
        if (repository == null) {
            final var timeoutHelper = new RedisTimeoutHelper(
                    storageConfig.redis().timeout(), metrics, "RedisAuthorizationStateRepository");
            repository = new RedisAuthorizationStateRepository(redisDataSource, objectMapper, oauthConfig, timeoutHelper);
            LOG.infof(
                    "Created Redis authorization state repository with prefix: %s",
                    oauthConfig.storage().redis().keyPrefix());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        final var state = availabilityState.get();
        if (state == AvailabilityState.AVAILABLE) {
            return Optional.of(HealthCheckResponse.named("oauth-state-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", oauthConfig.storage().redis().keyPrefix())
                    .build());
        }
        final var error =
                state == AvailabilityState.CHECKING ? "Availability check in progress" : "Redis not available";
        return Optional.of(HealthCheckResponse.named("oauth-state-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", error)
                .build());
    }
}
