package slidewriter.adapter.out.storage.redis;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.eclipse.microprofile.health.HealthCheckResponse;
import org.jboss.logging.Logger;

import slidewriter.core.config.SessionConfig;
import slidewriter.core.config.StorageConfig;
import slidewriter.core.port.out.Metrics;
import slidewriter.core.port.out.SessionTokenRepository;
import slidewriter.spi.SessionStorageProvider;

/**
 * Redis-based session storage provider.
 *
 * <p>This is the recommended provider for production deployments.
 * Sessions are persisted in Redis with automatic TTL expiration.
 */
@ApplicationScoped
public class RedisSessionStorageProvider implements SessionStorageProvider {

    private static final Logger LOG = Logger.getLogger(RedisSessionStorageProvider.class);
    private static final int PRIORITY = 100;

    private final ReactiveRedisDataSource redisDataSource;
    private final ObjectMapper objectMapper;
    private final SessionConfig sessionConfig;
    private final StorageConfig storageConfig;
    private final Metrics metrics;

    private RedisSessionTokenRepository repository;
    private final AtomicBoolean available = new AtomicBoolean(false);
    private final CountDownLatch checkLatch = new CountDownLatch(1);

    @Inject
    public RedisSessionStorageProvider(
            ReactiveRedisDataSource redisDataSource,
            ObjectMapper objectMapper,
            SessionConfig sessionConfig,
            StorageConfig storageConfig,
            Metrics metrics) {
        this.redisDataSource = redisDataSource;
        this.objectMapper = objectMapper;
        this.sessionConfig = sessionConfig;
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
                            available.set(true);
                            checkLatch.countDown();
                            LOG.info("Redis session storage is available");
                        },
                        error -> {
                            available.set(false);
                            checkLatch.countDown();
                            LOG.warnf("Redis session storage is not available: %s", error.getMessage());
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
        return available.get();
    }

    @Override
    public synchronized SessionTokenRepository createRepository() {
        if (repository == null) {
            final var timeoutHelper =
                    new RedisTimeoutHelper(storageConfig.redis().timeout(), metrics, "RedisSessionTokenRepository");
            repository = new RedisSessionTokenRepository(redisDataSource, objectMapper, sessionConfig, timeoutHelper);
            LOG.infof(
                    "Created Redis session repository with prefix: %s",
                    sessionConfig.storage().redis().keyPrefix());
        }
        return repository;
    }

    @Override
    public Optional<HealthCheckResponse> healthCheck() {
        // cached state; health checks must not block
        if (available.get()) {
            return Optional.of(HealthCheckResponse.named("session-storage-redis")
                    .up()
                    .withData("type", "redis")
                    .withData("keyPrefix", sessionConfig.storage().redis().keyPrefix())
                    .build());
        }
        return Optional.of(HealthCheckResponse.named("session-storage-redis")
                .down()
                .withData("type", "redis")
                .withData("error", "Redis not available or check not completed")
                .build());
    }
}
