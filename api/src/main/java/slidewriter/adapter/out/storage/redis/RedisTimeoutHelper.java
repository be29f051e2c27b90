package slidewriter.adapter.out.storage.redis;

import java.time.Duration;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import slidewriter.core.model.common.StorageException;
import slidewriter.core.port.out.Metrics;

/**
 * Bounds Redis operations in time and reports their failures uniformly.
 *
 * <p>Sessions and authorization state are both required to serve a request, so
 * there is no graceful degradation: a timeout or a connection/server failure
 * fails the operation with {@link StorageException} and the client receives
 * {@code backend_unavailable}.
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final Metrics metrics;
    private final String repositoryName;

    /**
     * @param timeout        the timeout duration for Redis operations
     * @param metrics        the metrics instance for recording failures (may be null)
     * @param repositoryName the repository name for logging and metrics tagging
     */
    public RedisTimeoutHelper(Duration timeout, Metrics metrics, String repositoryName) {
        this.timeout = timeout;
        this.metrics = metrics;
        this.repositoryName = repositoryName;
    }

    /**
     * Apply the timeout to an operation.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni failing with StorageException on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    record(operationName, "timeout");
                    return StorageException.backendUnavailable(operationName, null);
                })
                .onFailure(e -> !(e instanceof StorageException))
                .transform(e -> {
                    LOG.warnv("Redis operation failure: {0} in {1}: {2}", operationName, repositoryName, e.getMessage());
                    record(operationName, "failure");
                    return StorageException.backendUnavailable(operationName, e);
                });
    }

    private void record(String operationName, String kind) {
        if (metrics != null) {
            metrics.recordStorageFailure(repositoryName, operationName, kind);
        }
    }
}
