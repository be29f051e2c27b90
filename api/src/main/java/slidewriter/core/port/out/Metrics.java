package slidewriter.core.port.out;

/**
 * Port interface for recording service metrics.
 *
 * <p>Implementations handle the actual metric recording (e.g., Micrometer).
 */
public interface Metrics {

    /**
     * Check if metrics collection is enabled.
     *
     * @return true if enabled
     */
    boolean isEnabled();

    /**
     * Record a started authorization attempt.
     */
    void recordAuthorizationStarted();

    /**
     * Record a completed authorization attempt.
     *
     * @param outcome "success" or the error code of the failure
     */
    void recordAuthorizationCompleted(String outcome);

    /**
     * Record a slide creation request.
     *
     * @param splitterType wire name of the segmentation strategy
     * @param outcome      "success" or the error code of the failure
     * @param slideCount   number of slides requested
     */
    void recordDeckCreation(String splitterType, String outcome, int slideCount);

    /**
     * Record a storage operation that timed out or failed.
     *
     * @param repository repository name
     * @param operation  operation name
     * @param kind       "timeout" or "failure"
     */
    void recordStorageFailure(String repository, String operation, String kind);
}
