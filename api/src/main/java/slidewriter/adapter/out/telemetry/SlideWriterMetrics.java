package slidewriter.adapter.out.telemetry;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;

import slidewriter.core.config.TelemetryConfig;
import slidewriter.core.port.out.Metrics;

/**
 * Records service metrics using Micrometer.
 *
 * <p>All methods are no-ops when metrics are disabled, so callers never check
 * configuration themselves.
 *
 * <p>Metrics recorded:
 * <ul>
 *   <li>{@code slidewriter.auth.started.total} - Authorization attempts started</li>
 *   <li>{@code slidewriter.auth.completed.total} - Callbacks by outcome</li>
 *   <li>{@code slidewriter.decks.total} - Slide creation requests by splitter and outcome</li>
 *   <li>{@code slidewriter.decks.slides} - Slides per successfully created deck</li>
 *   <li>{@code slidewriter.storage.failures.total} - Storage timeouts and failures</li>
 * </ul>
 */
@ApplicationScoped
public class SlideWriterMetrics implements Metrics {

    private final MeterRegistry registry;
    private final boolean enabled;

    @Inject
    public SlideWriterMetrics(MeterRegistry registry, TelemetryConfig config) {
        this.registry = registry;
        this.enabled = config != null && config.metricsEnabled();
    }

    @Override
    public boolean isEnabled() {
        return enabled;
    }

    @Override
    public void recordAuthorizationStarted() {
        if (!enabled) {
            return;
        }

        Counter.builder("slidewriter.auth.started.total")
                .description("Authorization attempts started")
                .register(registry)
                .increment();
    }

    @Override
    public void recordAuthorizationCompleted(String outcome) {
        if (!enabled) {
            return;
        }

        Counter.builder("slidewriter.auth.completed.total")
                .description("Authorization callbacks by outcome")
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();
    }

    @Override
    public void recordDeckCreation(String splitterType, String outcome, int slideCount) {
        if (!enabled) {
            return;
        }

        Counter.builder("slidewriter.decks.total")
                .description("Slide creation requests")
                .tag("splitter", nullSafe(splitterType))
                .tag("outcome", nullSafe(outcome))
                .register(registry)
                .increment();

        if ("success".equals(outcome)) {
            DistributionSummary.builder("slidewriter.decks.slides")
                    .description("Slides per created deck")
                    .tag("splitter", nullSafe(splitterType))
                    .register(registry)
                    .record(slideCount);
        }
    }

    @Override
    public void recordStorageFailure(String repository, String operation, String kind) {
        if (!enabled) {
            return;
        }

        Counter.builder("slidewriter.storage.failures.total")
                .description("Storage operations that timed out or failed")
                .tag("repository", nullSafe(repository))
                .tag("operation", nullSafe(operation))
                .tag("kind", nullSafe(kind))
                .register(registry)
                .increment();
    }

    private static String nullSafe(String value) {
        return value != null ? value : "unknown";
    }
}
