package io.olmwatch.metrics;

/**
 * Something that can re-count the objects it watches and publish the total.
 */
public interface MetricsProvider {

    /**
     * Re-count and publish.
     *
     * @return the published count
     */
    int refresh();

    static MetricsProvider noop() {
        return NoopMetricsProvider.INSTANCE;
    }
}
