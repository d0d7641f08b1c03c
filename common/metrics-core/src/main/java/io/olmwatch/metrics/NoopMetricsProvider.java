package io.olmwatch.metrics;

/**
 * Provider for disabled categories: publishes nothing.
 */
final class NoopMetricsProvider implements MetricsProvider {

    static final NoopMetricsProvider INSTANCE = new NoopMetricsProvider();

    private NoopMetricsProvider() {
    }

    @Override
    public int refresh() {
        return 0;
    }

    @Override
    public String toString() {
        return "NoopMetricsProvider";
    }
}
