package io.olmwatch.metrics;

/**
 * Raised when a series family name is registered twice. Registration happens while the process
 * starts, so this is never recovered from.
 */
public class DuplicateMetricRegistrationException extends IllegalStateException {

    private final String metricName;

    public DuplicateMetricRegistrationException(String metricName) {
        super("Metric family '" + metricName + "' is already registered");
        this.metricName = metricName;
    }

    public String getMetricName() {
        return metricName;
    }
}
