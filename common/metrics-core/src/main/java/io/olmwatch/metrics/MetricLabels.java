package io.olmwatch.metrics;

/**
 * Label names shared by every lifecycle series. These are part of the published contract and
 * must not change.
 */
public final class MetricLabels {

    public static final String NAME = "name";
    public static final String INSTALLED = "installed";
    public static final String NAMESPACE = "namespace";
    public static final String CHANNEL = "channel";
    public static final String VERSION = "version";
    public static final String PHASE = "phase";
    public static final String REASON = "reason";
    public static final String PACKAGE = "package";

    private MetricLabels() {
    }
}
