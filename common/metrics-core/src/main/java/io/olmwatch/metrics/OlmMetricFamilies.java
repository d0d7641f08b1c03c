package io.olmwatch.metrics;

import static io.olmwatch.metrics.MetricLabels.NAME;
import static io.olmwatch.metrics.MetricLabels.NAMESPACE;
import static io.olmwatch.metrics.MetricLabels.PHASE;
import static io.olmwatch.metrics.MetricLabels.REASON;
import static io.olmwatch.metrics.MetricLabels.VERSION;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Series families published by the lifecycle operator: CSV totals, per-CSV install state and
 * the upgrade counter.
 */
public final class OlmMetricFamilies {

    private static final Logger log = LoggerFactory.getLogger(OlmMetricFamilies.class);

    public static final MetricDescriptor CSV_COUNT =
        MetricDescriptor.gauge("csv_count", "Number of CSVs successfully registered");
    public static final MetricDescriptor CSV_SUCCEEDED =
        MetricDescriptor.gauge("csv_succeeded", "Successful CSV install", NAMESPACE, NAME, VERSION);
    public static final MetricDescriptor CSV_ABNORMAL =
        MetricDescriptor.gauge("csv_abnormal", "CSV is not installed", NAMESPACE, NAME, VERSION, PHASE, REASON);
    public static final MetricDescriptor CSV_UPGRADE_COUNT =
        MetricDescriptor.counter("csv_upgrade_count", "Monotonic count of CSV upgrades");

    private final GaugeFamily csvCount;
    private final GaugeFamily csvSucceeded;
    private final GaugeFamily csvAbnormal;
    private final CounterFamily csvUpgradeCount;

    private OlmMetricFamilies(GaugeFamily csvCount,
                              GaugeFamily csvSucceeded,
                              GaugeFamily csvAbnormal,
                              CounterFamily csvUpgradeCount) {
        this.csvCount = csvCount;
        this.csvSucceeded = csvSucceeded;
        this.csvAbnormal = csvAbnormal;
        this.csvUpgradeCount = csvUpgradeCount;
    }

    public static OlmMetricFamilies register(MetricFamilyRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        OlmMetricFamilies families = new OlmMetricFamilies(
            registry.gauge(CSV_COUNT),
            registry.gauge(CSV_SUCCEEDED),
            registry.gauge(CSV_ABNORMAL),
            registry.counter(CSV_UPGRADE_COUNT));
        log.info("Registered OLM metric families {}, {}, {}, {}",
            CSV_COUNT.name(), CSV_SUCCEEDED.name(), CSV_ABNORMAL.name(), CSV_UPGRADE_COUNT.name());
        return families;
    }

    public GaugeFamily csvCount() {
        return csvCount;
    }

    public GaugeFamily csvSucceeded() {
        return csvSucceeded;
    }

    public GaugeFamily csvAbnormal() {
        return csvAbnormal;
    }

    public CounterFamily csvUpgradeCount() {
        return csvUpgradeCount;
    }
}
