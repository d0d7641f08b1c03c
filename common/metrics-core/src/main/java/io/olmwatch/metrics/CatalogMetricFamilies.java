package io.olmwatch.metrics;

import static io.olmwatch.metrics.MetricLabels.CHANNEL;
import static io.olmwatch.metrics.MetricLabels.INSTALLED;
import static io.olmwatch.metrics.MetricLabels.NAME;
import static io.olmwatch.metrics.MetricLabels.PACKAGE;

import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Series families published by the catalog operator: install plan, subscription and catalog
 * source totals, and the per-subscription sync counter.
 */
public final class CatalogMetricFamilies {

    private static final Logger log = LoggerFactory.getLogger(CatalogMetricFamilies.class);

    public static final MetricDescriptor INSTALL_PLAN_COUNT =
        MetricDescriptor.gauge("install_plan_count", "Number of install plans");
    public static final MetricDescriptor SUBSCRIPTION_COUNT =
        MetricDescriptor.gauge("subscription_count", "Number of subscriptions");
    public static final MetricDescriptor CATALOG_SOURCE_COUNT =
        MetricDescriptor.gauge("catalog_source_count", "Number of catalog sources");
    public static final MetricDescriptor SUBSCRIPTION_SYNC_TOTAL =
        MetricDescriptor.counter("subscription_sync_total", "Monotonic count of subscription syncs",
            NAME, INSTALLED, CHANNEL, PACKAGE);

    private final GaugeFamily installPlanCount;
    private final GaugeFamily subscriptionCount;
    private final GaugeFamily catalogSourceCount;
    private final CounterFamily subscriptionSyncTotal;

    private CatalogMetricFamilies(GaugeFamily installPlanCount,
                                  GaugeFamily subscriptionCount,
                                  GaugeFamily catalogSourceCount,
                                  CounterFamily subscriptionSyncTotal) {
        this.installPlanCount = installPlanCount;
        this.subscriptionCount = subscriptionCount;
        this.catalogSourceCount = catalogSourceCount;
        this.subscriptionSyncTotal = subscriptionSyncTotal;
    }

    public static CatalogMetricFamilies register(MetricFamilyRegistry registry) {
        Objects.requireNonNull(registry, "registry");
        CatalogMetricFamilies families = new CatalogMetricFamilies(
            registry.gauge(INSTALL_PLAN_COUNT),
            registry.gauge(SUBSCRIPTION_COUNT),
            registry.gauge(CATALOG_SOURCE_COUNT),
            registry.counter(SUBSCRIPTION_SYNC_TOTAL));
        log.info("Registered catalog metric families {}, {}, {}, {}",
            INSTALL_PLAN_COUNT.name(), SUBSCRIPTION_COUNT.name(), CATALOG_SOURCE_COUNT.name(),
            SUBSCRIPTION_SYNC_TOTAL.name());
        return families;
    }

    public GaugeFamily installPlanCount() {
        return installPlanCount;
    }

    public GaugeFamily subscriptionCount() {
        return subscriptionCount;
    }

    public GaugeFamily catalogSourceCount() {
        return catalogSourceCount;
    }

    public CounterFamily subscriptionSyncTotal() {
        return subscriptionSyncTotal;
    }
}
