package io.olmwatch.metrics;

import io.olmwatch.metrics.ports.ClusterObjectLister;
import io.olmwatch.model.ObjectKind;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateless re-count of current object totals, one provider per {@link ObjectKind}.
 */
public final class SnapshotGauges {

    private static final Logger log = LoggerFactory.getLogger(SnapshotGauges.class);

    private final Map<ObjectKind, MetricsProvider> providers;

    public SnapshotGauges(Map<ObjectKind, MetricsProvider> providers) {
        Objects.requireNonNull(providers, "providers");
        EnumMap<ObjectKind, MetricsProvider> resolved = new EnumMap<>(ObjectKind.class);
        for (ObjectKind kind : ObjectKind.values()) {
            MetricsProvider provider = providers.get(kind);
            resolved.put(kind, provider != null ? provider : MetricsProvider.noop());
        }
        this.providers = Collections.unmodifiableMap(resolved);
    }

    /**
     * Build one counting provider per enabled kind; every other kind gets the no-op provider.
     */
    public static SnapshotGauges create(ClusterObjectLister lister,
                                        OlmMetricFamilies olm,
                                        CatalogMetricFamilies catalog,
                                        Set<ObjectKind> enabledKinds) {
        Objects.requireNonNull(lister, "lister");
        Objects.requireNonNull(olm, "olm");
        Objects.requireNonNull(catalog, "catalog");
        Objects.requireNonNull(enabledKinds, "enabledKinds");
        Map<ObjectKind, MetricsProvider> providers = new EnumMap<>(ObjectKind.class);
        for (ObjectKind kind : enabledKinds) {
            GaugeFamily gauge = switch (kind) {
                case CLUSTER_SERVICE_VERSION -> olm.csvCount();
                case INSTALL_PLAN -> catalog.installPlanCount();
                case SUBSCRIPTION -> catalog.subscriptionCount();
                case CATALOG_SOURCE -> catalog.catalogSourceCount();
            };
            providers.put(kind, new ObjectCountMetricsProvider(kind, lister, gauge));
        }
        return new SnapshotGauges(providers);
    }

    public static SnapshotGauges disabled() {
        return new SnapshotGauges(Map.of());
    }

    /**
     * Refresh the gauge for a single kind.
     *
     * @return the published count
     */
    public int refresh(ObjectKind kind) {
        return provider(kind).refresh();
    }

    /**
     * Refresh every kind. A listing failure does not stop the remaining kinds; the first failure
     * is rethrown once all kinds have been attempted.
     */
    public void refreshSnapshots() {
        RuntimeException firstFailure = null;
        for (Map.Entry<ObjectKind, MetricsProvider> entry : providers.entrySet()) {
            try {
                int count = entry.getValue().refresh();
                log.trace("Snapshot {}={}", entry.getKey(), count);
            } catch (RuntimeException ex) {
                if (firstFailure == null) {
                    firstFailure = ex;
                } else {
                    log.warn("Snapshot refresh for {} failed", entry.getKey(), ex);
                }
            }
        }
        if (firstFailure != null) {
            throw firstFailure;
        }
    }

    public MetricsProvider provider(ObjectKind kind) {
        return providers.get(Objects.requireNonNull(kind, "kind"));
    }
}
