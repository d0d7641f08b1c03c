package io.olmwatch.metrics.spring;

import io.olmwatch.model.ObjectKind;
import java.util.EnumSet;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Switches for the lifecycle metrics. Disabled categories keep their series families registered
 * but their snapshot gauges are never refreshed.
 */
@ConfigurationProperties(prefix = "olm-watch.metrics")
public final class LifecycleMetricsProperties {

    private final boolean enabled;
    private final Olm olm;
    private final Catalog catalog;

    public LifecycleMetricsProperties(Boolean enabled, Olm olm, Catalog catalog) {
        this.enabled = enabled == null || enabled;
        this.olm = olm != null ? olm : new Olm(null);
        this.catalog = catalog != null ? catalog : new Catalog(null);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public Olm getOlm() {
        return olm;
    }

    public Catalog getCatalog() {
        return catalog;
    }

    /**
     * Object kinds whose totals should be counted.
     */
    public Set<ObjectKind> snapshotKinds() {
        Set<ObjectKind> kinds = EnumSet.noneOf(ObjectKind.class);
        if (olm.enabled()) {
            kinds.add(ObjectKind.CLUSTER_SERVICE_VERSION);
        }
        if (catalog.enabled()) {
            kinds.add(ObjectKind.INSTALL_PLAN);
            kinds.add(ObjectKind.SUBSCRIPTION);
            kinds.add(ObjectKind.CATALOG_SOURCE);
        }
        return kinds;
    }

    public static final class Olm {
        private final boolean enabled;

        public Olm(Boolean enabled) {
            this.enabled = enabled == null || enabled;
        }

        public boolean enabled() {
            return enabled;
        }
    }

    public static final class Catalog {
        private final boolean enabled;

        public Catalog(Boolean enabled) {
            this.enabled = enabled == null || enabled;
        }

        public boolean enabled() {
            return enabled;
        }
    }
}
