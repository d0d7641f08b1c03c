package io.olmwatch.metrics;

import io.olmwatch.metrics.ports.ClusterObjectLister;
import io.olmwatch.metrics.ports.ObjectListingException;
import io.olmwatch.model.ClusterObject;
import io.olmwatch.model.ObjectKind;
import java.util.List;
import java.util.Objects;

/**
 * Publishes the number of objects of one kind to an unlabelled gauge. Listing failures propagate
 * unchanged and leave the gauge at its previous value.
 */
public final class ObjectCountMetricsProvider implements MetricsProvider {

    private final ObjectKind kind;
    private final ClusterObjectLister lister;
    private final GaugeFamily gauge;

    public ObjectCountMetricsProvider(ObjectKind kind, ClusterObjectLister lister, GaugeFamily gauge) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.lister = Objects.requireNonNull(lister, "lister");
        this.gauge = Objects.requireNonNull(gauge, "gauge");
        if (!gauge.descriptor().labelNames().isEmpty()) {
            throw new IllegalArgumentException(gauge.descriptor().name() + " must not declare labels");
        }
    }

    @Override
    public int refresh() {
        List<? extends ClusterObject> objects = lister.list(kind);
        if (objects == null) {
            throw new ObjectListingException(kind, "Lister returned no result for " + kind.apiKind());
        }
        int count = objects.size();
        gauge.set(LabelValues.empty(), count);
        return count;
    }

    public ObjectKind kind() {
        return kind;
    }

    @Override
    public String toString() {
        return "ObjectCountMetricsProvider[" + kind.apiKind() + " -> " + gauge.descriptor().name() + "]";
    }
}
