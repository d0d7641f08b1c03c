package io.olmwatch.metrics.ports;

import io.olmwatch.model.ClusterObject;
import io.olmwatch.model.ObjectKind;
import java.util.List;

/**
 * Port used by the snapshot gauges to enumerate cluster objects.
 */
public interface ClusterObjectLister {

    /**
     * List every object of the given kind across all namespaces. Ordering is not significant.
     *
     * @param kind object kind to enumerate
     * @return the objects currently present (never null)
     * @throws ObjectListingException when the objects cannot be listed
     */
    List<? extends ClusterObject> list(ObjectKind kind);
}
