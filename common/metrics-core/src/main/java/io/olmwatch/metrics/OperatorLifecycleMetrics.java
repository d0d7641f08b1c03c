package io.olmwatch.metrics;

import io.olmwatch.model.ClusterServiceVersion;
import io.olmwatch.model.Subscription;
import java.util.Objects;

/**
 * Entry points called by the reconcile loop. Each call is a fast, idempotent in-memory update;
 * snapshot refresh is the only call that reaches out to the cluster.
 */
public final class OperatorLifecycleMetrics {

    private final SnapshotGauges snapshots;
    private final CsvMetrics csvMetrics;
    private final SubscriptionSyncMetrics subscriptionMetrics;

    public OperatorLifecycleMetrics(SnapshotGauges snapshots,
                                    CsvMetrics csvMetrics,
                                    SubscriptionSyncMetrics subscriptionMetrics) {
        this.snapshots = Objects.requireNonNull(snapshots, "snapshots");
        this.csvMetrics = Objects.requireNonNull(csvMetrics, "csvMetrics");
        this.subscriptionMetrics = Objects.requireNonNull(subscriptionMetrics, "subscriptionMetrics");
    }

    /**
     * @throws io.olmwatch.metrics.ports.ObjectListingException when a kind cannot be listed
     */
    public void refreshSnapshots() {
        snapshots.refreshSnapshots();
    }

    public void onVersionedObjectTransition(ClusterServiceVersion oldCsv, ClusterServiceVersion newCsv) {
        csvMetrics.onTransition(oldCsv, newCsv);
    }

    public void onVersionedObjectDelete(ClusterServiceVersion oldCsv) {
        csvMetrics.onDelete(oldCsv);
    }

    public void onSubscriptionSync(Subscription subscription) {
        subscriptionMetrics.onSync(subscription);
    }

    public void onSubscriptionReconcile(Subscription subscription) {
        subscriptionMetrics.onReconcile(subscription);
    }

    public void onSubscriptionDelete(Subscription subscription) {
        subscriptionMetrics.onDelete(subscription);
    }

    public void incrementUpgradeCounter() {
        csvMetrics.incrementUpgradeCount();
    }
}
