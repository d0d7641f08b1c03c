package io.olmwatch.metrics;

import io.olmwatch.model.Subscription;
import io.olmwatch.model.SubscriptionSpec;
import java.util.Objects;
import java.util.OptionalDouble;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maintains the {@code subscription_sync_total} counter for each subscription.
 * <p>
 * The counter is keyed by (name, installed, channel, package). When any of those values drift,
 * {@link #onReconcile} deletes the series of the previous tuple and records the new one; the
 * next {@link #onSync} starts counting on the new tuple. Subscriptions without a spec are not
 * trackable yet and are ignored by every operation.
 */
public final class SubscriptionSyncMetrics {

    private static final Logger log = LoggerFactory.getLogger(SubscriptionSyncMetrics.class);

    private final CounterFamily syncCounter;
    private final SubscriptionSyncDirectory directory;

    public SubscriptionSyncMetrics(CatalogMetricFamilies families, SubscriptionSyncDirectory directory) {
        this.syncCounter = Objects.requireNonNull(families, "families").subscriptionSyncTotal();
        this.directory = Objects.requireNonNull(directory, "directory");
    }

    public void onSync(Subscription subscription) {
        SubscriptionSpec spec = trackableSpec(subscription);
        if (spec == null) {
            return;
        }
        SubscriptionSyncRecord current = SubscriptionSyncRecord.of(subscription, spec);
        directory.update(subscription.name(), (name, stored) -> {
            syncCounter.increment(current.counterLabels(name));
            return stored != null ? stored : current;
        });
    }

    public void onReconcile(Subscription subscription) {
        SubscriptionSpec spec = trackableSpec(subscription);
        if (spec == null) {
            return;
        }
        SubscriptionSyncRecord current = SubscriptionSyncRecord.of(subscription, spec);
        directory.update(subscription.name(), (name, stored) -> {
            if (current.equals(stored)) {
                return stored;
            }
            if (stored != null) {
                boolean removed = syncCounter.delete(stored.counterLabels(name));
                log.debug("Subscription {} drifted from {} to {}, stale series removed={}",
                    name, stored, current, removed);
            }
            return current;
        });
    }

    /**
     * Delete the counter series of a removed subscription and forget its directory entry. Both
     * the live tuple and the stored tuple are removed, so a drift that was never reconciled does
     * not leave a series behind.
     */
    public void onDelete(Subscription subscription) {
        SubscriptionSpec spec = trackableSpec(subscription);
        if (spec == null) {
            return;
        }
        SubscriptionSyncRecord current = SubscriptionSyncRecord.of(subscription, spec);
        directory.update(subscription.name(), (name, stored) -> {
            syncCounter.delete(current.counterLabels(name));
            if (stored != null && !stored.equals(current)) {
                syncCounter.delete(stored.counterLabels(name));
            }
            return null;
        });
        log.debug("Deleted sync counter for subscription {}", subscription.name());
    }

    /**
     * Current counter value for the subscription's live tuple.
     */
    public OptionalDouble counterValue(Subscription subscription) {
        SubscriptionSpec spec = trackableSpec(subscription);
        if (spec == null) {
            return OptionalDouble.empty();
        }
        return syncCounter.value(SubscriptionSyncRecord.of(subscription, spec).counterLabels(subscription.name()));
    }

    private static SubscriptionSpec trackableSpec(Subscription subscription) {
        if (subscription == null) {
            return null;
        }
        SubscriptionSpec spec = subscription.spec();
        if (spec == null) {
            log.debug("Subscription {}/{} has no spec yet, skipping sync metrics",
                subscription.namespace(), subscription.name());
        }
        return spec;
    }
}
