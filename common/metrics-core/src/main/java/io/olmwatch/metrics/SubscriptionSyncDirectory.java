package io.olmwatch.metrics;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.BiFunction;

/**
 * Directory of subscription name to the {@link SubscriptionSyncRecord} last published for it.
 * <p>
 * One instance is created at startup and shared by reference. {@link #update} runs its
 * transition atomically for the given name, so series changes made inside the transition are
 * serialized with any other update of the same subscription.
 */
public final class SubscriptionSyncDirectory {

    private final ConcurrentMap<String, SubscriptionSyncRecord> records = new ConcurrentHashMap<>();

    public Optional<SubscriptionSyncRecord> lookup(String subscriptionName) {
        if (subscriptionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.get(subscriptionName));
    }

    /**
     * Apply {@code transition} to the stored record for {@code subscriptionName}. The transition
     * receives {@code null} when nothing is stored; returning {@code null} removes the entry.
     *
     * @return the record stored after the transition, if any
     */
    public Optional<SubscriptionSyncRecord> update(
        String subscriptionName,
        BiFunction<String, SubscriptionSyncRecord, SubscriptionSyncRecord> transition) {
        Objects.requireNonNull(subscriptionName, "subscriptionName");
        Objects.requireNonNull(transition, "transition");
        return Optional.ofNullable(records.compute(subscriptionName, transition));
    }

    /**
     * Forget the record for a deleted subscription.
     *
     * @return the record that was stored, if any
     */
    public Optional<SubscriptionSyncRecord> purge(String subscriptionName) {
        if (subscriptionName == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(records.remove(subscriptionName));
    }

    public int size() {
        return records.size();
    }
}
