package io.olmwatch.metrics;

import io.olmwatch.model.Subscription;
import io.olmwatch.model.SubscriptionSpec;

/**
 * The label values last used for a subscription's sync counter.
 */
public record SubscriptionSyncRecord(String installedCsv, String packageName, String channel) {

    public SubscriptionSyncRecord {
        installedCsv = installedCsv == null ? "" : installedCsv;
        packageName = packageName == null ? "" : packageName;
        channel = channel == null ? "" : channel;
    }

    /**
     * Read the current tuple from a subscription whose spec is present.
     */
    static SubscriptionSyncRecord of(Subscription subscription, SubscriptionSpec spec) {
        return new SubscriptionSyncRecord(subscription.installedCsvLabel(), spec.packageName(), spec.channel());
    }

    LabelValues counterLabels(String subscriptionName) {
        return LabelValues.of(subscriptionName, installedCsv, channel, packageName);
    }
}
