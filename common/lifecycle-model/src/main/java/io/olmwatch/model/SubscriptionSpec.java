package io.olmwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record SubscriptionSpec(@JsonProperty("source") String catalogSource,
                               @JsonProperty("sourceNamespace") String catalogSourceNamespace,
                               @JsonProperty("name") String packageName,
                               String channel,
                               String startingCSV,
                               String installPlanApproval) {
    public SubscriptionSpec {
        packageName = packageName == null ? "" : packageName;
        channel = channel == null ? "" : channel;
    }

    public static SubscriptionSpec of(String packageName, String channel) {
        return new SubscriptionSpec(null, null, packageName, channel, null, null);
    }
}
