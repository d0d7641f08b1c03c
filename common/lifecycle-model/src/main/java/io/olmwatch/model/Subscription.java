package io.olmwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;
import java.util.Optional;

/**
 * A request to keep a package installed from a catalog channel. The spec is absent until the
 * object has been fully admitted, and consumers treat such objects as not yet trackable.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Subscription(ObjectMeta metadata, SubscriptionSpec spec, Status status) implements ClusterObject {

    public Subscription {
        metadata = Objects.requireNonNull(metadata, "metadata");
        status = status == null ? new Status(null, null, null) : status;
    }

    public Optional<SubscriptionSpec> specIfPresent() {
        return Optional.ofNullable(spec);
    }

    public String installedCsvLabel() {
        return status.installedCsv() == null ? "" : status.installedCsv();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(@JsonProperty("installedCSV") String installedCsv,
                         @JsonProperty("currentCSV") String currentCsv,
                         String state) {
    }
}
