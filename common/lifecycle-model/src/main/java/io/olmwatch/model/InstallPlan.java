package io.olmwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record InstallPlan(ObjectMeta metadata, Spec spec, Status status) implements ClusterObject {

    public InstallPlan {
        metadata = Objects.requireNonNull(metadata, "metadata");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(List<String> clusterServiceVersionNames, String approval, boolean approved) {
        public Spec {
            clusterServiceVersionNames = clusterServiceVersionNames == null
                ? List.of()
                : List.copyOf(clusterServiceVersionNames);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(String phase) {
    }
}
