package io.olmwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CatalogSource(ObjectMeta metadata, Spec spec) implements ClusterObject {

    public CatalogSource {
        metadata = Objects.requireNonNull(metadata, "metadata");
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(String sourceType, String image, String displayName) {
    }
}
