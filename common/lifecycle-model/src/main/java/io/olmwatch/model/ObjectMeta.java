package io.olmwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Identity of a cluster object. Cluster-scoped objects carry an empty namespace.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ObjectMeta(String namespace, String name) {
    public ObjectMeta {
        namespace = namespace == null ? "" : namespace;
        name = name == null ? "" : name;
    }
}
