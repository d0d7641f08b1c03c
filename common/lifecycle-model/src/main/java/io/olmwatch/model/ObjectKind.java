package io.olmwatch.model;

/**
 * Object kinds whose totals are published as snapshot gauges.
 */
public enum ObjectKind {
    CLUSTER_SERVICE_VERSION("ClusterServiceVersion"),
    INSTALL_PLAN("InstallPlan"),
    SUBSCRIPTION("Subscription"),
    CATALOG_SOURCE("CatalogSource");

    private final String apiKind;

    ObjectKind(String apiKind) {
        this.apiKind = apiKind;
    }

    public String apiKind() {
        return apiKind;
    }
}
