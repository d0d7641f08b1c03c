package io.olmwatch.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.Objects;

/**
 * A versioned component record: the installed version of an operator together with its
 * install phase and the reason for that phase.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ClusterServiceVersion(ObjectMeta metadata, Spec spec, Status status) implements ClusterObject {

    public ClusterServiceVersion {
        metadata = Objects.requireNonNull(metadata, "metadata");
        spec = spec == null ? new Spec(null, null) : spec;
        status = status == null ? new Status(null, null, null) : status;
    }

    public static ClusterServiceVersion of(String namespace, String name, String version, CsvPhase phase, String reason) {
        return new ClusterServiceVersion(new ObjectMeta(namespace, name), new Spec(version, null), new Status(phase, reason, null));
    }

    /**
     * Copies share the origin's identity labels, so they never publish series of their own.
     */
    public boolean isCopy() {
        return CsvReason.COPIED.equals(status.reason());
    }

    public boolean isSucceeded() {
        return status.phase() == CsvPhase.SUCCEEDED;
    }

    public String versionLabel() {
        return spec.version() == null ? "" : spec.version();
    }

    public String phaseLabel() {
        return status.phase().value();
    }

    public String reasonLabel() {
        return status.reason() == null ? "" : status.reason();
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Spec(String version, String displayName) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Status(CsvPhase phase, String reason, String message) {
        public Status {
            phase = phase == null ? CsvPhase.NONE : phase;
        }
    }
}
