package io.olmwatch.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Install phase reported in a ClusterServiceVersion status.
 */
public enum CsvPhase {
    NONE(""),
    PENDING("Pending"),
    INSTALL_READY("InstallReady"),
    INSTALLING("Installing"),
    SUCCEEDED("Succeeded"),
    FAILED("Failed"),
    UNKNOWN("Unknown"),
    REPLACING("Replacing"),
    DELETING("Deleting");

    private final String value;

    CsvPhase(String value) {
        this.value = value;
    }

    @JsonValue
    public String value() {
        return value;
    }

    @JsonCreator
    public static CsvPhase fromValue(String value) {
        if (value == null || value.isEmpty()) {
            return NONE;
        }
        for (CsvPhase phase : values()) {
            if (phase.value.equals(value)) {
                return phase;
            }
        }
        return UNKNOWN;
    }
}
