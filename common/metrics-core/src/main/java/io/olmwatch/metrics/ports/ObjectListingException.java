package io.olmwatch.metrics.ports;

import io.olmwatch.model.ObjectKind;

/**
 * Signals that a {@link ClusterObjectLister} could not enumerate objects. Usually transient;
 * retrying is up to the caller.
 */
public class ObjectListingException extends RuntimeException {

    private final ObjectKind kind;

    public ObjectListingException(ObjectKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ObjectListingException(ObjectKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ObjectKind getKind() {
        return kind;
    }
}
