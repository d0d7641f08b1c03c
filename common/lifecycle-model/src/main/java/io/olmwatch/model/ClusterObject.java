package io.olmwatch.model;

/**
 * Common surface of every watched cluster record.
 */
public interface ClusterObject {

    ObjectMeta metadata();

    default String namespace() {
        return metadata().namespace();
    }

    default String name() {
        return metadata().name();
    }
}
