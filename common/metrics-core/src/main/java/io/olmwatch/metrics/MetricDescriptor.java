package io.olmwatch.metrics;

import java.util.List;
import java.util.Objects;

/**
 * Startup-time description of a series family: its name, help text, kind and label names.
 */
public record MetricDescriptor(String name, String help, Type type, List<String> labelNames) {

    public enum Type {
        GAUGE,
        COUNTER
    }

    public MetricDescriptor {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("name must not be blank");
        }
        help = help == null ? "" : help;
        type = Objects.requireNonNull(type, "type");
        labelNames = labelNames == null ? List.of() : List.copyOf(labelNames);
    }

    public static MetricDescriptor gauge(String name, String help, String... labelNames) {
        return new MetricDescriptor(name, help, Type.GAUGE, List.of(labelNames));
    }

    public static MetricDescriptor counter(String name, String help, String... labelNames) {
        return new MetricDescriptor(name, help, Type.COUNTER, List.of(labelNames));
    }

    void checkArity(LabelValues labels) {
        Objects.requireNonNull(labels, "labels");
        if (labels.size() != labelNames.size()) {
            throw new IllegalArgumentException(
                name + " expects " + labelNames.size() + " label values " + labelNames + " but got " + labels.values());
        }
    }
}
