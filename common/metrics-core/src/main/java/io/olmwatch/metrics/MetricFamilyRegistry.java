package io.olmwatch.metrics;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Registers series families against a {@link MeterRegistry}. A family name can be registered
 * once; a second registration throws {@link DuplicateMetricRegistrationException}.
 */
public final class MetricFamilyRegistry {

    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<String, MetricDescriptor> descriptors = new ConcurrentHashMap<>();

    public MetricFamilyRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public GaugeFamily gauge(MetricDescriptor descriptor) {
        register(descriptor, MetricDescriptor.Type.GAUGE);
        return new GaugeFamily(descriptor, meterRegistry);
    }

    public CounterFamily counter(MetricDescriptor descriptor) {
        register(descriptor, MetricDescriptor.Type.COUNTER);
        return new CounterFamily(descriptor, meterRegistry);
    }

    public Optional<MetricDescriptor> descriptor(String name) {
        return Optional.ofNullable(descriptors.get(name));
    }

    public List<MetricDescriptor> descriptors() {
        return List.copyOf(descriptors.values());
    }

    public MeterRegistry meterRegistry() {
        return meterRegistry;
    }

    private void register(MetricDescriptor descriptor, MetricDescriptor.Type expected) {
        Objects.requireNonNull(descriptor, "descriptor");
        if (descriptor.type() != expected) {
            throw new IllegalArgumentException(
                descriptor.name() + " is declared as " + descriptor.type() + " but registered as " + expected);
        }
        if (descriptors.putIfAbsent(descriptor.name(), descriptor) != null) {
            throw new DuplicateMetricRegistrationException(descriptor.name());
        }
    }
}
