package io.olmwatch.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A named family of monotonic counters keyed by label tuple. Deleting a tuple unregisters its
 * counter; a later increment on the same tuple starts again from zero.
 */
public final class CounterFamily {

    private final MetricDescriptor descriptor;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<LabelValues, Counter> series = new ConcurrentHashMap<>();

    CounterFamily(MetricDescriptor descriptor, MeterRegistry meterRegistry) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public MetricDescriptor descriptor() {
        return descriptor;
    }

    public void increment(LabelValues labels) {
        descriptor.checkArity(labels);
        series.compute(labels, (key, existing) -> {
            Counter target = existing != null ? existing : register(key);
            target.increment();
            return target;
        });
    }

    public boolean delete(LabelValues labels) {
        descriptor.checkArity(labels);
        AtomicBoolean removed = new AtomicBoolean(false);
        series.computeIfPresent(labels, (key, existing) -> {
            meterRegistry.remove(existing);
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    public OptionalDouble value(LabelValues labels) {
        Counter current = series.get(labels);
        return current == null ? OptionalDouble.empty() : OptionalDouble.of(current.count());
    }

    public boolean contains(LabelValues labels) {
        return series.containsKey(labels);
    }

    public Set<LabelValues> labelSets() {
        return Set.copyOf(series.keySet());
    }

    public int size() {
        return series.size();
    }

    private Counter register(LabelValues labels) {
        return Counter.builder(descriptor.name())
            .description(descriptor.help())
            .tags(SeriesTags.of(descriptor, labels))
            .register(meterRegistry);
    }
}
