package io.olmwatch.metrics;

import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

/**
 * A named family of gauges, one Micrometer gauge per label tuple.
 * <p>
 * The family owns gauge registration and removal so callers only deal in label tuples. Each
 * {@link #set} and {@link #delete} runs inside a per-tuple {@link ConcurrentMap} operation, so
 * a concurrent set and delete on the same tuple never leave a meter registered that the family
 * no longer tracks.
 */
public final class GaugeFamily {

    private final MetricDescriptor descriptor;
    private final MeterRegistry meterRegistry;
    private final ConcurrentMap<LabelValues, Series> series = new ConcurrentHashMap<>();

    GaugeFamily(MetricDescriptor descriptor, MeterRegistry meterRegistry) {
        this.descriptor = Objects.requireNonNull(descriptor, "descriptor");
        this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry");
    }

    public MetricDescriptor descriptor() {
        return descriptor;
    }

    public void set(LabelValues labels, double value) {
        descriptor.checkArity(labels);
        series.compute(labels, (key, existing) -> {
            Series target = existing != null ? existing : register(key);
            target.value().set(value);
            return target;
        });
    }

    /**
     * Remove the series for {@code labels}. Removing a series that does not exist is a no-op.
     *
     * @return {@code true} when a series was removed
     */
    public boolean delete(LabelValues labels) {
        descriptor.checkArity(labels);
        AtomicBoolean removed = new AtomicBoolean(false);
        series.computeIfPresent(labels, (key, existing) -> {
            meterRegistry.remove(existing.gauge());
            removed.set(true);
            return null;
        });
        return removed.get();
    }

    public OptionalDouble value(LabelValues labels) {
        Series current = series.get(labels);
        return current == null ? OptionalDouble.empty() : OptionalDouble.of(current.value().get());
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

    private Series register(LabelValues labels) {
        AtomicReference<Double> holder = new AtomicReference<>(0.0);
        Gauge gauge = Gauge.builder(descriptor.name(), holder, AtomicReference::get)
            .description(descriptor.help())
            .tags(SeriesTags.of(descriptor, labels))
            .register(meterRegistry);
        return new Series(holder, gauge);
    }

    private record Series(AtomicReference<Double> value, Gauge gauge) {
    }
}
