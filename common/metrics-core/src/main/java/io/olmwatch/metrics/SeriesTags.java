package io.olmwatch.metrics;

import io.micrometer.core.instrument.Tags;
import java.util.List;

final class SeriesTags {

    private SeriesTags() {
    }

    static Tags of(MetricDescriptor descriptor, LabelValues labels) {
        List<String> names = descriptor.labelNames();
        Tags tags = Tags.empty();
        for (int i = 0; i < names.size(); i++) {
            tags = tags.and(names.get(i), labels.get(i));
        }
        return tags;
    }
}
