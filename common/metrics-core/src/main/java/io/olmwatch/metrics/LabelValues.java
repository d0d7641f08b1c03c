package io.olmwatch.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered label-value tuple identifying one series inside a family. Values line up with the
 * family's declared label names by position; {@code null} values are published as the empty
 * string.
 */
public record LabelValues(List<String> values) {

    private static final LabelValues EMPTY = new LabelValues(List.of());

    public LabelValues {
        if (values == null || values.isEmpty()) {
            values = List.of();
        } else {
            List<String> normalized = new ArrayList<>(values.size());
            for (String value : values) {
                normalized.add(value == null ? "" : value);
            }
            values = Collections.unmodifiableList(normalized);
        }
    }

    public static LabelValues of(String... values) {
        if (values == null || values.length == 0) {
            return EMPTY;
        }
        List<String> list = new ArrayList<>(values.length);
        Collections.addAll(list, values);
        return new LabelValues(list);
    }

    public static LabelValues empty() {
        return EMPTY;
    }

    public int size() {
        return values.size();
    }

    public String get(int index) {
        return values.get(index);
    }
}
