package io.olmwatch.metrics;

import io.olmwatch.model.ClusterServiceVersion;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Keeps the per-CSV install series in step with observed CSV transitions.
 * <p>
 * Every CSV publishes a success gauge keyed by (namespace, name, version) and, while it is not
 * succeeded, an abnormal gauge keyed by (namespace, name, version, phase, reason). Each
 * transition removes the abnormal series of the previous state before publishing the new one,
 * so at most one abnormal series exists per CSV. Deletes of absent series are no-ops because
 * the watch can redeliver or reorder updates.
 */
public final class CsvMetrics {

    private static final Logger log = LoggerFactory.getLogger(CsvMetrics.class);

    private final OlmMetricFamilies families;

    public CsvMetrics(OlmMetricFamilies families) {
        this.families = Objects.requireNonNull(families, "families");
    }

    public void onTransition(ClusterServiceVersion oldCsv, ClusterServiceVersion newCsv) {
        if (oldCsv == null || newCsv == null) {
            return;
        }
        if (newCsv.isCopy()) {
            log.debug("Skipping metrics for copied CSV {}/{}", newCsv.namespace(), newCsv.name());
            return;
        }

        families.csvAbnormal().delete(abnormalLabels(oldCsv));

        if (newCsv.isSucceeded()) {
            families.csvSucceeded().set(succeededLabels(newCsv), 1);
        } else {
            families.csvSucceeded().set(succeededLabels(newCsv), 0);
            families.csvAbnormal().set(abnormalLabels(newCsv), 1);
        }
    }

    public void onDelete(ClusterServiceVersion oldCsv) {
        if (oldCsv == null) {
            return;
        }
        boolean abnormal = families.csvAbnormal().delete(abnormalLabels(oldCsv));
        boolean succeeded = families.csvSucceeded().delete(succeededLabels(oldCsv));
        if (log.isDebugEnabled()) {
            log.debug("Deleted CSV series for {}/{} version={} abnormal={} succeeded={}",
                oldCsv.namespace(), oldCsv.name(), oldCsv.versionLabel(), abnormal, succeeded);
        }
    }

    public void incrementUpgradeCount() {
        families.csvUpgradeCount().increment(LabelValues.empty());
    }

    static LabelValues succeededLabels(ClusterServiceVersion csv) {
        return LabelValues.of(csv.namespace(), csv.name(), csv.versionLabel());
    }

    static LabelValues abnormalLabels(ClusterServiceVersion csv) {
        return LabelValues.of(csv.namespace(), csv.name(), csv.versionLabel(), csv.phaseLabel(), csv.reasonLabel());
    }
}
