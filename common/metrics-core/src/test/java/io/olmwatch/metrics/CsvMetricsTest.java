package io.olmwatch.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.olmwatch.model.ClusterServiceVersion;
import io.olmwatch.model.CsvPhase;
import io.olmwatch.model.CsvReason;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

class CsvMetricsTest {

    private SimpleMeterRegistry meterRegistry;
    private OlmMetricFamilies families;
    private CsvMetrics metrics;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        families = OlmMetricFamilies.register(new MetricFamilyRegistry(meterRegistry));
        metrics = new CsvMetrics(families);
    }

    @Test
    void succeededTransitionPublishesSuccessAndNoAbnormalSeries() {
        ClusterServiceVersion installing = csv(CsvPhase.INSTALLING, CsvReason.REQUIREMENTS_MET);
        metrics.onTransition(csv(CsvPhase.PENDING, CsvReason.REQUIREMENTS_UNKNOWN), installing);

        metrics.onTransition(installing, csv(CsvPhase.SUCCEEDED, CsvReason.INSTALL_SUCCESSFUL));

        assertThat(families.csvSucceeded().value(LabelValues.of("operators", "etcd.v0.9.4", "0.9.4"))).hasValue(1.0);
        assertThat(families.csvAbnormal().size()).isZero();
        assertThat(meterRegistry.find("csv_abnormal").gauges()).isEmpty();
    }

    @ParameterizedTest
    @EnumSource(value = CsvPhase.class, names = "SUCCEEDED", mode = EnumSource.Mode.EXCLUDE)
    void nonSuccessTransitionPublishesExactlyOneAbnormalSeries(CsvPhase phase) {
        ClusterServiceVersion pending = csv(CsvPhase.PENDING, CsvReason.REQUIREMENTS_UNKNOWN);
        metrics.onTransition(csv(CsvPhase.NONE, null), pending);

        metrics.onTransition(pending, csv(phase, CsvReason.COMPONENT_FAILED));

        assertThat(families.csvSucceeded().value(LabelValues.of("operators", "etcd.v0.9.4", "0.9.4"))).hasValue(0.0);
        assertThat(families.csvAbnormal().labelSets()).containsExactly(
            LabelValues.of("operators", "etcd.v0.9.4", "0.9.4", phase.value(), CsvReason.COMPONENT_FAILED));
        assertThat(meterRegistry.get("csv_abnormal").tag("phase", phase.value()).gauge().value()).isEqualTo(1.0);
    }

    @Test
    void recoveryFromFailureRemovesAbnormalSeries() {
        ClusterServiceVersion failed = csv(CsvPhase.FAILED, CsvReason.INSTALL_CHECK_FAILED);
        metrics.onTransition(csv(CsvPhase.INSTALLING, CsvReason.REQUIREMENTS_MET), failed);
        assertThat(families.csvAbnormal().size()).isEqualTo(1);

        metrics.onTransition(failed, csv(CsvPhase.SUCCEEDED, CsvReason.INSTALL_SUCCESSFUL));

        assertThat(families.csvAbnormal().size()).isZero();
        assertThat(families.csvSucceeded().value(LabelValues.of("operators", "etcd.v0.9.4", "0.9.4"))).hasValue(1.0);
    }

    @Test
    void copiedCsvChangesNoSeries() {
        ClusterServiceVersion failed = csv(CsvPhase.FAILED, CsvReason.INSTALL_CHECK_FAILED);
        metrics.onTransition(csv(CsvPhase.INSTALLING, CsvReason.REQUIREMENTS_MET), failed);

        ClusterServiceVersion copy = ClusterServiceVersion.of(
            "tenant-a", "etcd.v0.9.4", "0.9.4", CsvPhase.SUCCEEDED, CsvReason.COPIED);
        metrics.onTransition(failed, copy);

        assertThat(families.csvAbnormal().labelSets()).containsExactly(
            LabelValues.of("operators", "etcd.v0.9.4", "0.9.4", "Failed", CsvReason.INSTALL_CHECK_FAILED));
        assertThat(families.csvSucceeded().labelSets()).containsExactly(
            LabelValues.of("operators", "etcd.v0.9.4", "0.9.4"));
        assertThat(families.csvSucceeded().value(LabelValues.of("operators", "etcd.v0.9.4", "0.9.4"))).hasValue(0.0);
    }

    @Test
    void missingArgumentsAreIgnored() {
        metrics.onTransition(null, csv(CsvPhase.FAILED, CsvReason.COMPONENT_FAILED));
        metrics.onTransition(csv(CsvPhase.FAILED, CsvReason.COMPONENT_FAILED), null);
        metrics.onDelete(null);

        assertThat(meterRegistry.getMeters()).isEmpty();
    }

    @Test
    void deleteIsIdempotent() {
        ClusterServiceVersion failed = csv(CsvPhase.FAILED, CsvReason.COMPONENT_FAILED);
        metrics.onTransition(csv(CsvPhase.INSTALLING, CsvReason.REQUIREMENTS_MET), failed);

        metrics.onDelete(failed);
        metrics.onDelete(failed);

        assertThat(families.csvSucceeded().size()).isZero();
        assertThat(families.csvAbnormal().size()).isZero();
        assertThat(meterRegistry.getMeters()).isEmpty();
    }

    @Test
    void redeliveredTransitionKeepsSingleAbnormalSeries() {
        ClusterServiceVersion installing = csv(CsvPhase.INSTALLING, CsvReason.REQUIREMENTS_MET);
        ClusterServiceVersion failed = csv(CsvPhase.FAILED, CsvReason.COMPONENT_FAILED);

        metrics.onTransition(installing, failed);
        metrics.onTransition(installing, failed);
        metrics.onTransition(failed, failed);

        assertThat(families.csvAbnormal().size()).isEqualTo(1);
    }

    @Test
    void versionsAreTrackedIndependently() {
        ClusterServiceVersion v1 = ClusterServiceVersion.of(
            "operators", "etcd.v0.9.4", "0.9.4", CsvPhase.SUCCEEDED, CsvReason.INSTALL_SUCCESSFUL);
        ClusterServiceVersion v2 = ClusterServiceVersion.of(
            "operators", "etcd.v0.9.5", "0.9.5", CsvPhase.PENDING, CsvReason.REQUIREMENTS_UNKNOWN);

        metrics.onTransition(v1, v1);
        metrics.onTransition(v2, v2);
        metrics.onDelete(v1);

        assertThat(families.csvSucceeded().labelSets()).containsExactly(
            LabelValues.of("operators", "etcd.v0.9.5", "0.9.5"));
    }

    @Test
    void upgradeCounterIncrements() {
        metrics.incrementUpgradeCount();
        metrics.incrementUpgradeCount();

        assertThat(families.csvUpgradeCount().value(LabelValues.empty())).hasValue(2.0);
        assertThat(meterRegistry.get("csv_upgrade_count").counter().count()).isEqualTo(2.0);
    }

    private static ClusterServiceVersion csv(CsvPhase phase, String reason) {
        return ClusterServiceVersion.of("operators", "etcd.v0.9.4", "0.9.4", phase, reason);
    }
}
