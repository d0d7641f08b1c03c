package io.olmwatch.metrics.spring;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import io.olmwatch.metrics.DuplicateMetricRegistrationException;
import io.olmwatch.metrics.MetricFamilyRegistry;
import io.olmwatch.metrics.MetricsProvider;
import io.olmwatch.metrics.ObjectCountMetricsProvider;
import io.olmwatch.metrics.OlmMetricFamilies;
import io.olmwatch.metrics.OperatorLifecycleMetrics;
import io.olmwatch.metrics.SnapshotGauges;
import io.olmwatch.metrics.SubscriptionSyncDirectory;
import io.olmwatch.metrics.ports.ClusterObjectLister;
import io.olmwatch.model.ClusterServiceVersion;
import io.olmwatch.model.CsvPhase;
import io.olmwatch.model.CsvReason;
import io.olmwatch.model.ObjectKind;
import io.olmwatch.model.ObjectMeta;
import io.olmwatch.model.Subscription;
import io.olmwatch.model.SubscriptionSpec;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

class LifecycleMetricsAutoConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(LifecycleMetricsAutoConfiguration.class))
        .withBean(MeterRegistry.class, SimpleMeterRegistry::new);

    @Test
    void registersLifecycleMetricsWithoutLister() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(OperatorLifecycleMetrics.class);
            assertThat(context).hasSingleBean(SubscriptionSyncDirectory.class);

            SnapshotGauges snapshots = context.getBean(SnapshotGauges.class);
            for (ObjectKind kind : ObjectKind.values()) {
                assertThat(snapshots.provider(kind)).isSameAs(MetricsProvider.noop());
            }
            MetricFamilyRegistry registry = context.getBean(MetricFamilyRegistry.class);
            assertThat(registry.descriptors()).hasSize(8);
        });
    }

    @Test
    void wiresListerForEnabledCategoriesOnly() {
        contextRunner
            .withBean(ClusterObjectLister.class, () -> mock(ClusterObjectLister.class))
            .withPropertyValues("olm-watch.metrics.catalog.enabled=false")
            .run(context -> {
                SnapshotGauges snapshots = context.getBean(SnapshotGauges.class);
                assertThat(snapshots.provider(ObjectKind.CLUSTER_SERVICE_VERSION))
                    .isInstanceOf(ObjectCountMetricsProvider.class);
                assertThat(snapshots.provider(ObjectKind.SUBSCRIPTION)).isSameAs(MetricsProvider.noop());
                assertThat(snapshots.provider(ObjectKind.INSTALL_PLAN)).isSameAs(MetricsProvider.noop());
                assertThat(snapshots.provider(ObjectKind.CATALOG_SOURCE)).isSameAs(MetricsProvider.noop());
            });
    }

    @Test
    void backsOffWhenDisabled() {
        contextRunner
            .withPropertyValues("olm-watch.metrics.enabled=false")
            .run(context -> assertThat(context).doesNotHaveBean(OperatorLifecycleMetrics.class));
    }

    @Test
    void backsOffWithoutMeterRegistry() {
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LifecycleMetricsAutoConfiguration.class))
            .run(context -> assertThat(context).doesNotHaveBean(MetricFamilyRegistry.class));
    }

    @Test
    void duplicateFamilyRegistrationFailsStartup() {
        contextRunner
            .withBean(MetricFamilyRegistry.class, () -> {
                MetricFamilyRegistry registry = new MetricFamilyRegistry(new SimpleMeterRegistry());
                OlmMetricFamilies.register(registry);
                return registry;
            })
            .run(context -> {
                assertThat(context).hasFailed();
                assertThat(context.getStartupFailure())
                    .hasRootCauseInstanceOf(DuplicateMetricRegistrationException.class);
            });
    }

    @Test
    void prometheusScrapeTracksLifecycle() {
        ClusterObjectLister lister = mock(ClusterObjectLister.class);
        new ApplicationContextRunner()
            .withConfiguration(AutoConfigurations.of(LifecycleMetricsAutoConfiguration.class))
            .withBean(PrometheusMeterRegistry.class, () -> new PrometheusMeterRegistry(PrometheusConfig.DEFAULT))
            .withBean(ClusterObjectLister.class, () -> lister)
            .run(context -> {
                OperatorLifecycleMetrics metrics = context.getBean(OperatorLifecycleMetrics.class);
                PrometheusMeterRegistry registry = context.getBean(PrometheusMeterRegistry.class);

                ClusterServiceVersion installing = ClusterServiceVersion.of(
                    "operators", "etcdoperator.v0.9.4", "0.9.4", CsvPhase.INSTALLING, CsvReason.REQUIREMENTS_MET);
                ClusterServiceVersion failed = ClusterServiceVersion.of(
                    "operators", "etcdoperator.v0.9.4", "0.9.4", CsvPhase.FAILED, CsvReason.COMPONENT_FAILED);
                metrics.onVersionedObjectTransition(installing, failed);
                Subscription subscription = new Subscription(
                    new ObjectMeta("operators", "etcd"), SubscriptionSpec.of("etcd", "stable"), null);
                metrics.onSubscriptionSync(subscription);
                doReturn(List.of(installing)).when(lister).list(ObjectKind.CLUSTER_SERVICE_VERSION);
                doReturn(List.of()).when(lister).list(ObjectKind.INSTALL_PLAN);
                doReturn(List.of(subscription)).when(lister).list(ObjectKind.SUBSCRIPTION);
                doReturn(List.of()).when(lister).list(ObjectKind.CATALOG_SOURCE);
                metrics.refreshSnapshots();
                metrics.incrementUpgradeCounter();

                String scrape = registry.scrape();
                assertThat(scrape)
                    .contains("# HELP csv_abnormal CSV is not installed")
                    .contains("phase=\"Failed\"")
                    .contains("reason=\"InstallComponentFailed\"")
                    .contains("subscription_sync_total{")
                    .contains("channel=\"stable\"")
                    .contains("csv_count 1.0")
                    .contains("csv_upgrade_count_total 1.0");

                metrics.onVersionedObjectDelete(failed);
                metrics.onSubscriptionDelete(subscription);

                String afterDelete = registry.scrape();
                assertThat(afterDelete)
                    .doesNotContain("csv_abnormal{")
                    .doesNotContain("csv_succeeded{")
                    .doesNotContain("subscription_sync_total{");
            });
    }
}
