package io.olmwatch.metrics.spring;

import io.micrometer.core.instrument.MeterRegistry;
import io.olmwatch.metrics.CatalogMetricFamilies;
import io.olmwatch.metrics.CsvMetrics;
import io.olmwatch.metrics.MetricFamilyRegistry;
import io.olmwatch.metrics.OlmMetricFamilies;
import io.olmwatch.metrics.OperatorLifecycleMetrics;
import io.olmwatch.metrics.SnapshotGauges;
import io.olmwatch.metrics.SubscriptionSyncDirectory;
import io.olmwatch.metrics.SubscriptionSyncMetrics;
import io.olmwatch.metrics.ports.ClusterObjectLister;
import io.olmwatch.model.ObjectKind;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Assembles the lifecycle metric managers on top of the application's {@link MeterRegistry}.
 * <p>
 * Series families are registered once per context; registering the same family twice fails the
 * context. Snapshot counting is wired to the {@link ClusterObjectLister} bean when one exists and
 * falls back to no-op providers otherwise.
 */
@AutoConfiguration(afterName = {
    "org.springframework.boot.actuate.autoconfigure.metrics.CompositeMeterRegistryAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.export.simple.SimpleMetricsExportAutoConfiguration",
    "org.springframework.boot.actuate.autoconfigure.metrics.export.prometheus.PrometheusMetricsExportAutoConfiguration"
})
@ConditionalOnClass(MeterRegistry.class)
@ConditionalOnBean(MeterRegistry.class)
@ConditionalOnProperty(prefix = "olm-watch.metrics", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(LifecycleMetricsProperties.class)
public class LifecycleMetricsAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(LifecycleMetricsAutoConfiguration.class);

    @Bean
    @ConditionalOnMissingBean
    MetricFamilyRegistry lifecycleMetricFamilyRegistry(MeterRegistry meterRegistry) {
        return new MetricFamilyRegistry(meterRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    OlmMetricFamilies olmMetricFamilies(MetricFamilyRegistry registry) {
        return OlmMetricFamilies.register(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    CatalogMetricFamilies catalogMetricFamilies(MetricFamilyRegistry registry) {
        return CatalogMetricFamilies.register(registry);
    }

    @Bean
    @ConditionalOnMissingBean
    SubscriptionSyncDirectory subscriptionSyncDirectory() {
        return new SubscriptionSyncDirectory();
    }

    @Bean
    @ConditionalOnMissingBean
    CsvMetrics csvMetrics(OlmMetricFamilies families) {
        return new CsvMetrics(families);
    }

    @Bean
    @ConditionalOnMissingBean
    SubscriptionSyncMetrics subscriptionSyncMetrics(CatalogMetricFamilies families,
                                                    SubscriptionSyncDirectory directory) {
        return new SubscriptionSyncMetrics(families, directory);
    }

    @Bean
    @ConditionalOnMissingBean
    SnapshotGauges snapshotGauges(ObjectProvider<ClusterObjectLister> listerProvider,
                                  OlmMetricFamilies olm,
                                  CatalogMetricFamilies catalog,
                                  LifecycleMetricsProperties properties) {
        ClusterObjectLister lister = listerProvider.getIfAvailable();
        if (lister == null) {
            log.info("No ClusterObjectLister available; snapshot gauges are disabled");
            return SnapshotGauges.disabled();
        }
        Set<ObjectKind> kinds = properties.snapshotKinds();
        log.info("Snapshot gauges enabled for {}", kinds);
        return SnapshotGauges.create(lister, olm, catalog, kinds);
    }

    @Bean
    @ConditionalOnMissingBean
    OperatorLifecycleMetrics operatorLifecycleMetrics(SnapshotGauges snapshots,
                                                      CsvMetrics csvMetrics,
                                                      SubscriptionSyncMetrics subscriptionMetrics) {
        return new OperatorLifecycleMetrics(snapshots, csvMetrics, subscriptionMetrics);
    }
}
