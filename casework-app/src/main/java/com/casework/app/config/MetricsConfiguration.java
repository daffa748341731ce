package com.casework.app.config;

import com.casework.engine.metrics.CaseMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus metrics configuration for the casework engine.
 *
 * Configures:
 * - Common tags for all metrics
 * - The engine's meters, bound eagerly so early callers never see an unbound registry
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "casework-engine");
    }

    @Bean
    public CaseMetrics caseMetrics(MeterRegistry registry) {
        CaseMetrics metrics = new CaseMetrics();
        metrics.bindTo(registry);
        return metrics;
    }
}
