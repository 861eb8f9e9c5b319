package com.caseflow.engine.metrics;

import com.caseflow.engine.runtime.WorkflowDispatcher;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.binder.MeterBinder;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Prometheus metrics configuration.
 *
 * Configures:
 * - Common tags for all metrics
 * - The workflow metrics listener
 * - A gauge of instances currently driven by a runner
 */
@Configuration
public class MetricsConfiguration {

    public static final String LIVE_RUNNERS = "caseflow.workflows.live";

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "caseflow");
    }

    @Bean
    public WorkflowMetrics workflowMetrics() {
        return new WorkflowMetrics();
    }

    @Bean
    public MeterBinder liveRunnersGauge(WorkflowDispatcher dispatcher) {
        return registry -> Gauge.builder(LIVE_RUNNERS, dispatcher, WorkflowDispatcher::activeCount)
            .description("Workflow instances driven by a runner")
            .register(registry);
    }
}
