package com.taskdrive.app.config;

import com.taskdrive.engine.metrics.SchedulerMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Metrics configuration for the worker process.
 * Boot binds {@link SchedulerMetrics} to its registry as a MeterBinder.
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "taskdrive");
    }

    @Bean
    public SchedulerMetrics schedulerMetrics() {
        return new SchedulerMetrics();
    }
}
