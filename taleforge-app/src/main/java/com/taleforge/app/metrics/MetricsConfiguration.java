package com.taleforge.app.metrics;

import com.taleforge.engine.metrics.TurnMetrics;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer configuration for the turn engine.
 *
 * Configures:
 * - Common tags for all metrics
 * - The engine's turn, roll and rewind meters on the application registry
 */
@Configuration
public class MetricsConfiguration {

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        return registry -> registry.config()
            .commonTags("application", "taleforge");
    }

    @Bean
    public TurnMetrics turnMetrics(MeterRegistry registry) {
        return new TurnMetrics(registry);
    }
}
