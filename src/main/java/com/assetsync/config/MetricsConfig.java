package com.assetsync.config;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Micrometer registry for run metrics. The tool is a one-shot CLI with no scrape endpoint,
 * so an in-memory registry is used and its counters are logged at the end of each run.
 */
@Configuration
public class MetricsConfig {

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
        meterRegistry.config().commonTags("application", "asset-sync");
        return meterRegistry;
    }
}
