package com.theobroma.perf.config;

import java.time.Clock;

import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.env.Environment;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Observability configuration.
 *
 * - Common metric tags (application, environment)
 * - Query statistics properties
 * - The clock used to timestamp query samples and snapshots
 *
 * Metrics are exposed at /actuator/prometheus for Prometheus scraping.
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
@EnableConfigurationProperties(QueryStatsProperties.class)
public class ObservabilityConfig {

    private final Environment environment;

    /**
     * Adds global tags to all metrics so they aggregate cleanly across environments.
     *
     * @return MeterRegistry customizer
     */
    @Bean
    public MeterRegistryCustomizer<MeterRegistry> metricsCommonTags() {
        String appName = environment.getProperty("spring.application.name", "theobroma-query-perf");
        String env = environment.getProperty("ENVIRONMENT", "dev");

        log.info("Configuring metrics with tags: application={}, environment={}", appName, env);

        return registry -> registry.config()
            .commonTags(
                "application", appName,
                "environment", env
            )
            .meterFilter(MeterFilter.maximumAllowableMetrics(10000));
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
