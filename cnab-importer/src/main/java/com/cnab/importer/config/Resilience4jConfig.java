package com.cnab.importer.config;

import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j bulkhead configuration.
 *
 * <p>A <b>SemaphoreBulkhead</b> caps how many imports run at the same time. Each import holds
 * its permit from file validation until the batch is committed or rolled back; callers that
 * cannot get a permit within {@code max-wait-duration} are turned away with a failed outcome.
 *
 * <p>Property values are read from {@code application.yml} under the {@code resilience4j.*}
 * namespace so that they can be overridden per environment without recompilation.
 */
@Slf4j
@Configuration
public class Resilience4jConfig {

    @Value("${resilience4j.bulkhead.instances.cnabImportBulkhead.max-concurrent-calls:4}")
    private int importMaxConcurrent;

    @Value("${resilience4j.bulkhead.instances.cnabImportBulkhead.max-wait-duration:2s}")
    private Duration importMaxWait;

    @Bean("cnabImportBulkhead")
    public Bulkhead cnabImportBulkhead(BulkheadRegistry registry) {
        BulkheadConfig cfg = BulkheadConfig.custom()
                .maxConcurrentCalls(importMaxConcurrent)
                .maxWaitDuration(importMaxWait)
                .build();
        Bulkhead bh = registry.bulkhead("cnabImportBulkhead", cfg);
        log.info("SemaphoreBulkhead 'cnabImportBulkhead' created, maxConcurrent={}, maxWait={}",
                importMaxConcurrent, importMaxWait);
        return bh;
    }

    @Bean
    public BulkheadRegistry bulkheadRegistry() {
        return BulkheadRegistry.ofDefaults();
    }
}
