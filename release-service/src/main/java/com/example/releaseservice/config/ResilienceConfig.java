package com.example.releaseservice.config;

import com.example.releaseservice.support.RevisionKeyCollision;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Resilience4j configuration.
 *
 * Retry strategy for revision allocation:
 * - Max attempts: release-store.allocation.max-attempts (first attempt plus one retry)
 * - Wait duration: release-store.allocation.wait-millis, fixed
 * - Retry on: a unique-key collision on the revisions table only; any other
 *   integrity failure surfaces on the first attempt
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    public static final String REVISION_ALLOCATION = "revisionAllocation";

    @Value("${release-store.allocation.max-attempts:2}")
    private int allocationMaxAttempts;

    @Value("${release-store.allocation.wait-millis:50}")
    private long allocationWaitMillis;

    @Bean
    public RetryRegistry retryRegistry() {
        RetryConfig allocationConfig = revisionAllocationConfig(allocationMaxAttempts, allocationWaitMillis);

        RetryRegistry registry = RetryRegistry.ofDefaults();
        registry.retry(REVISION_ALLOCATION, allocationConfig);

        log.info("Retry configured name={} maxAttempts={} waitMillis={}",
                REVISION_ALLOCATION, allocationMaxAttempts, allocationWaitMillis);
        return registry;
    }

    public static RetryConfig revisionAllocationConfig(int maxAttempts, long waitMillis) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .waitDuration(Duration.ofMillis(waitMillis))
                .retryOnException(RevisionKeyCollision::matches)
                .build();
    }
}
