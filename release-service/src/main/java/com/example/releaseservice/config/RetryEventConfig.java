package com.example.releaseservice.config;

import io.github.resilience4j.retry.RetryRegistry;
import io.github.resilience4j.retry.event.RetryOnErrorEvent;
import io.github.resilience4j.retry.event.RetryOnRetryEvent;
import io.github.resilience4j.retry.event.RetryOnSuccessEvent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;

/**
 * Retry event logging.
 *
 * Logs emitted:
 * - WARN on retry attempt
 * - INFO on success after retry (only if retried)
 * - WARN on retry exhaustion
 *
 * A revision allocation retry means two writers raced past the row lock;
 * repeated RETRY_EXHAUSTED lines point at a locking problem, not at load.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class RetryEventConfig {

    private final RetryRegistry retryRegistry;

    @PostConstruct
    public void configureRetryEventLogging() {
        configureRetryEvents(ResilienceConfig.REVISION_ALLOCATION);
    }

    /**
     * Attaches listeners to an existing retry instance without creating one
     * with the default configuration.
     */
    private void configureRetryEvents(String retryName) {
        retryRegistry.find(retryName)
            .ifPresentOrElse(
                retry -> {
                    int maxAttempts = retry.getRetryConfig().getMaxAttempts();
                    retry.getEventPublisher()
                        .onRetry(event -> logRetryAttempt(event, maxAttempts))
                        .onSuccess(this::logRetrySuccess)
                        .onError(event -> logRetryError(event, maxAttempts));
                    log.debug("Retry event logging enabled for: {}", retryName);
                },
                () -> log.warn("Retry not found in registry, skipping event config: {}", retryName)
            );
    }

    private void logRetryAttempt(RetryOnRetryEvent event, int maxAttempts) {
        log.warn("RETRY_ATTEMPT name={} attempt={}/{} error={}",
            event.getName(),
            event.getNumberOfRetryAttempts(),
            maxAttempts,
            event.getLastThrowable().getClass().getSimpleName());
    }

    private void logRetrySuccess(RetryOnSuccessEvent event) {
        if (event.getNumberOfRetryAttempts() > 0) {
            log.info("RETRY_SUCCESS name={} attempts={}",
                event.getName(),
                event.getNumberOfRetryAttempts());
        }
    }

    private void logRetryError(RetryOnErrorEvent event, int maxAttempts) {
        if (event.getNumberOfRetryAttempts() >= maxAttempts) {
            log.warn("RETRY_EXHAUSTED name={} attempts={} error={}",
                event.getName(),
                event.getNumberOfRetryAttempts(),
                event.getLastThrowable().getClass().getSimpleName());
        }
    }
}
