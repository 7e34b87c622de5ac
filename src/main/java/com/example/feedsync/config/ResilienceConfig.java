package com.example.feedsync.config;

import com.example.feedsync.exception.TransientFetchException;
import io.github.resilience4j.bulkhead.Bulkhead;
import io.github.resilience4j.bulkhead.BulkheadConfig;
import io.github.resilience4j.bulkhead.BulkheadFullException;
import io.github.resilience4j.bulkhead.BulkheadRegistry;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import io.github.resilience4j.ratelimiter.RateLimiterRegistry;
import io.github.resilience4j.ratelimiter.RequestNotPermitted;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Shared limits for the metadata source. Push-origin and backfill-origin work
 * both go through the same bulkhead and rate limiter instances, so together
 * they never exceed the source's concurrency or request budget.
 */
@Slf4j
@Configuration
public class ResilienceConfig {

    @Bean
    @Qualifier("metadataRateLimiter")
    public RateLimiter metadataRateLimiter(RateLimiterRegistry registry,
                                           @Value("${app.metadata.rate-limit-per-second:5}") int perSecond,
                                           @Value("${app.metadata.rate-limit-timeout:10s}") Duration timeout) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(perSecond)
                .limitRefreshPeriod(Duration.ofSeconds(1))
                .timeoutDuration(timeout)
                .build();
        return registry.rateLimiter("metadataRateLimiter", config);
    }

    @Bean
    @Qualifier("metadataBulkhead")
    public Bulkhead metadataBulkhead(BulkheadRegistry registry,
                                     @Value("${app.metadata.max-concurrency:4}") int maxConcurrency,
                                     @Value("${app.metadata.max-wait:30s}") Duration maxWait) {
        BulkheadConfig config = BulkheadConfig.custom()
                .maxConcurrentCalls(maxConcurrency)
                .maxWaitDuration(maxWait)
                .build();
        return registry.bulkhead("metadataBulkhead", config);
    }

    @Bean
    @Qualifier("metadataRetry")
    public Retry metadataRetry(RetryRegistry registry,
                               @Value("${app.metadata.retry.max-attempts:4}") int maxAttempts,
                               @Value("${app.metadata.retry.initial-backoff:2s}") Duration initialBackoff,
                               @Value("${app.metadata.retry.max-backoff:1m}") Duration maxBackoff) {
        return registry.retry("metadataRetry", transientRetryConfig(maxAttempts, initialBackoff, maxBackoff));
    }

    @Bean
    @Qualifier("listingRateLimiter")
    public RateLimiter listingRateLimiter(RateLimiterRegistry registry,
                                          @Value("${app.backfill.listing-rate-limit-per-minute:10}") int perMinute,
                                          @Value("${app.backfill.listing-rate-limit-timeout:1m}") Duration timeout) {
        RateLimiterConfig config = RateLimiterConfig.custom()
                .limitForPeriod(perMinute)
                .limitRefreshPeriod(Duration.ofMinutes(1))
                .timeoutDuration(timeout)
                .build();
        return registry.rateLimiter("listingRateLimiter", config);
    }

    @Bean
    @Qualifier("listingRetry")
    public Retry listingRetry(RetryRegistry registry,
                              @Value("${app.metadata.retry.max-attempts:4}") int maxAttempts,
                              @Value("${app.metadata.retry.initial-backoff:2s}") Duration initialBackoff,
                              @Value("${app.metadata.retry.max-backoff:1m}") Duration maxBackoff) {
        return registry.retry("listingRetry", transientRetryConfig(maxAttempts, initialBackoff, maxBackoff));
    }

    /**
     * Exponential backoff over the failures that signal a temporary condition:
     * transport errors, rate limiting on either side, and a saturated bulkhead.
     */
    public static RetryConfig transientRetryConfig(int maxAttempts, Duration initialBackoff, Duration maxBackoff) {
        return RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(initialBackoff, 2.0, maxBackoff))
                .retryExceptions(TransientFetchException.class, RequestNotPermitted.class, BulkheadFullException.class)
                .build();
    }
}
