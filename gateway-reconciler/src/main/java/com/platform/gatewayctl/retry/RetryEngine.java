package com.platform.gatewayctl.retry;

import com.platform.gatewayctl.config.GatewayProperties;
import com.platform.gatewayctl.error.ErrorCode;
import com.platform.gatewayctl.error.GatewayControlException;
import com.platform.gatewayctl.error.TransientControlPlaneException;
import com.platform.gatewayctl.observability.MetricsRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Retry engine with exponential backoff and jitter.
 * <p>
 * Only {@link ErrorCode.ErrorCategory#TRANSIENT} failures are retried; everything else
 * propagates on the first attempt. Exhaustion raises a {@link TransientControlPlaneException}
 * with {@link ErrorCode#RETRIES_EXHAUSTED} wrapping the last failure.
 */
@Slf4j
@Component
public class RetryEngine {
    
    private final MetricsRegistry metricsRegistry;
    private final GatewayProperties.Retry settings;
    private final BackoffSleeper sleeper;
    
    @Autowired
    public RetryEngine(MetricsRegistry metricsRegistry, GatewayProperties properties) {
        this(metricsRegistry, properties.getRetry(), BackoffSleeper.THREAD_SLEEP);
    }
    
    public RetryEngine(MetricsRegistry metricsRegistry, GatewayProperties.Retry settings, BackoffSleeper sleeper) {
        this.metricsRegistry = metricsRegistry;
        this.settings = settings;
        this.sleeper = sleeper;
    }
    
    /**
     * Execute an operation with retry logic.
     */
    public <T> T executeWithRetry(String operationName, Supplier<T> operation) {
        int maxAttempts = settings.getMaxAttempts();
        int attempt = 0;
        GatewayControlException lastException = null;
        
        while (attempt < maxAttempts) {
            try {
                T result = operation.get();
                if (attempt > 0) {
                    log.info("{} succeeded after {} attempts", operationName, attempt + 1);
                }
                return result;
                
            } catch (GatewayControlException e) {
                if (!e.isTransient()) {
                    throw e;
                }
                lastException = e;
                attempt++;
                
                metricsRegistry.recordRetryAttempt(operationName, attempt);
                log.warn("{} failed (attempt {}/{}): [{}] {}", 
                    operationName, attempt, maxAttempts, e.getErrorCode().getCode(), e.getMessage());
                
                if (attempt < maxAttempts) {
                    long delay = calculateDelay(attempt);
                    log.debug("Retrying {} in {}ms", operationName, delay);
                    
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw TransientControlPlaneException.exhausted(operationName, attempt, e);
                    }
                }
            }
        }
        
        log.error("{} failed after {} attempts", operationName, maxAttempts);
        throw TransientControlPlaneException.exhausted(operationName, maxAttempts, lastException);
    }
    
    /**
     * Execute an operation with retry logic (void return).
     */
    public void executeWithRetry(String operationName, Runnable operation) {
        executeWithRetry(operationName, () -> {
            operation.run();
            return null;
        });
    }
    
    /**
     * Calculate delay with exponential backoff and jitter.
     */
    long calculateDelay(int attempt) {
        long initialDelayMs = settings.getInitialDelayMs();
        double exponentialDelay = initialDelayMs * Math.pow(settings.getMultiplier(), attempt - 1);
        
        long baseDelay = Math.min((long) exponentialDelay, settings.getMaxDelayMs());
        
        long jitter = (long) (baseDelay * settings.getJitterFactor() * ThreadLocalRandom.current().nextDouble());
        
        // Randomly add or subtract jitter
        if (ThreadLocalRandom.current().nextBoolean()) {
            return baseDelay + jitter;
        } else {
            return Math.max(Math.min(initialDelayMs, baseDelay), baseDelay - jitter);
        }
    }
}
