package com.platform.gatewayctl.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for reconciler metrics: control-plane calls, retries, step outcomes and runs.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
    }

    /**
     * Record the latency and outcome of one control-plane call.
     */
    public void recordCall(String operation, String outcome, long latencyMs) {
        String timerKey = operation + "." + outcome;
        Timer timer = timers.computeIfAbsent(timerKey, k ->
            Timer.builder("gateway.controlplane.call.latency")
                .tag("operation", operation)
                .tag("outcome", outcome)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));

        timer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Record retry attempt.
     */
    public void recordRetryAttempt(String operation, int attemptNumber) {
        incrementCounter("gateway.retry.attempt", "operation", operation, "attempt", String.valueOf(attemptNumber));
    }

    /**
     * Record the outcome of a reconciliation step (CREATED, UPDATED, UNCHANGED, ...).
     */
    public void recordStepOutcome(String stepKind, String outcome) {
        incrementCounter("gateway.reconcile.step", "step", stepKind, "outcome", outcome);
    }

    /**
     * Record a finished run.
     */
    public void recordRun(String apiName, boolean success, long durationMs) {
        incrementCounter("gateway.reconcile.run", "api", apiName, "result", success ? "success" : "failure");
        timers.computeIfAbsent("run." + apiName, k ->
            Timer.builder("gateway.reconcile.run.duration")
                .tag("api", apiName)
                .register(meterRegistry))
            .record(Duration.ofMillis(durationMs));
        log.debug("Recorded run for {}: success={} in {}ms", apiName, success, durationMs);
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k ->
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment();
    }
}
