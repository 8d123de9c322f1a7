package com.koni.energy.infrastructure.observability;

import com.koni.energy.domain.model.AlertKind;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Component for tracking alert evaluation metrics.
 * Provides counters and timers for monitoring system behavior.
 */
@Slf4j
@Component
public class AlertMetrics {

    private final Counter evaluationPasses;
    private final Counter evaluationFailures;
    private final Counter cooldownSuppressed;
    private final Counter fallbackStored;
    private final Counter fallbackReplayed;
    private final Map<AlertKind, Counter> triggeredByKind = new EnumMap<>(AlertKind.class);
    private final Timer evaluationTime;

    public AlertMetrics(MeterRegistry registry) {
        this.evaluationPasses = Counter.builder("alerts.evaluation.passes.total")
                .description("Total alert evaluation passes run")
                .register(registry);

        this.evaluationFailures = Counter.builder("alerts.evaluation.failures.total")
                .description("Total alert evaluation passes aborted by a store failure")
                .register(registry);

        this.cooldownSuppressed = Counter.builder("alerts.cooldown.suppressed.total")
                .description("Total rule/device pairs skipped because of cooldown")
                .register(registry);

        this.fallbackStored = Counter.builder("alerts.notifications.fallback.total")
                .description("Total alert notifications stored in the fallback table")
                .register(registry);

        this.fallbackReplayed = Counter.builder("alerts.notifications.replayed.total")
                .description("Total alert notifications replayed from the fallback table")
                .register(registry);

        for (AlertKind kind : AlertKind.values()) {
            triggeredByKind.put(kind, Counter.builder("alerts.triggered.total")
                    .description("Total alert events triggered")
                    .tag("kind", kind.code())
                    .register(registry));
        }

        this.evaluationTime = Timer.builder("alerts.evaluation.time")
                .description("Time to run one evaluation pass")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordPass() {
        evaluationPasses.increment();
    }

    public void recordFailure() {
        evaluationFailures.increment();
    }

    public void recordTriggered(AlertKind kind) {
        triggeredByKind.get(kind).increment();
        log.debug("Triggered counter incremented: kind={}", kind);
    }

    public void recordCooldownSuppressed() {
        cooldownSuppressed.increment();
    }

    public void recordFallbackStored() {
        fallbackStored.increment();
    }

    public void recordFallbackReplayed() {
        fallbackReplayed.increment();
    }

    /**
     * Record the duration of an evaluation pass.
     * 
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordEvaluationTime(Supplier<T> operation) {
        return evaluationTime.record(operation);
    }
}
