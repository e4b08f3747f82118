package com.platform.gatewayctl.reconcile;

import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * Mutable state of one reconciliation run: the step in progress and the steps completed so far.
 * Not thread-safe; a run is single threaded.
 */
@Slf4j
public class ReconciliationContext {

    static final String MDC_STEP = "step";

    private final Consumer<StepRecord> listener;
    private final List<StepRecord> records = new ArrayList<>();
    private StepKind currentStep;
    private String currentTarget;

    public ReconciliationContext() {
        this(record -> { });
    }

    /**
     * @param listener notified of every completed step, e.g. for metrics and structured logging
     */
    public ReconciliationContext(Consumer<StepRecord> listener) {
        this.listener = listener;
    }

    /**
     * Run one step. On failure the step stays current so the caller can report it.
     */
    public StepOutcome step(StepKind step, String target, Supplier<StepOutcome> action) {
        return step(step, target, action, Function.identity());
    }

    /**
     * Run one step that produces a value, deriving the recorded outcome from it.
     */
    public <T> T step(StepKind step, String target, Supplier<T> action, Function<T, StepOutcome> outcomeOf) {
        currentStep = step;
        currentTarget = target;
        MDC.put(MDC_STEP, step.getStepName());

        T result = action.get();
        StepOutcome outcome = outcomeOf.apply(result);

        StepRecord record = StepRecord.create(step, target, outcome);
        records.add(record);
        log.info("{} {} -> {}", step.getStepName(), target, outcome);
        listener.accept(record);
        return result;
    }

    public StepKind getCurrentStep() {
        return currentStep;
    }

    public String getCurrentTarget() {
        return currentTarget;
    }

    /**
     * Human readable name of the step in progress, e.g. {@code integration /api/{proxy+} ANY}.
     */
    public String describeCurrentStep() {
        return currentStep == null ? "none" : currentStep.getStepName() + " " + currentTarget;
    }

    public List<StepRecord> getRecords() {
        return List.copyOf(records);
    }

    /**
     * Whether any completed step modified the remote configuration.
     */
    public boolean hasChanges() {
        return records.stream().anyMatch(r -> r.outcome().isChange());
    }
}
