package com.platform.gatewayctl.reconcile;

import java.time.Instant;

/**
 * Record of one completed reconciliation step.
 */
public record StepRecord(
    StepKind step,
    String target,
    StepOutcome outcome,
    Instant completedAt
) {
    
    public static StepRecord create(StepKind step, String target, StepOutcome outcome) {
        return new StepRecord(step, target, outcome, Instant.now());
    }
    
    @Override
    public String toString() {
        return step.getStepName() + " " + target + ": " + outcome;
    }
}
