package com.platform.gatewayctl.reconcile;

/**
 * What a step did to the remote configuration.
 */
public enum StepOutcome {
    CREATED,
    UPDATED,
    UNCHANGED,
    DELETED,
    PUBLISHED,
    SKIPPED;
    
    /**
     * Whether the outcome modified the remote configuration.
     */
    public boolean isChange() {
        return this == CREATED || this == UPDATED || this == DELETED;
    }
}
