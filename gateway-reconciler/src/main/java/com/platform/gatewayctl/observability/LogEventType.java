package com.platform.gatewayctl.observability;

/**
 * Event types of structured log lines.
 */
public enum LogEventType {
    RECONCILE_RUN_STARTED,
    RECONCILE_STEP_COMPLETED,
    RECONCILE_RUN_COMPLETED,
    RECONCILE_RUN_FAILED,
    DEPLOYMENT_PUBLISHED,
    DEPLOYMENT_SKIPPED
}
