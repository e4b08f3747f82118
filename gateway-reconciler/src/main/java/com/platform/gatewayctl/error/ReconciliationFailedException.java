package com.platform.gatewayctl.error;

/**
 * Wraps the first unrecovered failure of a reconciliation run.
 * Names the failed step and whether the deployment step was reached,
 * since only a successful deployment activates configuration changes.
 */
public class ReconciliationFailedException extends GatewayControlException {
    
    private final String failedStep;
    private final boolean deploymentReached;
    private final ErrorCode causeCode;
    
    public ReconciliationFailedException(String failedStep, boolean deploymentReached, Throwable cause) {
        super(deploymentReached ? ErrorCode.DEPLOYMENT_FAILED : ErrorCode.RECONCILIATION_FAILED,
            describe(failedStep, deploymentReached, cause),
            cause);
        this.failedStep = failedStep;
        this.deploymentReached = deploymentReached;
        this.causeCode = cause instanceof GatewayControlException gce
            ? gce.getErrorCode()
            : ErrorCode.INTERNAL_ERROR;
    }
    
    private static String describe(String failedStep, boolean deploymentReached, Throwable cause) {
        String activation = deploymentReached
            ? "deployment step was reached but did not complete; changes are applied but inactive"
            : "deployment step was not reached; no changes are active";
        return String.format("Step '%s' failed: %s (%s)", failedStep, cause.getMessage(), activation);
    }
    
    public String getFailedStep() {
        return failedStep;
    }
    
    public boolean isDeploymentReached() {
        return deploymentReached;
    }
    
    /**
     * Error code of the underlying failure.
     */
    public ErrorCode getCauseCode() {
        return causeCode;
    }
}
