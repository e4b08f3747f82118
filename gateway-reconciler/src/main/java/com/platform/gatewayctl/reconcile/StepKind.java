package com.platform.gatewayctl.reconcile;

/**
 * Kinds of steps a reconciliation run performs, in the order they occur for one route.
 */
public enum StepKind {
    LOOKUP_API("lookupApi"),
    PRUNE("prune"),
    RESOLVE_RESOURCE("resolveResource"),
    METHOD("method"),
    INTEGRATION("integration"),
    METHOD_RESPONSE("methodResponse"),
    INTEGRATION_RESPONSE("integrationResponse"),
    DEPLOYMENT("deployment");
    
    private final String stepName;
    
    StepKind(String stepName) {
        this.stepName = stepName;
    }
    
    public String getStepName() {
        return stepName;
    }
}
