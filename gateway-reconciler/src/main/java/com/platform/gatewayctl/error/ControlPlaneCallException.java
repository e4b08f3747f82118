package com.platform.gatewayctl.error;

/**
 * A control-plane failure that fits no other class of the taxonomy.
 */
public class ControlPlaneCallException extends GatewayControlException {
    
    private final String operation;
    
    public ControlPlaneCallException(String operation, String message, Throwable cause) {
        super(ErrorCode.UNEXPECTED_CONTROL_PLANE_ERROR, message, cause);
        this.operation = operation;
    }
    
    public String getOperation() {
        return operation;
    }
}
