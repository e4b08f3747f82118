package com.platform.gatewayctl.error;

/**
 * Credentials or IAM policy rejected a control-plane call.
 * The remote message is kept verbatim.
 */
public class PermissionDeniedException extends GatewayControlException {
    
    private final String operation;
    
    public PermissionDeniedException(String operation, String remoteMessage, Throwable cause) {
        super(ErrorCode.PERMISSION_DENIED, remoteMessage, cause);
        this.operation = operation;
    }
    
    public String getOperation() {
        return operation;
    }
}
