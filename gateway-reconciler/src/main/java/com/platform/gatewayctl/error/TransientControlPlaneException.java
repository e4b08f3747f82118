package com.platform.gatewayctl.error;

/**
 * Exception for network, throttling and timeout failures of the control plane.
 */
public class TransientControlPlaneException extends GatewayControlException {
    
    private final String operation;
    
    public TransientControlPlaneException(ErrorCode errorCode, String operation, String message) {
        super(errorCode, message);
        this.operation = operation;
    }
    
    public TransientControlPlaneException(ErrorCode errorCode, String operation, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.operation = operation;
    }
    
    public static TransientControlPlaneException unavailable(String operation, String message, Throwable cause) {
        return new TransientControlPlaneException(ErrorCode.CONTROL_PLANE_UNAVAILABLE, operation, message, cause);
    }
    
    public static TransientControlPlaneException throttled(String operation, String message, Throwable cause) {
        return new TransientControlPlaneException(ErrorCode.CONTROL_PLANE_THROTTLED, operation, message, cause);
    }
    
    public static TransientControlPlaneException timeout(String operation, String message, Throwable cause) {
        return new TransientControlPlaneException(ErrorCode.CONTROL_PLANE_TIMEOUT, operation, message, cause);
    }
    
    public static TransientControlPlaneException exhausted(String operation, int attempts, Throwable lastFailure) {
        return new TransientControlPlaneException(
            ErrorCode.RETRIES_EXHAUSTED,
            operation,
            String.format("Operation %s failed after %d attempts", operation, attempts),
            lastFailure
        );
    }
    
    public String getOperation() {
        return operation;
    }
}
