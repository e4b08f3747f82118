package com.platform.gatewayctl.error;

/**
 * Base exception for all gateway reconciler exceptions.
 * Carries an ErrorCode for standardized error handling.
 */
public abstract class GatewayControlException extends RuntimeException {
    
    private final ErrorCode errorCode;
    
    protected GatewayControlException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }
    
    protected GatewayControlException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }
    
    protected GatewayControlException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }
    
    public ErrorCode getErrorCode() {
        return errorCode;
    }
    
    public boolean isFatal() {
        return errorCode.isFatal();
    }
    
    public boolean isTransient() {
        return errorCode.isTransient();
    }
}
