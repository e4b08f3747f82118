package com.platform.gatewayctl.error;

/**
 * Exception for invalid configuration, path templates and route definitions.
 */
public class ValidationException extends GatewayControlException {
    
    private final String field;
    private final Object rejectedValue;
    
    public ValidationException(ErrorCode errorCode, String message) {
        super(errorCode, message);
        this.field = null;
        this.rejectedValue = null;
    }
    
    public ValidationException(ErrorCode errorCode, String field, Object rejectedValue, String message) {
        super(errorCode, 
            String.format("Invalid value '%s' for field '%s': %s", rejectedValue, field, message));
        this.field = field;
        this.rejectedValue = rejectedValue;
    }
    
    public String getField() {
        return field;
    }
    
    public Object getRejectedValue() {
        return rejectedValue;
    }
}
