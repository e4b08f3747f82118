package com.platform.gatewayctl.error;

/**
 * Standardized error codes for the gateway reconciler.
 * Each error has a unique code that operators and the CLI exit-code mapping can act on.
 * 
 * Format: GW-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors (configuration, templates)
 * - 2xx: Permission errors
 * - 3xx: Resource errors (not found, already exists, conflict)
 * - 4xx: Transient control-plane errors
 * - 5xx: Reconciliation errors
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {
    
    // ==================== Validation Errors (1xx) ====================
    
    VALIDATION_ERROR("GW-100", "Validation error", ErrorCategory.FATAL),
    INVALID_PATH_TEMPLATE("GW-101", "Invalid path template", ErrorCategory.FATAL),
    INVALID_ROUTE("GW-102", "Invalid route definition", ErrorCategory.FATAL),
    UNSUPPORTED_CONTENT_TYPE("GW-103", "Unsupported content type", ErrorCategory.FATAL),
    CAPTURE_BINDING_MISSING("GW-104", "Captured path variable is not bound to the upstream URI", ErrorCategory.FATAL),
    
    // ==================== Permission Errors (2xx) ====================
    
    PERMISSION_DENIED("GW-200", "Permission denied by control plane", ErrorCategory.FATAL),
    
    // ==================== Resource Errors (3xx) ====================
    
    RESOURCE_NOT_FOUND("GW-300", "Resource not found", ErrorCategory.FATAL),
    API_NOT_FOUND("GW-301", "REST API not found", ErrorCategory.FATAL),
    ROOT_RESOURCE_NOT_FOUND("GW-302", "Root resource not found", ErrorCategory.FATAL),
    RESOURCE_ALREADY_EXISTS("GW-310", "Resource already exists", ErrorCategory.RECOVERABLE),
    RESOURCE_CONFLICT("GW-320", "Resource conflict", ErrorCategory.FATAL),
    AMBIGUOUS_MATCH("GW-321", "Ambiguous match", ErrorCategory.FATAL),
    DEPENDENCY_ORDER_VIOLATION("GW-322", "Dependency order violated", ErrorCategory.FATAL),
    
    // ==================== Transient Errors (4xx) ====================
    
    CONTROL_PLANE_UNAVAILABLE("GW-400", "Control plane unavailable", ErrorCategory.TRANSIENT),
    CONTROL_PLANE_THROTTLED("GW-401", "Control plane throttled the request", ErrorCategory.TRANSIENT),
    CONTROL_PLANE_TIMEOUT("GW-402", "Control plane call timed out", ErrorCategory.TRANSIENT),
    RETRIES_EXHAUSTED("GW-410", "Retries exhausted", ErrorCategory.FATAL),
    
    // ==================== Reconciliation Errors (5xx) ====================
    
    RECONCILIATION_FAILED("GW-500", "Reconciliation failed", ErrorCategory.FATAL),
    DEPLOYMENT_FAILED("GW-501", "Deployment publication failed", ErrorCategory.FATAL),
    
    // ==================== Internal Errors (9xx) ====================
    
    INTERNAL_ERROR("GW-900", "Internal error", ErrorCategory.FATAL),
    UNEXPECTED_CONTROL_PLANE_ERROR("GW-901", "Unexpected control plane error", ErrorCategory.FATAL),
    CONFIGURATION_ERROR("GW-902", "Configuration error", ErrorCategory.FATAL);
    
    private final String code;
    private final String defaultMessage;
    private final ErrorCategory category;
    
    ErrorCode(String code, String defaultMessage, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.category = category;
    }
    
    public String getCode() {
        return code;
    }
    
    public String getDefaultMessage() {
        return defaultMessage;
    }
    
    public ErrorCategory getCategory() {
        return category;
    }
    
    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }
    
    public boolean isRecoverable() {
        return category == ErrorCategory.RECOVERABLE;
    }
    
    public boolean isTransient() {
        return category == ErrorCategory.TRANSIENT;
    }
    
    /**
     * Error category for distinguishing fatal, transient and locally recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * Recovered by the step that raised it (e.g. create falls back to update).
         */
        RECOVERABLE,
        
        /**
         * Network or throttling failure - safe to retry with backoff.
         */
        TRANSIENT,
        
        /**
         * Halts the run.
         */
        FATAL
    }
}
