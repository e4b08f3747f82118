package com.platform.gatewayctl.error;

/**
 * Exception for dependency-order violations and ambiguous matches.
 */
public class ResourceConflictException extends GatewayControlException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceConflictException(ErrorCode errorCode, String resourceType, String resourceId, String message) {
        super(errorCode, message);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public ResourceConflictException(String resourceType, String resourceId, String message, Throwable cause) {
        super(ErrorCode.RESOURCE_CONFLICT, message, cause);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceConflictException ambiguous(String resourceType, String key, int matches) {
        return new ResourceConflictException(
            ErrorCode.AMBIGUOUS_MATCH,
            resourceType,
            key,
            String.format("%d %s entries match '%s'", matches, resourceType, key)
        );
    }
    
    public static ResourceConflictException missingDependency(String resourceType, String resourceId, String dependency) {
        return new ResourceConflictException(
            ErrorCode.DEPENDENCY_ORDER_VIOLATION,
            resourceType,
            resourceId,
            String.format("Cannot put %s on %s: %s does not exist yet", resourceType, resourceId, dependency)
        );
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
