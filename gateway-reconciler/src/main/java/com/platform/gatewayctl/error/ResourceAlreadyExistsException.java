package com.platform.gatewayctl.error;

/**
 * Raised by a create call when the target object already exists.
 * Never surfaced to the caller of the configurator: it triggers the update fallback.
 */
public class ResourceAlreadyExistsException extends GatewayControlException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceAlreadyExistsException(String resourceType, String resourceId) {
        super(ErrorCode.RESOURCE_ALREADY_EXISTS,
            String.format("%s already exists: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public ResourceAlreadyExistsException(String resourceType, String resourceId, String message, Throwable cause) {
        super(ErrorCode.RESOURCE_ALREADY_EXISTS, message, cause);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
