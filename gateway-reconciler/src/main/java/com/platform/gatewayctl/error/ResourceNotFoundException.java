package com.platform.gatewayctl.error;

/**
 * Exception for a referenced API, resource or ancestor that does not exist.
 */
public class ResourceNotFoundException extends GatewayControlException {
    
    private final String resourceType;
    private final String resourceId;
    
    public ResourceNotFoundException(String resourceType, String resourceId) {
        super(ErrorCode.RESOURCE_NOT_FOUND, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, 
            String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public ResourceNotFoundException(String resourceType, String resourceId, String message, Throwable cause) {
        super(ErrorCode.RESOURCE_NOT_FOUND, message, cause);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }
    
    public static ResourceNotFoundException api(String apiName) {
        return new ResourceNotFoundException(ErrorCode.API_NOT_FOUND, "REST API", apiName);
    }
    
    public static ResourceNotFoundException rootResource(String apiId) {
        return new ResourceNotFoundException(ErrorCode.ROOT_RESOURCE_NOT_FOUND, "Root resource of API", apiId);
    }
    
    public String getResourceType() {
        return resourceType;
    }
    
    public String getResourceId() {
        return resourceId;
    }
}
