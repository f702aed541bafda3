package com.platform.autoheal.error;

/**
 * Exception for when a requested workload does not exist or is not managed.
 */
public class ResourceNotFoundException extends AutoHealException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException workload(String workloadId) {
        return new ResourceNotFoundException(ErrorCode.WORKLOAD_NOT_FOUND, "Deployment", workloadId);
    }

    public static ResourceNotFoundException notManaged(String workloadId) {
        return new ResourceNotFoundException(ErrorCode.WORKLOAD_NOT_MANAGED, "Managed workload", workloadId);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
