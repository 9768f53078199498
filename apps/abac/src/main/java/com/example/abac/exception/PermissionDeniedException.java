package com.example.abac.exception;

import org.springframework.lang.Nullable;

/**
 * Raised when a permission assertion fails. Rendered as HTTP 403 without any
 * evaluation detail.
 */
public class PermissionDeniedException extends RuntimeException {

    private final String action;
    private final String resourceType;
    @Nullable
    private final String resourceId;

    public PermissionDeniedException(String action, String resourceType, @Nullable String resourceId) {
        super(buildMessage(action, resourceType, resourceId));
        this.action = action;
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    private static String buildMessage(String action, String resourceType, @Nullable String resourceId) {
        String target = resourceId != null ? resourceType + "/" + resourceId : resourceType;
        return "Permission denied: " + action + " on " + target;
    }

    public String getAction() {
        return action;
    }

    public String getResourceType() {
        return resourceType;
    }

    @Nullable
    public String getResourceId() {
        return resourceId;
    }
}
