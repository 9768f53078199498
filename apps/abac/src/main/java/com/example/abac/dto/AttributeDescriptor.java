package com.example.abac.dto;

import java.util.List;

/**
 * One entry of the attribute vocabulary offered to policy authors.
 */
public record AttributeDescriptor(String key, String name, Category category, String type) {

    public enum Category {
        subject, resource, environment
    }

    public static final List<AttributeDescriptor> VOCABULARY = List.of(
            new AttributeDescriptor("user.id", "User ID", Category.subject, "integer"),
            new AttributeDescriptor("user.username", "Username", Category.subject, "string"),
            new AttributeDescriptor("user.email", "Email", Category.subject, "string"),
            new AttributeDescriptor("user.phone", "Phone", Category.subject, "string"),
            new AttributeDescriptor("user.department", "Department", Category.subject, "string"),
            new AttributeDescriptor("user.is_active", "Active", Category.subject, "boolean"),
            new AttributeDescriptor("user.security_level", "Security level", Category.subject, "integer"),
            new AttributeDescriptor("user.roles", "Roles", Category.subject, "array_string"),
            new AttributeDescriptor("resource.type", "Resource type", Category.resource, "string"),
            new AttributeDescriptor("resource.id", "Resource ID", Category.resource, "string"),
            new AttributeDescriptor("resource.owner_id", "Owner ID", Category.resource, "integer"),
            new AttributeDescriptor("environment.current_time", "Current time", Category.environment, "datetime")
    );
}
