package com.example.abac.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The resource a point check is made against.
 *
 * @param type       resource type, e.g. {@code file}
 * @param id         instance id, absent for type-level checks
 * @param attributes instance fields available under {@code resource.*}
 */
public record ResourceDescriptor(
        @NonNull String type,
        @Nullable String id,
        @NonNull Map<String, Object> attributes
) {
    public ResourceDescriptor {
        attributes = attributes == null ? Map.of() : new LinkedHashMap<>(attributes);
    }

    public static ResourceDescriptor of(@NonNull String type, @Nullable String id) {
        return new ResourceDescriptor(type, id, Map.of());
    }

    public ResourceDescriptor withType(@NonNull String resourceType) {
        return new ResourceDescriptor(resourceType, id, attributes);
    }
}
