package com.example.abac.attribute;

import com.example.abac.model.ResourceDescriptor;
import com.example.abac.model.SubjectAttributes;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Builds the attribute namespace from a subject, a resource and an action.
 * Attribute keys use the snake_case names policies are written against.
 */
@Component
@RequiredArgsConstructor
public class AttributeExtractor {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Full namespace for a point check.
     */
    @NonNull
    public AttributeNamespace namespace(
            @NonNull SubjectAttributes subject,
            @NonNull ResourceDescriptor resource,
            @NonNull String action) {
        return AttributeNamespace.of(
                userAttributes(subject),
                resourceAttributes(resource),
                Map.of("type", action),
                environmentAttributes());
    }

    /**
     * Namespace for bulk filtering, where no resource instance exists yet.
     */
    @NonNull
    public AttributeNamespace subjectNamespace(
            @NonNull SubjectAttributes subject,
            @NonNull String resourceType,
            @NonNull String action) {
        return AttributeNamespace.of(
                userAttributes(subject),
                Map.of("type", resourceType),
                Map.of("type", action),
                environmentAttributes());
    }

    @NonNull
    public Map<String, Object> userAttributes(@NonNull SubjectAttributes subject) {
        Map<String, Object> user = new LinkedHashMap<>();
        user.put("id", subject.id());
        putIfPresent(user, "username", subject.username());
        putIfPresent(user, "email", subject.email());
        putIfPresent(user, "phone", subject.phone());
        putIfPresent(user, "department", subject.department());
        putIfPresent(user, "security_level", subject.securityLevel());
        user.put("is_active", subject.active());
        user.put("roles", subject.roles());
        return user;
    }

    @NonNull
    public Map<String, Object> resourceAttributes(@NonNull ResourceDescriptor resource) {
        Map<String, Object> attributes = new LinkedHashMap<>(resource.attributes());
        attributes.put("type", resource.type());
        putIfPresent(attributes, "id", resource.id());
        return attributes;
    }

    /**
     * Describes a domain object as a resource. Its fields come from Jackson so they carry
     * the same names the object has on the wire; the type defaults to the lower-cased
     * simple class name.
     */
    @NonNull
    public ResourceDescriptor describe(@NonNull Object resource, @Nullable String resourceType) {
        Map<String, Object> fields = objectMapper.convertValue(resource, MAP_TYPE);
        String type = resourceType != null
                ? resourceType
                : resource.getClass().getSimpleName().toLowerCase(Locale.ROOT);
        Object id = fields.get("id");
        return new ResourceDescriptor(type, id != null ? String.valueOf(id) : null, fields);
    }

    private Map<String, Object> environmentAttributes() {
        return Map.of("current_time", LocalDateTime.now(clock));
    }

    private static void putIfPresent(Map<String, Object> target, String key, @Nullable Object value) {
        if (value != null) {
            target.put(key, value);
        }
    }
}
