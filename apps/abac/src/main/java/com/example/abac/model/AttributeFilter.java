package com.example.abac.model;

import org.springframework.lang.NonNull;

import java.util.List;

/**
 * Predicate over one attribute path that decides whether a policy applies.
 *
 * @param key      dot-separated attribute path, e.g. {@code user.roles}
 * @param operator how the resolved value is compared with {@code values}
 * @param values   expected values
 */
public record AttributeFilter(
        @NonNull String key,
        @NonNull FilterOperator operator,
        @NonNull List<String> values
) {
    public static final String RESOURCE_TYPE_KEY = "resource.type";
    public static final String WILDCARD = "*";

    public AttributeFilter {
        values = values == null ? List.of() : List.copyOf(values);
    }

    public boolean isResourceType() {
        return RESOURCE_TYPE_KEY.equals(key);
    }
}
