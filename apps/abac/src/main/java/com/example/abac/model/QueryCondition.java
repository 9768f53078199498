package com.example.abac.model;

import org.springframework.lang.NonNull;

/**
 * Row-level comparison {@code resource.<resourceAttribute> <op> user.<subjectAttribute>}.
 */
public record QueryCondition(
        @NonNull String resourceAttribute,
        @NonNull ConditionOperator operator,
        @NonNull String subjectAttribute
) {
    public String resourcePath() {
        return "resource." + resourceAttribute;
    }

    public String subjectPath() {
        return "user." + subjectAttribute;
    }
}
