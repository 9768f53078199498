package com.example.abac.model;

import com.example.abac.rule.Rule;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Validated policy ready for evaluation. Built from stored definitions by
 * {@link com.example.abac.policy.PolicyCompiler}; never mutated by the engine.
 */
public record Policy(
        @NonNull String id,
        @NonNull String name,
        @Nullable String description,
        @NonNull Effect effect,
        @NonNull List<String> actions,
        @NonNull List<AttributeFilter> subjects,
        @NonNull List<AttributeFilter> resources,
        @NonNull List<QueryCondition> queryConditions,
        @Nullable Rule condition,
        boolean active
) {
    public Policy {
        effect = effect == null ? Effect.ALLOW : effect;
        actions = actions == null ? List.of() : List.copyOf(actions);
        subjects = subjects == null ? List.of() : List.copyOf(subjects);
        resources = resources == null ? List.of() : List.copyOf(resources);
        queryConditions = queryConditions == null ? List.of() : List.copyOf(queryConditions);
    }

    public boolean isAllow() {
        return effect == Effect.ALLOW;
    }

    public boolean isDeny() {
        return effect == Effect.DENY;
    }

    public boolean isUnconditional() {
        return queryConditions.isEmpty();
    }
}
