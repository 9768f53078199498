package com.example.abac.model;

import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Result of a point check. Errors list the policies that failed during evaluation;
 * they are diagnostics only and never change the outcome.
 */
public record AccessDecision(
        boolean allowed,
        @Nullable String policyId,
        String reason,
        List<MatchError> errors
) {
    public static final String DEFAULT_DENY = "DEFAULT_DENY";
    public static final String INACTIVE_SUBJECT = "INACTIVE_SUBJECT";
    public static final String UNKNOWN_SUBJECT = "UNKNOWN_SUBJECT";

    public AccessDecision {
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static AccessDecision allow(Policy policy, List<MatchError> errors) {
        return new AccessDecision(true, policy.id(), "Allowed by policy '" + policy.name() + "'", errors);
    }

    public static AccessDecision deny(Policy policy, List<MatchError> errors) {
        return new AccessDecision(false, policy.id(), "Denied by policy '" + policy.name() + "'", errors);
    }

    public static AccessDecision defaultDeny(List<MatchError> errors) {
        return new AccessDecision(false, DEFAULT_DENY, "No policy granted access for this request", errors);
    }

    public static AccessDecision deny(String code, String reason) {
        return new AccessDecision(false, code, reason, List.of());
    }

    public boolean isDenied() {
        return !allowed;
    }
}
