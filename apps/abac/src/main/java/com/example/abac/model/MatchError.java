package com.example.abac.model;

/**
 * Why a single policy could not be evaluated.
 */
public record MatchError(String policyId, String policyName, Kind kind, String detail) {

    public enum Kind {
        /** The policy shape cannot be evaluated, e.g. an {@code eq} filter with two values. */
        MALFORMED_POLICY,
        /** Evaluation hit operands or arguments it cannot handle. */
        EVALUATION_ERROR
    }

    public static MatchError of(Policy policy, Kind kind, String detail) {
        return new MatchError(policy.id(), policy.name(), kind, detail);
    }
}
