package com.example.abac.policy;

import java.time.Instant;
import java.util.List;

/**
 * The active policy set as cached between store reads.
 */
public record PolicySnapshot(List<PolicyDefinition> policies, Instant loadedAt) {

    public PolicySnapshot {
        policies = policies == null ? List.of() : List.copyOf(policies);
    }

    public static PolicySnapshot of(List<PolicyDefinition> policies) {
        return new PolicySnapshot(policies, Instant.now());
    }
}
