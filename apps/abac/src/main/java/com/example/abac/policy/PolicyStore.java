package com.example.abac.policy;

import com.example.abac.filter.FilterExpression;
import reactor.core.publisher.Flux;

/**
 * Read-only access to stored policies.
 */
public interface PolicyStore {

    /**
     * Policies whose {@code is_active} is missing or non-zero, in stored order.
     */
    Flux<PolicyDefinition> findActivePolicies();

    /**
     * Every stored policy, active or not, that satisfies {@code filter}.
     */
    Flux<PolicyDefinition> findMatching(FilterExpression filter);
}
