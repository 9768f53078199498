package com.example.abac.engine;

import com.example.abac.attribute.AttributeNamespace;
import com.example.abac.model.AccessDecision;
import com.example.abac.model.MatchError;
import com.example.abac.model.MatchResult;
import com.example.abac.model.Policy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Point-check decisions with deny-overrides combining.
 *
 * <p>Active deny policies are tried first and the first match denies. Only then are
 * active allow policies tried, the first match allowing. When nothing matches the
 * request is denied. Policies that fail to evaluate count as not matching and are
 * reported on the decision.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyEvaluator {

    private final PolicyMatcher policyMatcher;

    public boolean decide(
            List<Policy> policies,
            AttributeNamespace namespace,
            String action,
            String resourceType,
            @Nullable String resourceId) {
        return evaluate(policies, namespace, action, resourceType, resourceId).allowed();
    }

    public AccessDecision evaluate(
            List<Policy> policies,
            AttributeNamespace namespace,
            String action,
            String resourceType,
            @Nullable String resourceId) {

        log.debug("Evaluating {} on {}/{} against {} policies", action, resourceType, resourceId, policies.size());
        List<MatchError> errors = new ArrayList<>();

        for (Policy policy : policies) {
            if (!policy.active() || !policy.isDeny()) {
                continue;
            }
            if (matched(policy, namespace, action, resourceType, errors)) {
                log.warn("Access DENIED by policy {} ({}): action={}, resource={}/{}",
                        policy.id(), policy.name(), action, resourceType, resourceId);
                return AccessDecision.deny(policy, errors);
            }
        }

        for (Policy policy : policies) {
            if (!policy.active() || !policy.isAllow()) {
                continue;
            }
            if (matched(policy, namespace, action, resourceType, errors)) {
                log.info("Access ALLOWED by policy {} ({}): action={}, resource={}/{}",
                        policy.id(), policy.name(), action, resourceType, resourceId);
                return AccessDecision.allow(policy, errors);
            }
        }

        log.warn("Access DENIED (no applicable policy): action={}, resource={}/{}", action, resourceType, resourceId);
        return AccessDecision.defaultDeny(errors);
    }

    private boolean matched(
            Policy policy,
            AttributeNamespace namespace,
            String action,
            String resourceType,
            List<MatchError> errors) {
        MatchResult result = policyMatcher.matchInstance(policy, namespace, action, resourceType);
        if (result.isFailed()) {
            errors.add(result.error());
        }
        return result.isMatched();
    }
}
