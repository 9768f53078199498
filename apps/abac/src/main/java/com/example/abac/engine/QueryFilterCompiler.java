package com.example.abac.engine;

import com.example.abac.attribute.AttributeNamespace;
import com.example.abac.filter.FilterExpression;
import com.example.abac.model.AttributeValue;
import com.example.abac.model.AttributeValue.Scalar;
import com.example.abac.model.MatchResult;
import com.example.abac.model.Policy;
import com.example.abac.model.QueryCondition;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiles the allow policies that apply to a subject into a row filter for list queries.
 *
 * <p>Only allow policies are considered; deny policies are not reflected in the filter.
 * An applicable policy without query conditions grants the whole resource type and
 * short-circuits to {@link FilterExpression#all()}. Otherwise each applicable policy
 * contributes the AND of its conditions, the contributions are OR-ed, and with no
 * contribution at all the result is {@link FilterExpression#none()}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QueryFilterCompiler {

    private final PolicyMatcher policyMatcher;

    public FilterExpression compile(
            List<Policy> policies,
            AttributeNamespace subjectNamespace,
            String action,
            String resourceType) {

        List<FilterExpression> grants = new ArrayList<>();

        for (Policy policy : policies) {
            if (!policy.active() || !policy.isAllow()) {
                continue;
            }
            MatchResult result = policyMatcher.matchApplicability(policy, subjectNamespace, action, resourceType);
            if (!result.isMatched()) {
                continue;
            }
            if (policy.isUnconditional()) {
                log.debug("Policy '{}' grants {} on all {} rows", policy.name(), action, resourceType);
                return FilterExpression.all();
            }
            FilterExpression grant = conditionsFilter(policy, subjectNamespace);
            if (grant != null) {
                grants.add(grant);
            }
        }

        if (grants.isEmpty()) {
            log.debug("No policy grants {} on {}, filtering out every row", action, resourceType);
            return FilterExpression.none();
        }
        return FilterExpression.or(grants);
    }

    @Nullable
    private FilterExpression conditionsFilter(Policy policy, AttributeNamespace subjectNamespace) {
        List<FilterExpression> terms = new ArrayList<>(policy.queryConditions().size());
        for (QueryCondition condition : policy.queryConditions()) {
            AttributeValue subjectValue = subjectNamespace.resolve(condition.subjectPath());
            if (!(subjectValue instanceof Scalar scalar)) {
                // No row can equal a missing or multi-valued subject attribute
                log.debug("Policy '{}' contributes nothing: {} is {}", policy.name(),
                        condition.subjectPath(), subjectValue.isAbsent() ? "absent" : "not a single value");
                return null;
            }
            terms.add(switch (condition.operator()) {
                case EQ -> FilterExpression.eq(condition.resourceAttribute(), scalar.value());
            });
        }
        return FilterExpression.and(terms);
    }
}
