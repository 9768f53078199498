package com.example.abac.engine;

import com.example.abac.attribute.AttributeNamespace;
import com.example.abac.exception.MalformedPolicyException;
import com.example.abac.model.AttributeFilter;
import com.example.abac.model.AttributeValue;
import com.example.abac.model.AttributeValue.Scalar;
import com.example.abac.model.AttributeValue.Sequence;
import com.example.abac.model.MatchError;
import com.example.abac.model.MatchResult;
import com.example.abac.model.Policy;
import com.example.abac.model.QueryCondition;
import com.example.abac.rule.RuleEvaluator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import static com.example.abac.model.AttributeFilter.WILDCARD;

/**
 * Decides whether a single policy applies to a request.
 *
 * <p>Clauses are checked in order and the first failing one stops the match:
 * <ol>
 *   <li>action: no actions listed, a {@code *} entry, or the requested action;</li>
 *   <li>resource: a {@code resource.type} filter naming the type or {@code *};</li>
 *   <li>subject: no filters, or any one filter holding for the subject;</li>
 *   <li>query conditions, only for instance checks: every condition holds;</li>
 *   <li>the condition tree, when the policy has one.</li>
 * </ol>
 *
 * <p>Nothing thrown while matching escapes: a malformed or unevaluable policy yields
 * {@link MatchResult#failed} and is treated as not matching.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyMatcher {

    private final RuleEvaluator ruleEvaluator;

    /**
     * Match used by point checks; query conditions compare the resource instance
     * against the subject.
     */
    public MatchResult matchInstance(Policy policy, AttributeNamespace namespace, String action, String resourceType) {
        return match(policy, namespace, action, resourceType, true);
    }

    /**
     * Match used by bulk filtering; query conditions are left to the store.
     */
    public MatchResult matchApplicability(Policy policy, AttributeNamespace namespace, String action, String resourceType) {
        return match(policy, namespace, action, resourceType, false);
    }

    public MatchResult match(
            Policy policy,
            AttributeNamespace namespace,
            String action,
            String resourceType,
            boolean checkInstance) {
        try {
            return MatchResult.of(matches(policy, namespace, action, resourceType, checkInstance));
        } catch (MalformedPolicyException e) {
            log.warn("Skipping malformed policy '{}' ({}): {}", policy.name(), policy.id(), e.getMessage());
            return MatchResult.failed(MatchError.of(policy, MatchError.Kind.MALFORMED_POLICY, e.getMessage()));
        } catch (RuntimeException e) {
            log.warn("Error evaluating policy '{}' ({}): {}", policy.name(), policy.id(), e.getMessage());
            return MatchResult.failed(MatchError.of(policy, MatchError.Kind.EVALUATION_ERROR, e.getMessage()));
        }
    }

    private boolean matches(
            Policy policy,
            AttributeNamespace namespace,
            String action,
            String resourceType,
            boolean checkInstance) {

        if (!actionMatches(policy, action)) {
            log.debug("Policy '{}': action '{}' not in {}", policy.name(), action, policy.actions());
            return false;
        }
        if (!resourceMatches(policy, resourceType)) {
            log.debug("Policy '{}': resource type '{}' not covered", policy.name(), resourceType);
            return false;
        }
        if (!subjectMatches(policy, namespace)) {
            log.debug("Policy '{}': subject attributes do not match", policy.name());
            return false;
        }
        if (checkInstance && !queryConditionsHold(policy, namespace)) {
            log.debug("Policy '{}': query conditions not met", policy.name());
            return false;
        }
        if (policy.condition() != null && !ruleEvaluator.evaluate(policy.condition(), namespace)) {
            log.debug("Policy '{}': condition rules not met", policy.name());
            return false;
        }
        log.debug("Policy '{}' matched {} on {}", policy.name(), action, resourceType);
        return true;
    }

    private boolean actionMatches(Policy policy, String action) {
        return policy.actions().isEmpty()
                || policy.actions().contains(WILDCARD)
                || policy.actions().contains(action);
    }

    private boolean resourceMatches(Policy policy, String resourceType) {
        for (AttributeFilter filter : policy.resources()) {
            if (!filter.isResourceType()) {
                continue;
            }
            boolean covered = switch (filter.operator()) {
                case IN -> filter.values().contains(WILDCARD) || filter.values().contains(resourceType);
                case EQ -> {
                    String expected = singleValue(filter);
                    yield WILDCARD.equals(expected) || expected.equals(resourceType);
                }
                case CONTAINS -> false;
            };
            if (covered) {
                return true;
            }
        }
        return false;
    }

    private boolean subjectMatches(Policy policy, AttributeNamespace namespace) {
        if (policy.subjects().isEmpty()) {
            return true;
        }
        for (AttributeFilter filter : policy.subjects()) {
            if (subjectFilterHolds(filter, namespace)) {
                return true;
            }
        }
        return false;
    }

    private boolean subjectFilterHolds(AttributeFilter filter, AttributeNamespace namespace) {
        AttributeValue resolved = namespace.resolve(filter.key());
        if (resolved.isAbsent()) {
            return false;
        }
        return switch (filter.operator()) {
            case IN -> resolved.elements().stream()
                    .anyMatch(element -> element instanceof Scalar scalar
                            && filter.values().stream().anyMatch(scalar::sameAs));
            case EQ -> resolved instanceof Scalar scalar && scalar.sameAs(singleValue(filter));
            case CONTAINS -> resolved instanceof Sequence sequence
                    && sequence.containsValue(new Scalar(singleValue(filter)));
        };
    }

    private boolean queryConditionsHold(Policy policy, AttributeNamespace namespace) {
        for (QueryCondition condition : policy.queryConditions()) {
            AttributeValue resourceValue = namespace.resolve(condition.resourcePath());
            AttributeValue subjectValue = namespace.resolve(condition.subjectPath());
            if (resourceValue.isAbsent() || subjectValue.isAbsent()) {
                log.debug("Policy '{}': cannot resolve {} or {}", policy.name(),
                        condition.resourcePath(), condition.subjectPath());
                return false;
            }
            if (!condition.operator().test(resourceValue, subjectValue)) {
                return false;
            }
        }
        return true;
    }

    private static String singleValue(AttributeFilter filter) {
        if (filter.values().size() != 1) {
            throw new MalformedPolicyException(String.format("Filter on '%s' with operator '%s' needs exactly one value, got %d",
                    filter.key(), filter.operator().wireName(), filter.values().size()));
        }
        return filter.values().get(0);
    }
}
