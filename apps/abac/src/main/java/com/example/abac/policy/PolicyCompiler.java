package com.example.abac.policy;

import com.example.abac.exception.MalformedPolicyException;
import com.example.abac.function.AbacFunction;
import com.example.abac.function.FunctionRegistry;
import com.example.abac.model.AttributeFilter;
import com.example.abac.model.ConditionOperator;
import com.example.abac.model.Effect;
import com.example.abac.model.FilterOperator;
import com.example.abac.model.Policy;
import com.example.abac.model.QueryCondition;
import com.example.abac.policy.PolicyDefinition.AttributeFilterDefinition;
import com.example.abac.policy.PolicyDefinition.QueryConditionDefinition;
import com.example.abac.policy.PolicyDefinition.RuleDefinition;
import com.example.abac.rule.ComparisonOperator;
import com.example.abac.rule.Rule;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns stored {@link PolicyDefinition}s into evaluable {@link Policy} instances.
 *
 * <p>Operators, effects and function names are checked here, so a bad policy is rejected
 * once at load time instead of on every request. Rejected policies are logged and left
 * out; they never match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class PolicyCompiler {

    private static final String AND = "AND";
    private static final String OR = "OR";

    private final FunctionRegistry functionRegistry;

    public List<Policy> compileAll(Collection<PolicyDefinition> definitions) {
        List<Policy> policies = new ArrayList<>(definitions.size());
        for (PolicyDefinition definition : definitions) {
            if (definition == null) {
                log.warn("Skipping null policy definition");
                continue;
            }
            try {
                policies.add(compile(definition));
            } catch (MalformedPolicyException e) {
                log.warn("Rejected policy '{}' ({}): {}", definition.name(), definition.id(), e.getMessage());
            } catch (RuntimeException e) {
                log.error("Failed to compile policy '{}' ({}), skipping it", definition.name(), definition.id(), e);
            }
        }
        log.debug("Compiled {} of {} policies", policies.size(), definitions.size());
        return policies;
    }

    /**
     * @throws MalformedPolicyException when the definition cannot be evaluated, including
     *                                  {@link com.example.abac.exception.UnknownFunctionException}
     */
    public Policy compile(PolicyDefinition definition) {
        if (definition.name() == null || definition.name().isBlank()) {
            throw new MalformedPolicyException("Policy name is required");
        }
        String id = definition.id() != null ? definition.id() : definition.name();

        return new Policy(
                id,
                definition.name(),
                definition.description(),
                Effect.fromWire(definition.effect()),
                compileActions(definition.actions()),
                compileFilters(definition.subjects()),
                compileFilters(definition.resources()),
                compileConditions(definition.queryConditions()),
                definition.conditions() != null ? compileRule(definition.conditions()) : null,
                definition.active()
        );
    }

    private List<String> compileActions(@Nullable List<String> actions) {
        if (actions == null) {
            return List.of();
        }
        if (actions.stream().anyMatch(PolicyCompiler::isBlank)) {
            throw new MalformedPolicyException("Actions must not contain null or blank entries");
        }
        return actions;
    }

    private List<AttributeFilter> compileFilters(@Nullable List<AttributeFilterDefinition> definitions) {
        if (definitions == null) {
            return List.of();
        }
        List<AttributeFilter> filters = new ArrayList<>(definitions.size());
        for (AttributeFilterDefinition definition : definitions) {
            if (definition == null) {
                throw new MalformedPolicyException("Attribute filter list contains a null entry");
            }
            if (definition.key() == null || definition.key().isBlank()) {
                throw new MalformedPolicyException("Attribute filter without a key");
            }
            FilterOperator operator = FilterOperator.fromWire(definition.operator());
            List<String> values = definition.value() == null ? List.of() : definition.value();
            if (values.stream().anyMatch(Objects::isNull)) {
                throw new MalformedPolicyException("Filter on '" + definition.key() + "' has a null value");
            }
            if (operator != FilterOperator.IN && values.size() != 1) {
                throw new MalformedPolicyException(String.format("Filter on '%s' with operator '%s' needs exactly one value",
                        definition.key(), definition.operator()));
            }
            filters.add(new AttributeFilter(definition.key(), operator, values));
        }
        return filters;
    }

    private List<QueryCondition> compileConditions(@Nullable List<QueryConditionDefinition> definitions) {
        if (definitions == null) {
            return List.of();
        }
        List<QueryCondition> conditions = new ArrayList<>(definitions.size());
        for (QueryConditionDefinition definition : definitions) {
            if (definition == null) {
                throw new MalformedPolicyException("Query condition list contains a null entry");
            }
            if (isBlank(definition.resourceAttribute()) || isBlank(definition.subjectAttribute())) {
                throw new MalformedPolicyException("Query condition needs both resource_attribute and subject_attribute");
            }
            conditions.add(new QueryCondition(
                    definition.resourceAttribute(),
                    ConditionOperator.fromWire(definition.operator()),
                    definition.subjectAttribute()));
        }
        return conditions;
    }

    Rule compileRule(@Nullable RuleDefinition definition) {
        if (definition == null) {
            throw new MalformedPolicyException("Condition rule must not be null");
        }
        if (definition.rules() != null) {
            String operator = definition.operator() == null ? AND : definition.operator().toUpperCase(Locale.ROOT);
            List<Rule> children = definition.rules().stream()
                    .map(this::compileRule)
                    .toList();
            return switch (operator) {
                case AND -> new Rule.AllOf(children);
                case OR -> new Rule.AnyOf(children);
                default -> throw new MalformedPolicyException("Unknown logical operator: " + definition.operator());
            };
        }
        if (definition.function() != null) {
            AbacFunction function = functionRegistry.resolve(definition.function());
            List<String> args = definition.args() == null ? List.of() : definition.args();
            if (args.stream().anyMatch(Objects::isNull)) {
                throw new MalformedPolicyException("Function '" + definition.function() + "' has a null argument");
            }
            functionRegistry.checkArity(function, args.size());
            return new Rule.FunctionCall(function, args);
        }
        if (isBlank(definition.attribute())) {
            throw new MalformedPolicyException("Condition needs an attribute, a function or nested rules");
        }
        ComparisonOperator operator = ComparisonOperator.fromWire(definition.operator());
        if (operator == ComparisonOperator.IN && !(definition.value() instanceof Collection<?>)) {
            throw new MalformedPolicyException("'in' condition on '" + definition.attribute() + "' expects a list");
        }
        return new Rule.Comparison(definition.attribute(), operator, definition.value());
    }

    private static boolean isBlank(@Nullable String value) {
        return value == null || value.isBlank();
    }
}
