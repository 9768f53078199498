package com.example.abac.rule;

import com.example.abac.function.AbacFunction;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Condition tree attached to a policy.
 */
public sealed interface Rule permits Rule.AllOf, Rule.AnyOf, Rule.Comparison, Rule.FunctionCall {

    /** Holds when every child holds; an empty group holds. */
    record AllOf(List<Rule> rules) implements Rule {
        public AllOf {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }

    /** Holds when at least one child holds; an empty group does not. */
    record AnyOf(List<Rule> rules) implements Rule {
        public AnyOf {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }

    record Comparison(String attribute, ComparisonOperator operator, @Nullable Object expected) implements Rule {
    }

    record FunctionCall(AbacFunction function, List<String> argumentPaths) implements Rule {
        public FunctionCall {
            argumentPaths = argumentPaths == null ? List.of() : List.copyOf(argumentPaths);
        }
    }
}
