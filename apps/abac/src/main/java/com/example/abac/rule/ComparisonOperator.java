package com.example.abac.rule;

import com.example.abac.exception.MalformedPolicyException;
import com.example.abac.model.AttributeValue;
import com.example.abac.model.AttributeValue.Scalar;
import com.example.abac.model.AttributeValue.Sequence;
import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.Collection;

/**
 * Operators available to {@link Rule.Comparison}. An absent actual value fails every
 * operator, {@link #NOT_EQUALS} included.
 */
public enum ComparisonOperator {

    EQUALS("equals") {
        @Override
        boolean test(AttributeValue actual, @Nullable Object expected) {
            return AttributeValue.sameValue(actual, AttributeValue.of(expected));
        }
    },
    NOT_EQUALS("not_equals") {
        @Override
        boolean test(AttributeValue actual, @Nullable Object expected) {
            return !AttributeValue.sameValue(actual, AttributeValue.of(expected));
        }
    },
    IN("in") {
        @Override
        boolean test(AttributeValue actual, @Nullable Object expected) {
            if (!(expected instanceof Collection<?> candidates)) {
                throw new MalformedPolicyException("'in' expects a list of values");
            }
            return actual.elements().stream()
                    .anyMatch(element -> candidates.stream()
                            .anyMatch(candidate -> AttributeValue.sameValue(element, AttributeValue.of(candidate))));
        }
    },
    GREATER_THAN("greater_than") {
        @Override
        boolean test(AttributeValue actual, @Nullable Object expected) {
            return order(actual, expected) > 0;
        }
    },
    GREATER_THAN_OR_EQUAL("greater_than_or_equal") {
        @Override
        boolean test(AttributeValue actual, @Nullable Object expected) {
            return order(actual, expected) >= 0;
        }
    },
    LESS_THAN("less_than") {
        @Override
        boolean test(AttributeValue actual, @Nullable Object expected) {
            return order(actual, expected) < 0;
        }
    },
    LESS_THAN_OR_EQUAL("less_than_or_equal") {
        @Override
        boolean test(AttributeValue actual, @Nullable Object expected) {
            return order(actual, expected) <= 0;
        }
    };

    private final String wireName;

    ComparisonOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean evaluate(AttributeValue actual, @Nullable Object expected) {
        if (actual.isAbsent()) {
            return false;
        }
        return test(actual, expected);
    }

    abstract boolean test(AttributeValue actual, @Nullable Object expected);

    public static ComparisonOperator fromWire(String value) {
        return Arrays.stream(values())
                .filter(operator -> operator.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new MalformedPolicyException("Unknown ABAC operator: " + value));
    }

    private static int order(AttributeValue actual, @Nullable Object expected) {
        if (expected == null) {
            throw new IllegalArgumentException("Cannot order against a missing value");
        }
        if (actual instanceof Scalar scalar) {
            return scalar.orderAgainst(expected);
        }
        if (actual instanceof Sequence) {
            throw new IllegalArgumentException("Cannot order a sequence of values");
        }
        throw new IllegalArgumentException("Cannot order a nested attribute");
    }
}
