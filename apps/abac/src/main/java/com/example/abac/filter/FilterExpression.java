package com.example.abac.filter;

import com.example.abac.attribute.AttributeResolver;
import com.example.abac.model.AttributeValue;

import java.util.List;
import java.util.Map;

/**
 * Store-independent row predicate produced for one list query.
 *
 * <p>{@link MatchAll} means no extra filtering, {@link MatchNone} excludes every row.
 * {@link #test(Map)} evaluates the predicate in memory with the same equality the
 * point check uses, so both paths agree on a row.
 */
public sealed interface FilterExpression
        permits FilterExpression.MatchAll, FilterExpression.MatchNone, FilterExpression.Equals,
                FilterExpression.And, FilterExpression.Or {

    boolean test(Map<String, ?> row);

    static FilterExpression all() {
        return new MatchAll();
    }

    static FilterExpression none() {
        return new MatchNone();
    }

    static FilterExpression eq(String attribute, Object value) {
        return new Equals(attribute, value);
    }

    static FilterExpression and(List<FilterExpression> operands) {
        return operands.size() == 1 ? operands.get(0) : new And(operands);
    }

    static FilterExpression or(List<FilterExpression> operands) {
        return operands.size() == 1 ? operands.get(0) : new Or(operands);
    }

    record MatchAll() implements FilterExpression {
        @Override
        public boolean test(Map<String, ?> row) {
            return true;
        }
    }

    record MatchNone() implements FilterExpression {
        @Override
        public boolean test(Map<String, ?> row) {
            return false;
        }
    }

    /**
     * {@code attribute == value}; the attribute may be a dotted path into the row.
     */
    record Equals(String attribute, Object value) implements FilterExpression {
        @Override
        public boolean test(Map<String, ?> row) {
            AttributeValue actual = AttributeResolver.resolve(attribute, AttributeValue.of(row));
            return AttributeValue.sameValue(actual, AttributeValue.of(value));
        }
    }

    record And(List<FilterExpression> operands) implements FilterExpression {
        public And {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean test(Map<String, ?> row) {
            return operands.stream().allMatch(operand -> operand.test(row));
        }
    }

    record Or(List<FilterExpression> operands) implements FilterExpression {
        public Or {
            operands = List.copyOf(operands);
        }

        @Override
        public boolean test(Map<String, ?> row) {
            return operands.stream().anyMatch(operand -> operand.test(row));
        }
    }
}
