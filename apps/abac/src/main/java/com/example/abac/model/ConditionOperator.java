package com.example.abac.model;

import com.example.abac.exception.MalformedPolicyException;

import java.util.Arrays;

/**
 * Operators for row-level query conditions. Each must translate to a store predicate.
 */
public enum ConditionOperator {
    EQ("eq");

    private final String wireName;

    ConditionOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public boolean test(AttributeValue resourceValue, AttributeValue subjectValue) {
        return switch (this) {
            case EQ -> AttributeValue.sameValue(resourceValue, subjectValue);
        };
    }

    public static ConditionOperator fromWire(String value) {
        return Arrays.stream(values())
                .filter(operator -> operator.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new MalformedPolicyException("Unknown query condition operator: " + value));
    }
}
