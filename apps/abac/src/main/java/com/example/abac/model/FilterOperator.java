package com.example.abac.model;

import com.example.abac.exception.MalformedPolicyException;

import java.util.Arrays;

/**
 * Operators allowed in subject and resource filters.
 */
public enum FilterOperator {
    EQ("eq"),
    IN("in"),
    CONTAINS("contains");

    private final String wireName;

    FilterOperator(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static FilterOperator fromWire(String value) {
        return Arrays.stream(values())
                .filter(operator -> operator.wireName.equals(value))
                .findFirst()
                .orElseThrow(() -> new MalformedPolicyException("Unknown filter operator: " + value));
    }
}
