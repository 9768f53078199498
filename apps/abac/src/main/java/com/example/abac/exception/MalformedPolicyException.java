package com.example.abac.exception;

/**
 * A stored policy cannot be turned into an evaluable one: unknown operator, unknown effect,
 * wrong number of values or arguments, or a missing required field.
 */
public class MalformedPolicyException extends RuntimeException {

    public MalformedPolicyException(String message) {
        super(message);
    }

    public MalformedPolicyException(String message, Throwable cause) {
        super(message, cause);
    }
}
