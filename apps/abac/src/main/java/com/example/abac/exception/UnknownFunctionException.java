package com.example.abac.exception;

/**
 * A policy condition names a function that is not registered.
 */
public class UnknownFunctionException extends MalformedPolicyException {

    private final String functionName;

    public UnknownFunctionException(String functionName) {
        super("Unknown ABAC function: " + functionName);
        this.functionName = functionName;
    }

    public String getFunctionName() {
        return functionName;
    }
}
