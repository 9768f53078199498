package com.example.abac.rule;

import com.example.abac.attribute.AttributeNamespace;
import com.example.abac.function.FunctionRegistry;
import com.example.abac.model.AttributeValue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Evaluates a policy's condition tree against a namespace.
 *
 * <p>Throws {@link IllegalArgumentException} or
 * {@link com.example.abac.exception.MalformedPolicyException} when operands cannot be
 * compared; the policy matcher turns these into a failed match.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RuleEvaluator {

    private final FunctionRegistry functionRegistry;

    public boolean evaluate(Rule rule, AttributeNamespace namespace) {
        if (rule instanceof Rule.AllOf allOf) {
            for (Rule child : allOf.rules()) {
                if (!evaluate(child, namespace)) {
                    return false;
                }
            }
            return true;
        }
        if (rule instanceof Rule.AnyOf anyOf) {
            for (Rule child : anyOf.rules()) {
                if (evaluate(child, namespace)) {
                    return true;
                }
            }
            return false;
        }
        if (rule instanceof Rule.Comparison comparison) {
            AttributeValue actual = namespace.resolve(comparison.attribute());
            boolean result = comparison.operator().evaluate(actual, comparison.expected());
            log.debug("Condition {} {} {} -> {} (actual={})", comparison.attribute(),
                    comparison.operator().wireName(), comparison.expected(), result, actual);
            return result;
        }
        Rule.FunctionCall call = (Rule.FunctionCall) rule;
        List<AttributeValue> args = call.argumentPaths().stream()
                .map(namespace::resolve)
                .toList();
        boolean result = functionRegistry.call(call.function(), args);
        log.debug("Function {}{} -> {}", call.function().functionName(), call.argumentPaths(), result);
        return result;
    }
}
