package com.example.abac.function;

import com.example.abac.exception.MalformedPolicyException;
import com.example.abac.exception.UnknownFunctionException;
import com.example.abac.model.AttributeValue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed mapping from function names to {@link AbacFunction}s. Names are resolved once when
 * policies are compiled; evaluation then calls the enum constant directly.
 */
@Slf4j
public class FunctionRegistry {

    private final Map<String, AbacFunction> functions;

    public FunctionRegistry(Set<AbacFunction> enabled) {
        this.functions = Collections.unmodifiableMap(enabled.stream()
                .collect(Collectors.toMap(AbacFunction::functionName, Function.identity(),
                        (left, right) -> left, LinkedHashMap::new)));
        log.info("ABAC function registry initialized with {}", functions.keySet());
    }

    public static FunctionRegistry withDefaults() {
        return new FunctionRegistry(EnumSet.allOf(AbacFunction.class));
    }

    /**
     * @throws UnknownFunctionException when nothing is registered under {@code name}
     */
    @NonNull
    public AbacFunction resolve(String name) {
        AbacFunction function = functions.get(name);
        if (function == null) {
            throw new UnknownFunctionException(name);
        }
        return function;
    }

    public boolean call(String name, List<AttributeValue> args) {
        return call(resolve(name), args);
    }

    /**
     * @throws MalformedPolicyException when the argument count does not match the function
     */
    public boolean call(@NonNull AbacFunction function, @NonNull List<AttributeValue> args) {
        checkArity(function, args.size());
        return function.apply(args);
    }

    public void checkArity(AbacFunction function, int argumentCount) {
        if (argumentCount != function.arity()) {
            throw new MalformedPolicyException(String.format("Function %s expects %d argument(s) but got %d",
                    function.functionName(), function.arity(), argumentCount));
        }
    }

    public Set<String> registeredNames() {
        return functions.keySet();
    }

    @Override
    public String toString() {
        return "FunctionRegistry" + Arrays.toString(functions.keySet().toArray());
    }
}
