package com.example.abac.model;

import com.example.abac.exception.MalformedPolicyException;
import org.springframework.lang.Nullable;

import java.util.Locale;

public enum Effect {
    ALLOW,
    DENY;

    /**
     * Parses the stored effect, defaulting to {@link #ALLOW} when none is given.
     */
    public static Effect fromWire(@Nullable String value) {
        if (value == null || value.isBlank()) {
            return ALLOW;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "allow" -> ALLOW;
            case "deny" -> DENY;
            default -> throw new MalformedPolicyException("Unknown policy effect: " + value);
        };
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
