package com.example.abac.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Attributes of the user requesting access, as supplied by the subject directory.
 */
public record SubjectAttributes(
        @NonNull String id,
        @Nullable String username,
        @Nullable String email,
        @Nullable String phone,
        @Nullable String department,
        @Nullable Integer securityLevel,
        @Nullable Boolean active,
        @NonNull List<String> roles
) {
    public SubjectAttributes {
        active = active == null ? Boolean.TRUE : active;
        roles = roles == null ? List.of() : List.copyOf(roles);
    }

    public boolean hasRole(String role) {
        return roles.contains(role);
    }
}
