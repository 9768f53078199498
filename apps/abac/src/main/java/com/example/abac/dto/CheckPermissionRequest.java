package com.example.abac.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record CheckPermissionRequest(
        @NotBlank @Size(max = 64) String action,
        @JsonProperty("resource_type") @NotBlank @Size(max = 64) String resourceType,
        @JsonProperty("resource_id") @Size(max = 128) String resourceId
) {
}
