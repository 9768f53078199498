package com.example.abac.dto;

public record CheckPermissionResponse(boolean allowed) {
}
