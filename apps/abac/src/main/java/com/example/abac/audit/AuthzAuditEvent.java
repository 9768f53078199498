package com.example.abac.audit;

import com.example.abac.model.AccessDecision;
import com.example.abac.model.MatchError;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured audit record for one authorization decision.
 */
public record AuthzAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,
        String correlationId,

        // Decision
        Outcome outcome,
        String policyId,
        String reason,
        List<String> failedPolicies,

        // Request
        String subjectId,
        String action,
        String resourceType,
        String resourceId,

        // Request context
        String path,
        String method,
        String clientIp,
        String userAgent
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static AuthzAuditEvent from(
            String subjectId,
            String action,
            String resourceType,
            String resourceId,
            AccessDecision decision,
            RequestContext requestContext) {

        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                requestContext.correlationId(),
                decision.allowed() ? Outcome.ALLOW : Outcome.DENY,
                decision.policyId(),
                decision.reason(),
                decision.errors().stream().map(MatchError::policyId).toList(),
                subjectId,
                action,
                resourceType,
                resourceId,
                requestContext.path(),
                requestContext.method(),
                requestContext.clientIp(),
                requestContext.userAgent()
        );
    }

    public static AuthzAuditEvent error(
            String subjectId,
            String action,
            String resourceType,
            String resourceId,
            String errorReason,
            RequestContext requestContext) {

        return new AuthzAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                requestContext.correlationId(),
                Outcome.ERROR,
                "ERROR",
                errorReason,
                List.of(),
                subjectId,
                action,
                resourceType,
                resourceId,
                requestContext.path(),
                requestContext.method(),
                requestContext.clientIp(),
                requestContext.userAgent()
        );
    }

    /**
     * Flat map for JSON logging; missing values become empty strings.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "abac_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("correlation_id", orEmpty(correlationId)),
                Map.entry("outcome", outcome.name()),
                Map.entry("policy_id", orEmpty(policyId)),
                Map.entry("reason", orEmpty(reason)),
                Map.entry("failed_policies", failedPolicies != null ? failedPolicies : List.of()),
                Map.entry("subject_id", orEmpty(subjectId)),
                Map.entry("action", orEmpty(action)),
                Map.entry("resource_type", orEmpty(resourceType)),
                Map.entry("resource_id", orEmpty(resourceId)),
                Map.entry("path", orEmpty(path)),
                Map.entry("method", orEmpty(method)),
                Map.entry("client_ip", orEmpty(clientIp)),
                Map.entry("user_agent", orEmpty(userAgent))
        );
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    public record RequestContext(
            String correlationId,
            String path,
            String method,
            String clientIp,
            String userAgent
    ) {
        public static RequestContext empty() {
            return new RequestContext(null, null, null, null, null);
        }
    }
}
