package com.example.abac.audit;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.model.AccessDecision;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;

import java.net.InetSocketAddress;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Writes authorization decisions to the {@code AUTHZ_AUDIT} logger as JSON.
 */
@Service
@RequiredArgsConstructor
@ConditionalOnProperty(name = "abac.audit.enabled", havingValue = "true", matchIfMissing = true)
public class AuthzAuditService {

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger("AUTHZ_AUDIT");

    private static final String HEADER_CORRELATION_ID = "X-Correlation-Id";
    private static final String HEADER_FORWARDED_FOR = "X-Forwarded-For";
    private static final String HEADER_USER_AGENT = "User-Agent";

    private static final Pattern CORRELATION_ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{1,64}$");
    private static final Pattern IP_ADDRESS_PATTERN = Pattern.compile(
            "^([0-9]{1,3}\\.){3}[0-9]{1,3}$|^([0-9a-fA-F]{0,4}:){2,7}[0-9a-fA-F]{0,4}$");

    private static final int MAX_USER_AGENT_LENGTH = 500;
    private static final int MAX_PATH_LENGTH = 2000;

    private final ObjectMapper objectMapper;

    public void logDecision(
            @NonNull String subjectId,
            @NonNull String action,
            @NonNull String resourceType,
            @Nullable String resourceId,
            @NonNull AccessDecision decision,
            @Nullable ServerHttpRequest request) {

        logEvent(AuthzAuditEvent.from(subjectId, action, resourceType, resourceId, decision,
                extractRequestContext(request)));
    }

    public void logError(
            @NonNull String subjectId,
            @NonNull String action,
            @NonNull String resourceType,
            @Nullable String resourceId,
            @NonNull String errorReason,
            @Nullable ServerHttpRequest request) {

        logEvent(AuthzAuditEvent.error(subjectId, action, resourceType, resourceId, errorReason,
                extractRequestContext(request)));
    }

    private void logEvent(@NonNull AuthzAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            switch (event.outcome()) {
                case ALLOW -> AUDIT_LOG.info(json);
                case DENY -> AUDIT_LOG.warn(json);
                case ERROR -> AUDIT_LOG.error(json);
            }
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            AUDIT_LOG.warn("AuthZ {} - subject={}, resource={}/{}, action={}, policy={}, reason={}",
                    event.outcome(),
                    StringSanitizer.forLog(event.subjectId()),
                    StringSanitizer.forLog(event.resourceType()),
                    StringSanitizer.forLog(event.resourceId()),
                    StringSanitizer.forLog(event.action()),
                    StringSanitizer.forLog(event.policyId()),
                    StringSanitizer.forLog(event.reason()));
        }
    }

    @NonNull
    AuthzAuditEvent.RequestContext extractRequestContext(@Nullable ServerHttpRequest request) {
        if (request == null) {
            return AuthzAuditEvent.RequestContext.empty();
        }
        String path = StringSanitizer.truncate(request.getPath().value(), MAX_PATH_LENGTH);
        return new AuthzAuditEvent.RequestContext(
                extractCorrelationId(request),
                path == null || path.isBlank() ? "/" : path,
                request.getMethod().name(),
                extractClientIp(request),
                StringSanitizer.truncate(request.getHeaders().getFirst(HEADER_USER_AGENT), MAX_USER_AGENT_LENGTH));
    }

    /**
     * Uses the caller's correlation id when it is well formed, otherwise a fresh UUID.
     */
    @NonNull
    private String extractCorrelationId(@NonNull ServerHttpRequest request) {
        String correlationId = StringSanitizer.headerValue(request.getHeaders().getFirst(HEADER_CORRELATION_ID));
        if (correlationId == null || !CORRELATION_ID_PATTERN.matcher(correlationId).matches()) {
            return UUID.randomUUID().toString();
        }
        return correlationId;
    }

    @Nullable
    private String extractClientIp(@NonNull ServerHttpRequest request) {
        String forwardedFor = request.getHeaders().getFirst(HEADER_FORWARDED_FOR);
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            String firstIp = forwardedFor.split(",")[0].trim();
            if (IP_ADDRESS_PATTERN.matcher(firstIp).matches()) {
                return firstIp;
            }
        }
        InetSocketAddress remoteAddress = request.getRemoteAddress();
        if (remoteAddress != null && remoteAddress.getAddress() != null) {
            return remoteAddress.getAddress().getHostAddress();
        }
        return null;
    }
}
