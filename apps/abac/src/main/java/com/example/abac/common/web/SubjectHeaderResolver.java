package com.example.abac.common.web;

import com.example.abac.common.util.StringSanitizer;
import com.example.abac.config.properties.AbacProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ResponseStatusException;

/**
 * Reads the authenticated subject id from the header set by the upstream gateway.
 */
@Slf4j
@Component
public class SubjectHeaderResolver {

    private final String headerName;

    public SubjectHeaderResolver(AbacProperties properties) {
        this.headerName = properties.subjectHeader();
    }

    /**
     * @throws ResponseStatusException 401 when the header is missing or not a valid id
     */
    public String requireSubjectId(ServerHttpRequest request) {
        String subjectId = StringSanitizer.headerValue(request.getHeaders().getFirst(headerName));
        if (!StringSanitizer.isValidSubjectId(subjectId)) {
            log.warn("Missing or invalid {} header on {}", headerName, request.getPath().value());
            throw new ResponseStatusException(HttpStatus.UNAUTHORIZED, "Authentication required");
        }
        return subjectId;
    }
}
