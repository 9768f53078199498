package com.example.abac.exception;

import com.example.abac.common.util.StringSanitizer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.web.WebProperties;
import org.springframework.boot.autoconfigure.web.reactive.error.AbstractErrorWebExceptionHandler;
import org.springframework.boot.web.reactive.error.ErrorAttributes;
import org.springframework.context.ApplicationContext;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerCodecConfigurer;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.reactive.function.BodyInserters;
import org.springframework.web.reactive.function.server.RequestPredicates;
import org.springframework.web.reactive.function.server.RouterFunction;
import org.springframework.web.reactive.function.server.RouterFunctions;
import org.springframework.web.reactive.function.server.ServerRequest;
import org.springframework.web.reactive.function.server.ServerResponse;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.util.stream.Collectors;

/**
 * Maps errors to JSON {@link ErrorResponse} bodies. Authorization failures never
 * carry evaluation details to the caller.
 */
@Slf4j
@Component
@Order(-2)  // Higher priority than DefaultErrorWebExceptionHandler
public class GlobalErrorWebExceptionHandler extends AbstractErrorWebExceptionHandler {

    public GlobalErrorWebExceptionHandler(
            ErrorAttributes errorAttributes,
            WebProperties webProperties,
            ApplicationContext applicationContext,
            ServerCodecConfigurer serverCodecConfigurer) {
        super(errorAttributes, webProperties.getResources(), applicationContext);
        this.setMessageWriters(serverCodecConfigurer.getWriters());
    }

    @Override
    protected RouterFunction<ServerResponse> getRoutingFunction(ErrorAttributes errorAttributes) {
        return RouterFunctions.route(RequestPredicates.all(), this::renderErrorResponse);
    }

    private Mono<ServerResponse> renderErrorResponse(ServerRequest request) {
        Throwable error = getError(request);
        String path = request.path();

        if (error instanceof PermissionDeniedException denied) {
            log.warn("Authorization denied: path={}, action={}, resourceType={}, resourceId={}",
                    path, denied.getAction(), denied.getResourceType(),
                    StringSanitizer.forLog(denied.getResourceId()));
            return createErrorResponse(HttpStatus.FORBIDDEN, "authorization_error",
                    "Access denied", path);
        }

        // Subject service errors -> 502 Bad Gateway
        if (error instanceof ApiException apiError) {
            log.error("External API error: service={}, status={}, path={}, error={}",
                    apiError.getServiceName(),
                    apiError.getStatusCode(),
                    path,
                    apiError.getMessage());
            return createErrorResponse(HttpStatus.BAD_GATEWAY, "external_service_error",
                    "External service unavailable", path);
        }

        if (error instanceof WebExchangeBindException bindException) {
            String fieldErrors = bindException.getFieldErrors().stream()
                    .map(fe -> fe.getField() + ": " + fe.getDefaultMessage())
                    .collect(Collectors.joining(", "));

            log.warn("Validation failed: path={}, errors={}", path, fieldErrors);
            return createErrorResponse(HttpStatus.BAD_REQUEST, "validation_error",
                    "Validation failed: " + fieldErrors, path);
        }

        if (error instanceof ResponseStatusException statusException) {
            HttpStatus status = HttpStatus.resolve(statusException.getStatusCode().value());
            if (status == null) {
                status = HttpStatus.INTERNAL_SERVER_ERROR;
            }

            log.warn("Response status exception: path={}, status={}, reason={}",
                    path, status, statusException.getReason());
            return createErrorResponse(status, "request_error",
                    statusException.getReason() != null ? statusException.getReason() : status.getReasonPhrase(),
                    path);
        }

        if (error instanceof IllegalArgumentException) {
            log.warn("Invalid argument: path={}, error={}", path, error.getMessage());
            return createErrorResponse(HttpStatus.BAD_REQUEST, "invalid_argument",
                    "Invalid request parameter", path);
        }

        log.error("Unhandled error: path={}, error={}", path, error.getMessage(), error);
        return createErrorResponse(HttpStatus.INTERNAL_SERVER_ERROR, "server_error",
                "An unexpected error occurred", path);
    }

    private Mono<ServerResponse> createErrorResponse(HttpStatus status, String error, String message, String path) {
        ErrorResponse body = ErrorResponse.of(status.value(), error, message, path);

        return ServerResponse.status(status)
                .contentType(MediaType.APPLICATION_JSON)
                .body(BodyInserters.fromValue(body));
    }
}
