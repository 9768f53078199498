package com.example.abac.aspect;

import com.example.abac.annotation.RequiresAbacPermission;
import com.example.abac.audit.AuthzAuditService;
import com.example.abac.common.web.SubjectHeaderResolver;
import com.example.abac.exception.PermissionDeniedException;
import com.example.abac.service.PermissionFacade;
import lombok.extern.slf4j.Slf4j;
import org.aspectj.lang.ProceedingJoinPoint;
import org.aspectj.lang.annotation.Around;
import org.aspectj.lang.annotation.Aspect;
import org.aspectj.lang.reflect.MethodSignature;
import org.springframework.core.annotation.Order;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;

import java.lang.reflect.Method;
import java.lang.reflect.Parameter;

/**
 * Enforces {@link RequiresAbacPermission} on controller methods.
 */
@Slf4j
@Aspect
@Component
@Order(1)
public class AbacPermissionAspect {

    private final PermissionFacade permissionFacade;
    private final SubjectHeaderResolver subjectHeaderResolver;
    @Nullable
    private final AuthzAuditService auditService;

    public AbacPermissionAspect(
            PermissionFacade permissionFacade,
            SubjectHeaderResolver subjectHeaderResolver,
            @Nullable AuthzAuditService auditService) {
        this.permissionFacade = permissionFacade;
        this.subjectHeaderResolver = subjectHeaderResolver;
        this.auditService = auditService;
    }

    @Around("@annotation(requiresAbacPermission)")
    public Object checkPermission(ProceedingJoinPoint joinPoint, RequiresAbacPermission requiresAbacPermission) {
        Method method = ((MethodSignature) joinPoint.getSignature()).getMethod();

        ServerWebExchange exchange = extractExchange(joinPoint.getArgs());
        if (exchange == null) {
            log.error("No ServerWebExchange found in method arguments: {}", method.getName());
            return Mono.error(new IllegalStateException("Request context unavailable for " + method.getName()));
        }

        String action = requiresAbacPermission.action();
        String resourceType = requiresAbacPermission.resourceType();
        String resourceId = extractResourceId(joinPoint.getArgs(), method, requiresAbacPermission.resourceIdParam());

        return Mono.fromCallable(() -> subjectHeaderResolver.requireSubjectId(exchange.getRequest()))
                .flatMap(subjectId -> permissionFacade.evaluate(subjectId, action, resourceType, null, resourceId)
                        .doOnNext(decision -> {
                            if (auditService != null) {
                                auditService.logDecision(subjectId, action, resourceType, resourceId,
                                        decision, exchange.getRequest());
                            }
                        })
                        .doOnError(error -> {
                            log.error("ABAC evaluation failed for {}: {}", method.getName(), error.getMessage());
                            if (auditService != null) {
                                auditService.logError(subjectId, action, resourceType, resourceId,
                                        error.getClass().getSimpleName(), exchange.getRequest());
                            }
                        }))
                .flatMap(decision -> {
                    if (!decision.allowed()) {
                        log.warn("ABAC permission denied for {}: {} on {}/{}",
                                method.getName(), action, resourceType, resourceId);
                        return Mono.error(new PermissionDeniedException(action, resourceType, resourceId));
                    }
                    log.debug("ABAC permission check passed for {}", method.getName());
                    return proceed(joinPoint);
                });
    }

    private Mono<?> proceed(ProceedingJoinPoint joinPoint) {
        try {
            Object result = joinPoint.proceed();
            if (result instanceof Mono<?> mono) {
                return mono;
            }
            return Mono.justOrEmpty(result);
        } catch (Throwable e) {
            return Mono.error(e);
        }
    }

    @Nullable
    private String extractResourceId(Object[] args, Method method, String paramName) {
        if (paramName.isEmpty()) {
            return null;
        }
        Parameter[] parameters = method.getParameters();
        for (int i = 0; i < parameters.length; i++) {
            PathVariable pathVariable = parameters[i].getAnnotation(PathVariable.class);
            if (pathVariable == null) {
                continue;
            }
            String name = !pathVariable.value().isEmpty() ? pathVariable.value()
                    : !pathVariable.name().isEmpty() ? pathVariable.name()
                    : parameters[i].getName();
            if (paramName.equals(name) && args[i] != null) {
                return args[i].toString();
            }
        }
        log.warn("Path variable '{}' not found on {}", paramName, method.getName());
        return null;
    }

    @Nullable
    private ServerWebExchange extractExchange(Object[] args) {
        for (Object arg : args) {
            if (arg instanceof ServerWebExchange exchange) {
                return exchange;
            }
        }
        return null;
    }
}
