package com.example.abac.controller;

import com.example.abac.annotation.RequiresAbacPermission;
import com.example.abac.audit.AuthzAuditService;
import com.example.abac.common.web.SubjectHeaderResolver;
import com.example.abac.config.properties.AbacProperties;
import com.example.abac.dto.AttributeDescriptor;
import com.example.abac.dto.CheckPermissionRequest;
import com.example.abac.dto.CheckPermissionResponse;
import com.example.abac.policy.PolicyDefinition;
import com.example.abac.policy.PolicyStore;
import com.example.abac.service.PermissionFacade;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.lang.Nullable;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Permission checks and policy vocabulary for front ends and other services.
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/abac")
public class AbacController {

    static final String POLICY_RESOURCE = "policy";
    static final String READ_LIST = "read_list";

    private final PermissionFacade permissionFacade;
    private final PolicyStore policyStore;
    private final SubjectHeaderResolver subjectHeaderResolver;
    private final AbacProperties properties;
    @Nullable
    private final AuthzAuditService auditService;

    public AbacController(
            PermissionFacade permissionFacade,
            PolicyStore policyStore,
            SubjectHeaderResolver subjectHeaderResolver,
            AbacProperties properties,
            @Nullable AuthzAuditService auditService) {
        this.permissionFacade = permissionFacade;
        this.policyStore = policyStore;
        this.subjectHeaderResolver = subjectHeaderResolver;
        this.properties = properties;
        this.auditService = auditService;
    }

    @GetMapping("/attributes")
    public List<AttributeDescriptor> attributes() {
        return AttributeDescriptor.VOCABULARY;
    }

    @GetMapping("/actions")
    public List<String> actions() {
        return properties.vocabulary().actions();
    }

    @GetMapping("/resource-types")
    public List<String> resourceTypes() {
        return properties.vocabulary().resourceTypes();
    }

    /**
     * Lets a client ask whether the current subject may perform an action, e.g. to
     * show or hide UI elements.
     */
    @PostMapping("/check-permission")
    public Mono<CheckPermissionResponse> checkPermission(
            @Valid @RequestBody CheckPermissionRequest request,
            ServerWebExchange exchange) {

        String subjectId = subjectHeaderResolver.requireSubjectId(exchange.getRequest());

        return permissionFacade.evaluate(subjectId, request.action(), request.resourceType(), null, request.resourceId())
                .doOnNext(decision -> {
                    if (auditService != null) {
                        auditService.logDecision(subjectId, request.action(), request.resourceType(),
                                request.resourceId(), decision, exchange.getRequest());
                    }
                })
                .doOnError(error -> {
                    if (auditService != null) {
                        auditService.logError(subjectId, request.action(), request.resourceType(),
                                request.resourceId(), error.getClass().getSimpleName(), exchange.getRequest());
                    }
                })
                .map(decision -> new CheckPermissionResponse(decision.allowed()));
    }

    /**
     * Policies the current subject may list.
     */
    @GetMapping("/policies")
    public Flux<PolicyDefinition> policies(ServerWebExchange exchange) {
        String subjectId = subjectHeaderResolver.requireSubjectId(exchange.getRequest());

        return permissionFacade.compileListFilter(subjectId, READ_LIST, POLICY_RESOURCE)
                .doOnNext(filter -> log.debug("Listing policies for {} with filter {}", subjectId, filter))
                .flatMapMany(policyStore::findMatching);
    }

    @DeleteMapping("/cache/policies")
    @RequiresAbacPermission(resourceType = POLICY_RESOURCE, action = "update")
    public Mono<ResponseEntity<Void>> invalidatePolicies(ServerWebExchange exchange) {
        return permissionFacade.invalidatePolicies()
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }

    @DeleteMapping("/cache/subjects/{subjectId}")
    @RequiresAbacPermission(resourceType = "user", action = "update", resourceIdParam = "subjectId")
    public Mono<ResponseEntity<Void>> invalidateSubject(
            @PathVariable("subjectId") String subjectId,
            ServerWebExchange exchange) {
        return permissionFacade.invalidateSubject(subjectId)
                .thenReturn(ResponseEntity.noContent().<Void>build());
    }
}
