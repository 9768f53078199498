package com.example.abac.service;

import com.example.abac.attribute.AttributeExtractor;
import com.example.abac.attribute.AttributeNamespace;
import com.example.abac.cache.AbacCacheOperations;
import com.example.abac.common.util.StringSanitizer;
import com.example.abac.engine.PolicyEvaluator;
import com.example.abac.engine.QueryFilterCompiler;
import com.example.abac.exception.PermissionDeniedException;
import com.example.abac.filter.FilterExpression;
import com.example.abac.model.AccessDecision;
import com.example.abac.model.Policy;
import com.example.abac.model.ResourceDescriptor;
import com.example.abac.model.SubjectAttributes;
import com.example.abac.policy.PolicyCompiler;
import com.example.abac.policy.PolicySnapshot;
import com.example.abac.policy.PolicyStore;
import com.example.abac.subject.SubjectDirectory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Entry point for authorization: point checks, permission assertions and list filters.
 *
 * <p>Loads the active policy set and the subject's attributes through the cache, then hands
 * them to the pure evaluation components. Unknown and inactive subjects are denied
 * everything.
 */
@Slf4j
@Service
public class PermissionFacade {

    private final PolicyStore policyStore;
    private final SubjectDirectory subjectDirectory;
    private final AbacCacheOperations cache;
    private final PolicyCompiler policyCompiler;
    private final AttributeExtractor attributeExtractor;
    private final PolicyEvaluator policyEvaluator;
    private final QueryFilterCompiler queryFilterCompiler;

    private final AtomicReference<CompiledPolicies> compiled = new AtomicReference<>();

    public PermissionFacade(
            PolicyStore policyStore,
            SubjectDirectory subjectDirectory,
            AbacCacheOperations cache,
            PolicyCompiler policyCompiler,
            AttributeExtractor attributeExtractor,
            PolicyEvaluator policyEvaluator,
            QueryFilterCompiler queryFilterCompiler) {
        this.policyStore = policyStore;
        this.subjectDirectory = subjectDirectory;
        this.cache = cache;
        this.policyCompiler = policyCompiler;
        this.attributeExtractor = attributeExtractor;
        this.policyEvaluator = policyEvaluator;
        this.queryFilterCompiler = queryFilterCompiler;
    }

    /**
     * Full decision for a point check.
     *
     * @param resource   the resource instance, when the caller has it loaded
     * @param resourceId the instance id, used when {@code resource} is not given
     */
    @NonNull
    public Mono<AccessDecision> evaluate(
            @NonNull String subjectId,
            @NonNull String action,
            @NonNull String resourceType,
            @Nullable ResourceDescriptor resource,
            @Nullable String resourceId) {

        String effectiveId = resourceId != null ? resourceId : resource != null ? resource.id() : null;
        ResourceDescriptor descriptor = resource != null
                ? resource.withType(resourceType)
                : ResourceDescriptor.of(resourceType, effectiveId);

        return loadSubject(subjectId)
                .zipWith(loadPolicies())
                .map(loaded -> {
                    SubjectAttributes subject = loaded.getT1();
                    if (!subject.active()) {
                        log.warn("Access DENIED (inactive subject): subject={}, action={}, resource={}/{}",
                                StringSanitizer.forLog(subjectId), action, resourceType, effectiveId);
                        return AccessDecision.deny(AccessDecision.INACTIVE_SUBJECT, "Subject is not active");
                    }
                    AttributeNamespace namespace = attributeExtractor.namespace(subject, descriptor, action);
                    return policyEvaluator.evaluate(loaded.getT2(), namespace, action, resourceType, effectiveId);
                })
                .defaultIfEmpty(AccessDecision.deny(AccessDecision.UNKNOWN_SUBJECT, "Subject is not known"));
    }

    @NonNull
    public Mono<Boolean> isPermitted(
            @NonNull String subjectId,
            @NonNull String action,
            @NonNull String resourceType,
            @Nullable ResourceDescriptor resource,
            @Nullable String resourceId) {
        return evaluate(subjectId, action, resourceType, resource, resourceId)
                .map(AccessDecision::allowed);
    }

    /**
     * Completes empty when permitted, errors with {@link PermissionDeniedException} otherwise.
     */
    @NonNull
    public Mono<Void> assertPermitted(
            @NonNull String subjectId,
            @NonNull String action,
            @NonNull String resourceType,
            @Nullable ResourceDescriptor resource,
            @Nullable String resourceId) {
        return evaluate(subjectId, action, resourceType, resource, resourceId)
                .flatMap(decision -> decision.allowed()
                        ? Mono.<Void>empty()
                        : Mono.error(new PermissionDeniedException(action, resourceType,
                                resourceId != null ? resourceId : resource != null ? resource.id() : null)));
    }

    /**
     * Row filter for listing {@code resourceType} with {@code action}. Callers AND it with
     * their own query constraints.
     */
    @NonNull
    public Mono<FilterExpression> compileListFilter(
            @NonNull String subjectId,
            @NonNull String action,
            @NonNull String resourceType) {

        return loadSubject(subjectId)
                .zipWith(loadPolicies())
                .map(loaded -> {
                    SubjectAttributes subject = loaded.getT1();
                    if (!subject.active()) {
                        log.warn("Inactive subject {} gets an empty {} listing", StringSanitizer.forLog(subjectId), resourceType);
                        return FilterExpression.none();
                    }
                    AttributeNamespace namespace = attributeExtractor.subjectNamespace(subject, resourceType, action);
                    return queryFilterCompiler.compile(loaded.getT2(), namespace, action, resourceType);
                })
                .defaultIfEmpty(FilterExpression.none());
    }

    @NonNull
    public Mono<Boolean> invalidatePolicies() {
        log.info("Invalidating cached ABAC policies");
        return cache.evictPolicies();
    }

    @NonNull
    public Mono<Boolean> invalidateSubject(@NonNull String subjectId) {
        log.info("Invalidating cached attributes for subject {}", StringSanitizer.forLog(subjectId));
        return cache.evictSubject(subjectId);
    }

    private Mono<SubjectAttributes> loadSubject(String subjectId) {
        return cache.getOrLoadSubject(subjectId, Mono.defer(() -> subjectDirectory.findSubject(subjectId)))
                .doOnSuccess(subject -> {
                    if (subject == null) {
                        log.debug("Unknown subject {}", StringSanitizer.forLog(subjectId));
                    }
                });
    }

    private Mono<List<Policy>> loadPolicies() {
        return cache.getOrLoadPolicies(Mono.defer(() -> policyStore.findActivePolicies()
                        .collectList()
                        .map(PolicySnapshot::of)))
                .map(this::compile);
    }

    /**
     * Reuses the compiled set while the cached snapshot is unchanged, so rejected
     * policies are reported once per snapshot rather than on every request.
     */
    private List<Policy> compile(PolicySnapshot snapshot) {
        CompiledPolicies current = compiled.get();
        if (current != null && current.source().equals(snapshot)) {
            return current.policies();
        }
        List<Policy> policies = policyCompiler.compileAll(snapshot.policies());
        compiled.set(new CompiledPolicies(snapshot, policies));
        return policies;
    }

    private record CompiledPolicies(PolicySnapshot source, List<Policy> policies) {
    }
}
