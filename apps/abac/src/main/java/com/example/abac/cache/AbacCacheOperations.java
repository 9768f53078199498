package com.example.abac.cache;

import com.example.abac.model.SubjectAttributes;
import com.example.abac.policy.PolicySnapshot;
import org.springframework.lang.NonNull;
import reactor.core.publisher.Mono;

/**
 * Cache for the two reads every decision needs: the active policy set and the
 * subject's attributes. Entries expire after their configured TTL; a cache failure
 * falls back to the loader rather than failing the request.
 */
public interface AbacCacheOperations {

    @NonNull
    Mono<PolicySnapshot> getOrLoadPolicies(@NonNull Mono<PolicySnapshot> loader);

    @NonNull
    Mono<SubjectAttributes> getOrLoadSubject(@NonNull String subjectId, @NonNull Mono<SubjectAttributes> loader);

    /**
     * Drops the cached policy set, e.g. after a policy was edited.
     */
    @NonNull
    Mono<Boolean> evictPolicies();

    @NonNull
    Mono<Boolean> evictSubject(@NonNull String subjectId);
}
