package com.example.abac.policy;

import com.example.abac.filter.FilterExpression;
import com.example.abac.filter.MongoCriteriaTranslator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.mongodb.core.ReactiveMongoTemplate;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Policy store reading the {@code abac_policies} collection.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(name = "abac.policy-store", havingValue = "mongo")
public class MongoPolicyStore implements PolicyStore {

    public static final String COLLECTION = "abac_policies";
    static final String ACTIVE_FIELD = "is_active";

    private final ReactiveMongoTemplate mongoTemplate;
    private final MongoCriteriaTranslator criteriaTranslator;

    @Override
    public Flux<PolicyDefinition> findActivePolicies() {
        // A document without is_active counts as active, as in PolicyDefinition.active()
        Query query = Query.query(Criteria.where(ACTIVE_FIELD).ne(0));
        return mongoTemplate.find(query, PolicyDefinition.class, COLLECTION)
                .doOnError(e -> log.error("Failed to read active policies from {}: {}", COLLECTION, e.getMessage()));
    }

    @Override
    public Flux<PolicyDefinition> findMatching(FilterExpression filter) {
        Query query = criteriaTranslator.toQuery(filter);
        log.debug("Querying {} with {}", COLLECTION, query);
        return mongoTemplate.find(query, PolicyDefinition.class, COLLECTION);
    }
}
