package com.example.abac.policy;

import com.example.abac.config.properties.AbacProperties;
import com.example.abac.filter.FilterExpression;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Map;

/**
 * Policy store backed by a JSON seed file, read once at startup.
 */
@Slf4j
@Component
@ConditionalOnProperty(name = "abac.policy-store", havingValue = "config", matchIfMissing = true)
public class ConfiguredPolicyStore implements PolicyStore {

    private static final TypeReference<List<PolicyDefinition>> POLICY_LIST = new TypeReference<>() {};
    private static final TypeReference<Map<String, Object>> ROW_TYPE = new TypeReference<>() {};

    private final List<PolicyDefinition> policies;
    private final ObjectMapper objectMapper;

    @Autowired
    public ConfiguredPolicyStore(AbacProperties properties, ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.policies = load(resourceLoader.getResource(properties.policySeed()));
        log.info("Loaded {} ABAC policies from {}", policies.size(), properties.policySeed());
    }

    ConfiguredPolicyStore(List<PolicyDefinition> policies, ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.policies = List.copyOf(policies);
    }

    @Override
    public Flux<PolicyDefinition> findActivePolicies() {
        return Flux.fromIterable(policies)
                .filter(PolicyDefinition::active);
    }

    @Override
    public Flux<PolicyDefinition> findMatching(FilterExpression filter) {
        return Flux.fromIterable(policies)
                .filter(policy -> filter.test(objectMapper.convertValue(policy, ROW_TYPE)));
    }

    private List<PolicyDefinition> load(Resource seed) {
        if (!seed.exists()) {
            throw new IllegalStateException("ABAC policy seed not found: " + seed.getDescription());
        }
        try (InputStream in = seed.getInputStream()) {
            return List.copyOf(objectMapper.readValue(in, POLICY_LIST));
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read ABAC policy seed " + seed.getDescription(), e);
        }
    }
}
