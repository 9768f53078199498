package com.example.abac.policy;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Field;
import org.springframework.lang.Nullable;

import java.util.List;

/**
 * Policy as stored and exchanged: the JSON seed file, the {@code abac_policies}
 * collection and the cache all use this shape.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PolicyDefinition(
        @Id @Nullable String id,
        String name,
        @Nullable String description,
        @Nullable String effect,
        @Nullable List<String> actions,
        @Nullable List<AttributeFilterDefinition> subjects,
        @Nullable List<AttributeFilterDefinition> resources,
        @JsonProperty("query_conditions") @Field("query_conditions")
        @Nullable List<QueryConditionDefinition> queryConditions,
        @Nullable RuleDefinition conditions,
        @JsonProperty("is_active") @Field("is_active")
        @Nullable Integer isActive
) {
    public boolean active() {
        return isActive == null || isActive != 0;
    }

    public record AttributeFilterDefinition(
            String key,
            String operator,
            @JsonFormat(with = JsonFormat.Feature.ACCEPT_SINGLE_VALUE_AS_ARRAY)
            List<String> value
    ) {
    }

    public record QueryConditionDefinition(
            @JsonProperty("resource_attribute") @Field("resource_attribute")
            String resourceAttribute,
            String operator,
            @JsonProperty("subject_attribute") @Field("subject_attribute")
            String subjectAttribute
    ) {
    }

    /**
     * Node of a condition tree: a group when {@code rules} is set, a function call when
     * {@code function} is set, otherwise a comparison of {@code attribute} with {@code value}.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record RuleDefinition(
            @Nullable String operator,
            @Nullable List<RuleDefinition> rules,
            @Nullable String attribute,
            @Nullable Object value,
            @Nullable String function,
            @Nullable List<String> args
    ) {
        public static RuleDefinition group(String operator, List<RuleDefinition> rules) {
            return new RuleDefinition(operator, rules, null, null, null, null);
        }

        public static RuleDefinition comparison(String attribute, String operator, Object value) {
            return new RuleDefinition(operator, null, attribute, value, null, null);
        }

        public static RuleDefinition call(String function, List<String> args) {
            return new RuleDefinition(null, null, null, null, function, args);
        }
    }
}
