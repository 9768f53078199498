package com.example.abac.policy;

import com.example.abac.exception.MalformedPolicyException;
import com.example.abac.exception.UnknownFunctionException;
import com.example.abac.function.AbacFunction;
import com.example.abac.function.FunctionRegistry;
import com.example.abac.model.ConditionOperator;
import com.example.abac.model.Effect;
import com.example.abac.model.FilterOperator;
import com.example.abac.model.Policy;
import com.example.abac.policy.PolicyDefinition.AttributeFilterDefinition;
import com.example.abac.policy.PolicyDefinition.QueryConditionDefinition;
import com.example.abac.policy.PolicyDefinition.RuleDefinition;
import com.example.abac.rule.ComparisonOperator;
import com.example.abac.rule.Rule;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PolicyCompiler")
class PolicyCompilerTest {

    private final PolicyCompiler compiler = new PolicyCompiler(FunctionRegistry.withDefaults());
    private final ObjectMapper objectMapper = new ObjectMapper();

    private static PolicyDefinition definition(String effect, List<AttributeFilterDefinition> subjects,
                                               RuleDefinition conditions) {
        return new PolicyDefinition(null, "test policy", null, effect, List.of("read"), subjects,
                List.of(new AttributeFilterDefinition("resource.type", "in", List.of("file"))),
                List.of(), conditions, null);
    }

    @Nested
    @DisplayName("definitions")
    class Definitions {

        @Test
        @DisplayName("should compile every clause of a definition")
        void shouldCompileAllClauses() {
            PolicyDefinition definition = new PolicyDefinition("p-1", "Own files", "desc", "deny",
                    List.of("read", "read_list"),
                    List.of(new AttributeFilterDefinition("user.department", "eq", List.of("finance"))),
                    List.of(new AttributeFilterDefinition("resource.type", "in", List.of("file"))),
                    List.of(new QueryConditionDefinition("user_id", "eq", "id")),
                    RuleDefinition.call("is_within_working_hours", List.of("environment.current_time")),
                    0);

            Policy policy = compiler.compile(definition);

            assertThat(policy.id()).isEqualTo("p-1");
            assertThat(policy.effect()).isEqualTo(Effect.DENY);
            assertThat(policy.subjects().get(0).operator()).isEqualTo(FilterOperator.EQ);
            assertThat(policy.queryConditions().get(0).operator()).isEqualTo(ConditionOperator.EQ);
            assertThat(policy.queryConditions().get(0).resourcePath()).isEqualTo("resource.user_id");
            assertThat(policy.condition()).isEqualTo(new Rule.FunctionCall(AbacFunction.IS_WITHIN_WORKING_HOURS,
                    List.of("environment.current_time")));
            assertThat(policy.active()).isFalse();
        }

        @Test
        @DisplayName("should default the effect to allow and the id to the name")
        void shouldApplyDefaults() {
            Policy policy = compiler.compile(definition(null, List.of(), null));

            assertThat(policy.effect()).isEqualTo(Effect.ALLOW);
            assertThat(policy.id()).isEqualTo("test policy");
            assertThat(policy.active()).isTrue();
        }

        @Test
        @DisplayName("should compile nested condition groups")
        void shouldCompileNestedGroups() {
            RuleDefinition tree = RuleDefinition.group("or", List.of(
                    RuleDefinition.comparison("user.security_level", "greater_than", 2),
                    RuleDefinition.group("AND", List.of(
                            RuleDefinition.comparison("user.department", "in", List.of("finance", "audit"))))));

            Policy policy = compiler.compile(definition("allow", List.of(), tree));

            assertThat(policy.condition()).isEqualTo(new Rule.AnyOf(List.of(
                    new Rule.Comparison("user.security_level", ComparisonOperator.GREATER_THAN, 2),
                    new Rule.AllOf(List.of(new Rule.Comparison("user.department", ComparisonOperator.IN,
                            List.of("finance", "audit")))))));
        }
    }

    @Nested
    @DisplayName("rejections")
    class Rejections {

        @Test
        @DisplayName("should reject an unknown function name")
        void shouldRejectUnknownFunction() {
            PolicyDefinition definition = definition("allow", List.of(),
                    RuleDefinition.call("is_full_moon", List.of()));

            assertThatThrownBy(() -> compiler.compile(definition))
                    .isInstanceOf(UnknownFunctionException.class)
                    .hasMessageContaining("is_full_moon");
        }

        @Test
        @DisplayName("should reject a function call with the wrong number of arguments")
        void shouldRejectWrongArity() {
            PolicyDefinition definition = definition("allow", List.of(),
                    RuleDefinition.call("is_resource_owner", List.of("user.id")));

            assertThatThrownBy(() -> compiler.compile(definition))
                    .isInstanceOf(MalformedPolicyException.class)
                    .hasMessageContaining("expects 2");
        }

        @Test
        @DisplayName("should reject an unknown comparison operator")
        void shouldRejectUnknownOperator() {
            PolicyDefinition definition = definition("allow", List.of(),
                    RuleDefinition.comparison("user.department", "like", "fin%"));

            assertThatThrownBy(() -> compiler.compile(definition)).isInstanceOf(MalformedPolicyException.class);
        }

        @Test
        @DisplayName("should reject an in condition without a list")
        void shouldRejectInWithoutList() {
            PolicyDefinition definition = definition("allow", List.of(),
                    RuleDefinition.comparison("user.department", "in", "finance"));

            assertThatThrownBy(() -> compiler.compile(definition))
                    .isInstanceOf(MalformedPolicyException.class)
                    .hasMessageContaining("expects a list");
        }

        @Test
        @DisplayName("should reject an unknown effect")
        void shouldRejectUnknownEffect() {
            assertThatThrownBy(() -> compiler.compile(definition("permit", List.of(), null)))
                    .isInstanceOf(MalformedPolicyException.class)
                    .hasMessageContaining("effect");
        }

        @Test
        @DisplayName("should reject an eq filter with several values")
        void shouldRejectMultiValueEq() {
            PolicyDefinition definition = definition("allow",
                    List.of(new AttributeFilterDefinition("user.department", "eq", List.of("a", "b"))), null);

            assertThatThrownBy(() -> compiler.compile(definition)).isInstanceOf(MalformedPolicyException.class);
        }

        @Test
        @DisplayName("should reject null entries in actions, filter values and nested rules")
        void shouldRejectNullEntries() {
            PolicyDefinition nullAction = new PolicyDefinition(null, "null action", null, "allow",
                    Arrays.asList("read", null), List.of(), List.of(), List.of(), null, 1);
            PolicyDefinition nullValue = definition("allow",
                    List.of(new AttributeFilterDefinition("user.department", "in", Arrays.asList("finance", null))),
                    null);
            PolicyDefinition nullRule = definition("allow", List.of(),
                    RuleDefinition.group("OR", Arrays.asList(
                            RuleDefinition.comparison("user.department", "eq", "finance"), null)));

            assertThatThrownBy(() -> compiler.compile(nullAction)).isInstanceOf(MalformedPolicyException.class);
            assertThatThrownBy(() -> compiler.compile(nullValue)).isInstanceOf(MalformedPolicyException.class);
            assertThatThrownBy(() -> compiler.compile(nullRule)).isInstanceOf(MalformedPolicyException.class);
        }

        @Test
        @DisplayName("compileAll should keep valid policies next to ones with null entries")
        void compileAllShouldSurviveNullEntries() {
            PolicyDefinition nullAction = new PolicyDefinition("bad", "null action", null, "allow",
                    Arrays.asList("read", null), List.of(), List.of(), List.of(), null, 1);

            List<Policy> policies = compiler.compileAll(Arrays.asList(
                    nullAction, null, definition("allow", List.of(), null)));

            assertThat(policies).extracting(Policy::name).containsExactly("test policy");
        }

        @Test
        @DisplayName("compileAll should leave rejected policies out")
        void compileAllShouldSkipRejected() {
            List<Policy> policies = compiler.compileAll(List.of(
                    definition("allow", List.of(), null),
                    definition("permit", List.of(), null)));

            assertThat(policies).hasSize(1);
        }
    }

    @Test
    @DisplayName("should compile the bundled seed policies")
    void shouldCompileSeedPolicies() throws IOException {
        List<PolicyDefinition> definitions;
        try (InputStream in = new ClassPathResource("abac/policies.json").getInputStream()) {
            definitions = objectMapper.readValue(in, new TypeReference<>() {});
        }

        List<Policy> policies = compiler.compileAll(definitions);

        assertThat(policies).hasSize(6).allMatch(Policy::isAllow).allMatch(Policy::active);
        assertThat(policies).filteredOn(policy -> !policy.isUnconditional())
                .extracting(Policy::name)
                .containsExactly("Allow User to Manage Their Own Profile",
                        "Allow User to Manage Their Own Files (List & CRUD)");
    }
}
