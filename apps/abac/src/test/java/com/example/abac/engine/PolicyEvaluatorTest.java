package com.example.abac.engine;

import com.example.abac.attribute.AttributeNamespace;
import com.example.abac.function.FunctionRegistry;
import com.example.abac.model.AccessDecision;
import com.example.abac.model.FilterOperator;
import com.example.abac.model.MatchError;
import com.example.abac.model.Policy;
import com.example.abac.rule.RuleEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static com.example.abac.util.PolicyTestBuilder.aDenyPolicy;
import static com.example.abac.util.PolicyTestBuilder.anAllowPolicy;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

@DisplayName("PolicyEvaluator")
class PolicyEvaluatorTest {

    private final PolicyEvaluator evaluator =
            new PolicyEvaluator(new PolicyMatcher(new RuleEvaluator(FunctionRegistry.withDefaults())));

    private static AttributeNamespace namespace(List<String> roles, Map<String, ?> resource) {
        return AttributeNamespace.of(
                Map.of("id", "5", "roles", roles),
                resource,
                Map.of(),
                Map.of());
    }

    @Nested
    @DisplayName("combining")
    class Combining {

        @Test
        @DisplayName("should deny when a deny policy matches even if an allow policy also matches")
        void denyShouldOverrideAllow() {
            Policy banned = aDenyPolicy().withId("deny-banned").forRoles("banned").build();
            Policy adminAll = anAllowPolicy().withId("allow-admin").forRoles("admin").build();

            AccessDecision decision = evaluator.evaluate(List.of(adminAll, banned),
                    namespace(List.of("banned", "admin"), Map.of("type", "chat")), "read", "chat", null);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.policyId()).isEqualTo("deny-banned");
        }

        @Test
        @DisplayName("should allow by the first matching allow policy")
        void shouldAllowByFirstMatch() {
            Policy first = anAllowPolicy().withId("first").forRoles("admin").build();
            Policy second = anAllowPolicy().withId("second").build();

            AccessDecision decision = evaluator.evaluate(List.of(first, second),
                    namespace(List.of("admin"), Map.of("type", "chat")), "read", "chat", null);

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.policyId()).isEqualTo("first");
        }

        @Test
        @DisplayName("should deny by default when nothing matches")
        void shouldDenyByDefault() {
            Policy admin = anAllowPolicy().forRoles("admin").build();

            AccessDecision decision = evaluator.evaluate(List.of(admin),
                    namespace(List.of("standard_user"), Map.of("type", "chat")), "read", "chat", null);

            assertThat(decision.allowed()).isFalse();
            assertThat(decision.policyId()).isEqualTo(AccessDecision.DEFAULT_DENY);
        }

        @Test
        @DisplayName("should deny by default with no policies")
        void shouldDenyWithNoPolicies() {
            assertThat(evaluator.decide(List.of(), namespace(List.of("admin"), Map.of("type", "chat")),
                    "read", "chat", null)).isFalse();
        }

        @Test
        @DisplayName("should skip inactive policies")
        void shouldSkipInactivePolicies() {
            Policy inactiveDeny = aDenyPolicy().inactive().build();
            Policy inactiveAllow = anAllowPolicy().withId("inactive-allow").inactive().build();
            Policy allow = anAllowPolicy().withId("active-allow").build();

            AccessDecision decision = evaluator.evaluate(List.of(inactiveDeny, inactiveAllow, allow),
                    namespace(List.of(), Map.of("type", "chat")), "read", "chat", null);

            assertThat(decision.policyId()).isEqualTo("active-allow");
        }

        @Test
        @DisplayName("a wildcard action should cover any action")
        void wildcardActionShouldCoverAnyAction() {
            Policy policy = anAllowPolicy().withActions("*").onResourceTypes("report").build();

            assertThat(evaluator.decide(List.of(policy), namespace(List.of(), Map.of("type", "report")),
                    "export", "report", null)).isTrue();
        }
    }

    @Nested
    @DisplayName("ownership")
    class Ownership {

        private final Policy ownProfile = anAllowPolicy()
                .withActions("read", "update")
                .onResourceTypes("user")
                .whereResourceEqualsSubject("owner_id", "id")
                .build();

        @Test
        @DisplayName("should allow the owner to read their own profile")
        void shouldAllowOwner() {
            assertThat(evaluator.decide(List.of(ownProfile),
                    namespace(List.of(), Map.of("type", "user", "owner_id", 5)), "read", "user", "5")).isTrue();
        }

        @Test
        @DisplayName("should deny someone else's profile")
        void shouldDenyOtherOwner() {
            assertThat(evaluator.decide(List.of(ownProfile),
                    namespace(List.of(), Map.of("type", "user", "owner_id", 7)), "read", "user", "7")).isFalse();
        }
    }

    @Nested
    @DisplayName("roles")
    class Roles {

        @Test
        @DisplayName("should deny a subject without the role a policy is scoped to")
        void shouldDenyWithoutRole() {
            Policy adminPolicies = anAllowPolicy().forRoles("admin").onResourceTypes("policy").build();

            assertThat(evaluator.decide(List.of(adminPolicies),
                    namespace(List.of("standard_user"), Map.of("type", "policy")), "read", "policy", null)).isFalse();
        }
    }

    @Nested
    @DisplayName("failures")
    class Failures {

        @Test
        @DisplayName("a malformed policy should not stop later policies and should be reported")
        void malformedPolicyShouldBeContained() {
            Policy broken = aDenyPolicy()
                    .withId("broken")
                    .withSubject("user.id", FilterOperator.EQ, "5", "6")
                    .build();
            Policy allow = anAllowPolicy().withId("allow").build();

            AccessDecision decision = evaluator.evaluate(List.of(broken, allow),
                    namespace(List.of(), Map.of("type", "chat")), "read", "chat", null);

            assertThat(decision.allowed()).isTrue();
            assertThat(decision.errors())
                    .extracting(MatchError::policyId, MatchError::kind)
                    .containsExactly(tuple("broken", MatchError.Kind.MALFORMED_POLICY));
        }

        @Test
        @DisplayName("should give the same decision for the same inputs")
        void shouldBeDeterministic() {
            List<Policy> policies = List.of(
                    aDenyPolicy().forRoles("banned").build(),
                    anAllowPolicy().forRoles("admin").build());
            AttributeNamespace namespace = namespace(List.of("admin"), Map.of("type", "chat"));

            AccessDecision first = evaluator.evaluate(policies, namespace, "read", "chat", null);
            AccessDecision second = evaluator.evaluate(policies, namespace, "read", "chat", null);

            assertThat(second).isEqualTo(first);
        }
    }
}
