package com.example.abac.attribute;

import com.example.abac.model.AttributeValue;
import com.example.abac.model.AttributeValue.Absent;
import com.example.abac.model.AttributeValue.Scalar;
import com.example.abac.model.AttributeValue.Sequence;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("AttributeResolver")
class AttributeResolverTest {

    private static final AttributeValue TREE = AttributeValue.of(Map.of(
            "user", Map.of(
                    "id", 5,
                    "department", "finance",
                    "roles", List.of(Map.of("name", "admin"), Map.of("name", "user")),
                    "teams", List.of(
                            Map.of("members", List.of(Map.of("id", "a"), Map.of("id", "b"))),
                            Map.of("members", List.of(Map.of("id", "c"))),
                            Map.of("label", "no members")),
                    "tags", List.of("x", "y"))));

    @Nested
    @DisplayName("node traversal")
    class NodeTraversal {

        @Test
        @DisplayName("should resolve a nested scalar")
        void shouldResolveNestedScalar() {
            AttributeValue value = AttributeResolver.resolve("user.department", TREE);

            assertThat(value).isEqualTo(new Scalar("finance"));
        }

        @Test
        @DisplayName("should return absent for a missing key")
        void shouldReturnAbsentForMissingKey() {
            assertThat(AttributeResolver.resolve("user.manager.id", TREE)).isSameAs(Absent.INSTANCE);
        }

        @Test
        @DisplayName("should return absent when a scalar has path segments left")
        void shouldReturnAbsentPastScalar() {
            assertThat(AttributeResolver.resolve("user.department.code", TREE)).isSameAs(Absent.INSTANCE);
        }

        @Test
        @DisplayName("should return absent for a blank path")
        void shouldReturnAbsentForBlankPath() {
            assertThat(AttributeResolver.resolve("", TREE).isAbsent()).isTrue();
            assertThat(AttributeResolver.resolve(null, TREE).isAbsent()).isTrue();
        }
    }

    @Nested
    @DisplayName("sequence traversal")
    class SequenceTraversal {

        @Test
        @DisplayName("should collect a field from every element")
        void shouldCollectFieldFromEveryElement() {
            AttributeValue value = AttributeResolver.resolve("user.roles.name", TREE);

            assertThat(value).isInstanceOf(Sequence.class);
            assertThat(((Sequence) value).elements())
                    .containsExactly(new Scalar("admin"), new Scalar("user"));
        }

        @Test
        @DisplayName("should flatten nested sequences by one level and skip elements without the field")
        void shouldFlattenNestedSequences() {
            AttributeValue value = AttributeResolver.resolve("user.teams.members.id", TREE);

            assertThat(((Sequence) value).elements())
                    .containsExactly(new Scalar("a"), new Scalar("b"), new Scalar("c"));
        }

        @Test
        @DisplayName("should return absent rather than an empty sequence when no element has the field")
        void shouldReturnAbsentWhenNothingFound() {
            assertThat(AttributeResolver.resolve("user.roles.level", TREE)).isSameAs(Absent.INSTANCE);
        }

        @Test
        @DisplayName("should return the sequence itself when the path ends on it")
        void shouldReturnSequenceAtEndOfPath() {
            AttributeValue value = AttributeResolver.resolve("user.tags", TREE);

            assertThat(value.elements()).containsExactly(new Scalar("x"), new Scalar("y"));
        }

        @Test
        @DisplayName("should return absent when descending into a sequence of scalars")
        void shouldReturnAbsentForScalarElements() {
            assertThat(AttributeResolver.resolve("user.tags.name", TREE)).isSameAs(Absent.INSTANCE);
        }
    }

    @Test
    @DisplayName("should give identical results for repeated calls")
    void shouldBeDeterministic() {
        assertThat(AttributeResolver.resolve("user.roles.name", TREE))
                .isEqualTo(AttributeResolver.resolve("user.roles.name", TREE));
    }
}
