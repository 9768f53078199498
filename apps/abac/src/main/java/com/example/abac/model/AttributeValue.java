package com.example.abac.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Value found at an attribute path.
 *
 * <p>The four shapes are closed: a single {@link Scalar}, an ordered {@link Sequence},
 * a keyed {@link Node}, or {@link Absent} when nothing exists at the path. Absent is a
 * value rather than an error so callers can fail closed without exception handling.
 */
public sealed interface AttributeValue
        permits AttributeValue.Scalar, AttributeValue.Sequence, AttributeValue.Node, AttributeValue.Absent {

    default boolean isAbsent() {
        return this == Absent.INSTANCE;
    }

    /**
     * Elements of this value as a list: a sequence yields its elements, a scalar or node
     * yields itself, and absent yields nothing.
     */
    default List<AttributeValue> elements() {
        if (this instanceof Sequence sequence) {
            return sequence.elements();
        }
        if (isAbsent()) {
            return List.of();
        }
        return List.of(this);
    }

    /**
     * Wraps a raw Java value. Maps become nodes, collections and arrays become sequences,
     * {@code null} becomes absent and everything else is a scalar.
     */
    @NonNull
    static AttributeValue of(@Nullable Object raw) {
        if (raw == null) {
            return Absent.INSTANCE;
        }
        if (raw instanceof AttributeValue value) {
            return value;
        }
        if (raw instanceof Map<?, ?> map) {
            Map<String, AttributeValue> fields = new LinkedHashMap<>();
            map.forEach((key, value) -> fields.put(String.valueOf(key), of(value)));
            return new Node(fields);
        }
        if (raw instanceof Collection<?> collection) {
            List<AttributeValue> elements = new ArrayList<>(collection.size());
            collection.forEach(element -> elements.add(of(element)));
            return new Sequence(elements);
        }
        if (raw instanceof Object[] array) {
            return of(List.of(array));
        }
        return new Scalar(raw);
    }

    /**
     * Equality used by every comparison in the engine. Scalars compare by {@link Scalar#sameAs},
     * sequences element-wise in order, nodes field by field. Absent never equals anything.
     */
    static boolean sameValue(@NonNull AttributeValue left, @NonNull AttributeValue right) {
        if (left.isAbsent() || right.isAbsent()) {
            return false;
        }
        if (left instanceof Scalar scalar && right instanceof Scalar other) {
            return scalar.sameAs(other.value());
        }
        if (left instanceof Sequence sequence && right instanceof Sequence other) {
            if (sequence.elements().size() != other.elements().size()) {
                return false;
            }
            for (int i = 0; i < sequence.elements().size(); i++) {
                if (!sameValue(sequence.elements().get(i), other.elements().get(i))) {
                    return false;
                }
            }
            return true;
        }
        if (left instanceof Node node && right instanceof Node other) {
            return node.fields().equals(other.fields());
        }
        return false;
    }

    record Scalar(@NonNull Object value) implements AttributeValue {

        public Scalar {
            Objects.requireNonNull(value, "scalar value");
        }

        /**
         * Numbers compare numerically ({@code 5 == 5.0}); anything else compares by its text,
         * so an integer id matches the same id written as a string in a policy.
         */
        public boolean sameAs(@Nullable Object expected) {
            if (expected == null) {
                return false;
            }
            if (expected instanceof Scalar scalar) {
                return sameAs(scalar.value());
            }
            if (value instanceof Number number && expected instanceof Number other) {
                return toDecimal(number).compareTo(toDecimal(other)) == 0;
            }
            return text().equals(String.valueOf(expected));
        }

        /**
         * Orders this scalar against {@code expected}.
         *
         * @throws IllegalArgumentException when the operands have no common ordering
         */
        @SuppressWarnings("unchecked")
        public int orderAgainst(@NonNull Object expected) {
            Object other = expected instanceof Scalar scalar ? scalar.value() : expected;
            if (value instanceof Number number) {
                BigDecimal right = other instanceof Number otherNumber
                        ? toDecimal(otherNumber)
                        : parseDecimal(other);
                return toDecimal(number).compareTo(right);
            }
            if (value instanceof Comparable<?> comparable && value.getClass().isInstance(other)) {
                return ((Comparable<Object>) comparable).compareTo(other);
            }
            throw new IllegalArgumentException("Cannot order " + value.getClass().getSimpleName()
                    + " against " + other.getClass().getSimpleName());
        }

        public String text() {
            return String.valueOf(value);
        }

        private static BigDecimal toDecimal(Number number) {
            if (number instanceof BigDecimal decimal) {
                return decimal;
            }
            return new BigDecimal(number.toString());
        }

        private static BigDecimal parseDecimal(Object other) {
            try {
                return new BigDecimal(String.valueOf(other));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Cannot order a number against '" + other + "'", e);
            }
        }
    }

    record Sequence(@NonNull List<AttributeValue> elements) implements AttributeValue {

        public Sequence {
            elements = elements == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(elements));
        }

        public boolean containsValue(@NonNull AttributeValue candidate) {
            return elements.stream().anyMatch(element -> sameValue(element, candidate));
        }
    }

    record Node(@NonNull Map<String, AttributeValue> fields) implements AttributeValue {

        public Node {
            fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        }

        @NonNull
        public AttributeValue get(String key) {
            AttributeValue value = fields.get(key);
            return value != null ? value : Absent.INSTANCE;
        }
    }

    enum Absent implements AttributeValue {
        INSTANCE
    }
}
