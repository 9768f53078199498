package com.example.abac.function;

import com.example.abac.model.AttributeValue;
import com.example.abac.model.AttributeValue.Scalar;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoField;
import java.time.temporal.TemporalAccessor;
import java.util.List;

/**
 * Boolean predicates that policy conditions may call by name.
 * Absent arguments make every function return {@code false}.
 */
public enum AbacFunction {

    /**
     * {@code is_resource_owner(subjectId, resourceOwnerId)}: ids compared as text.
     */
    IS_RESOURCE_OWNER("is_resource_owner", 2) {
        @Override
        boolean apply(List<AttributeValue> args) {
            if (!(args.get(0) instanceof Scalar subjectId) || !(args.get(1) instanceof Scalar ownerId)) {
                return false;
            }
            return subjectId.text().equals(ownerId.text());
        }
    },

    /**
     * {@code is_within_working_hours(currentTime)}: true from 09:00 up to, not including, 17:00.
     */
    IS_WITHIN_WORKING_HOURS("is_within_working_hours", 1) {
        @Override
        boolean apply(List<AttributeValue> args) {
            if (!(args.get(0) instanceof Scalar time)) {
                return false;
            }
            int hour = hourOf(time.value());
            return hour >= WORKDAY_START_HOUR && hour < WORKDAY_END_HOUR;
        }
    };

    private static final int WORKDAY_START_HOUR = 9;
    private static final int WORKDAY_END_HOUR = 17;

    private final String functionName;
    private final int arity;

    AbacFunction(String functionName, int arity) {
        this.functionName = functionName;
        this.arity = arity;
    }

    public String functionName() {
        return functionName;
    }

    public int arity() {
        return arity;
    }

    abstract boolean apply(List<AttributeValue> args);

    private static int hourOf(Object value) {
        if (value instanceof TemporalAccessor temporal && temporal.isSupported(ChronoField.HOUR_OF_DAY)) {
            return temporal.get(ChronoField.HOUR_OF_DAY);
        }
        if (value instanceof CharSequence text) {
            return parseHour(text.toString());
        }
        throw new IllegalArgumentException("Expected a date-time but got " + value.getClass().getSimpleName());
    }

    private static int parseHour(String text) {
        try {
            return LocalDateTime.parse(text).getHour();
        } catch (DateTimeParseException notLocal) {
            try {
                return OffsetDateTime.parse(text).getHour();
            } catch (DateTimeParseException notOffset) {
                try {
                    return ZonedDateTime.parse(text).getHour();
                } catch (DateTimeParseException e) {
                    throw new IllegalArgumentException("Unparseable date-time: " + text, e);
                }
            }
        }
    }
}
