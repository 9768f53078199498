package com.example.abac.filter;

import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Component;

/**
 * Translates {@link FilterExpression}s into MongoDB criteria.
 *
 * <p>Point checks compare scalars by their text, so {@code "5"} equals {@code 5}. Mongo
 * matches by BSON type, so an equality on a value with an exact numeric or boolean
 * reading becomes an {@code $in} over both forms.
 */
@Component
public class MongoCriteriaTranslator {

    private static final String ID_FIELD = "_id";

    public Query toQuery(FilterExpression expression) {
        return new Query(toCriteria(expression));
    }

    public Criteria toCriteria(FilterExpression expression) {
        if (expression instanceof FilterExpression.MatchAll) {
            return new Criteria();
        }
        if (expression instanceof FilterExpression.MatchNone) {
            // Every stored document has an _id
            return Criteria.where(ID_FIELD).exists(false);
        }
        if (expression instanceof FilterExpression.Equals equals) {
            return equality(equals.attribute(), equals.value());
        }
        if (expression instanceof FilterExpression.And and) {
            return new Criteria().andOperator(and.operands().stream()
                    .map(this::toCriteria)
                    .toArray(Criteria[]::new));
        }
        FilterExpression.Or or = (FilterExpression.Or) expression;
        return new Criteria().orOperator(or.operands().stream()
                .map(this::toCriteria)
                .toArray(Criteria[]::new));
    }

    private Criteria equality(String attribute, Object value) {
        Object alternate = alternateForm(value);
        if (alternate == null) {
            return Criteria.where(attribute).is(value);
        }
        return Criteria.where(attribute).in(value, alternate);
    }

    /**
     * The other BSON form of a value whose text reading is exact, or null when there is none.
     */
    @Nullable
    static Object alternateForm(@Nullable Object value) {
        if (value instanceof String text) {
            if ("true".equals(text) || "false".equals(text)) {
                return Boolean.valueOf(text);
            }
            try {
                long number = Long.parseLong(text);
                return String.valueOf(number).equals(text) ? number : null;
            } catch (NumberFormatException e) {
                return null;
            }
        }
        if (value instanceof Long || value instanceof Integer || value instanceof Boolean) {
            return String.valueOf(value);
        }
        return null;
    }
}
