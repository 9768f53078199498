package com.example.abac.attribute;

import com.example.abac.model.AttributeValue;
import com.example.abac.model.AttributeValue.Absent;
import com.example.abac.model.AttributeValue.Node;
import com.example.abac.model.AttributeValue.Sequence;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Resolves dot-separated attribute paths.
 *
 * <p>Walking rules:
 * <ul>
 *   <li>a node descends by key, a missing key resolves to {@link Absent};</li>
 *   <li>a sequence resolves the remaining path against each of its node elements, drops
 *       absent results and flattens nested sequences by one level, so
 *       {@code user.roles.name} over {@code roles=[{name:admin},{name:user}]} yields
 *       {@code [admin, user]};</li>
 *   <li>a sequence that yields nothing resolves to {@link Absent}, never to an empty sequence;</li>
 *   <li>a scalar with segments left over resolves to {@link Absent}.</li>
 * </ul>
 */
public final class AttributeResolver {

    private AttributeResolver() {}

    @NonNull
    public static AttributeValue resolve(@Nullable String path, @NonNull AttributeValue root) {
        if (path == null || path.isBlank()) {
            return Absent.INSTANCE;
        }
        return resolve(Arrays.asList(path.split("\\.")), root);
    }

    private static AttributeValue resolve(List<String> segments, AttributeValue current) {
        for (int i = 0; i < segments.size(); i++) {
            if (current instanceof Node node) {
                current = node.get(segments.get(i));
                if (current.isAbsent()) {
                    return Absent.INSTANCE;
                }
            } else if (current instanceof Sequence sequence) {
                return resolveEach(segments.subList(i, segments.size()), sequence);
            } else {
                return Absent.INSTANCE;
            }
        }
        return current;
    }

    private static AttributeValue resolveEach(List<String> remaining, Sequence sequence) {
        List<AttributeValue> found = new ArrayList<>();
        for (AttributeValue element : sequence.elements()) {
            if (!(element instanceof Node)) {
                continue;
            }
            AttributeValue value = resolve(remaining, element);
            if (value instanceof Sequence nested) {
                found.addAll(nested.elements());
            } else if (!value.isAbsent()) {
                found.add(value);
            }
        }
        return found.isEmpty() ? Absent.INSTANCE : new Sequence(found);
    }
}
