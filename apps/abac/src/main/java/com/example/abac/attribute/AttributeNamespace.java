package com.example.abac.attribute;

import com.example.abac.model.AttributeValue;
import com.example.abac.model.AttributeValue.Node;
import org.springframework.lang.NonNull;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The attribute tree policies are evaluated against, rooted at the four sections
 * {@code user}, {@code resource}, {@code action} and {@code environment}.
 * Built fresh for every request.
 */
public final class AttributeNamespace {

    public static final String USER = "user";
    public static final String RESOURCE = "resource";
    public static final String ACTION = "action";
    public static final String ENVIRONMENT = "environment";

    private final Node root;

    private AttributeNamespace(Node root) {
        this.root = root;
    }

    public static AttributeNamespace of(
            Map<String, ?> user,
            Map<String, ?> resource,
            Map<String, ?> action,
            Map<String, ?> environment) {
        Map<String, Object> sections = new LinkedHashMap<>();
        sections.put(USER, user);
        sections.put(RESOURCE, resource);
        sections.put(ACTION, action);
        sections.put(ENVIRONMENT, environment);
        return new AttributeNamespace((Node) AttributeValue.of(sections));
    }

    /**
     * Namespace from an arbitrary tree, for callers that already hold one.
     */
    public static AttributeNamespace fromTree(Map<String, ?> tree) {
        return new AttributeNamespace((Node) AttributeValue.of(tree));
    }

    @NonNull
    public AttributeValue resolve(String path) {
        return AttributeResolver.resolve(path, root);
    }

    @NonNull
    public AttributeValue section(String name) {
        return root.get(name);
    }

    @Override
    public String toString() {
        return "AttributeNamespace" + root.fields().keySet();
    }
}
