package com.jsonloom.service.core.queries.expressions;

import com.jsonloom.core.resources.RelationshipAttribute;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Tree of relationships to include. Chains sharing a prefix share the same tree nodes. */
public record IncludeExpression(List<IncludeElementExpression> elements) implements QueryExpression {

    public static final IncludeExpression EMPTY = new IncludeExpression(List.of());

    public IncludeExpression {
        elements = List.copyOf(elements);
    }

    public boolean isEmpty() {
        return elements.isEmpty();
    }

    /** Builds a tree from relationship chains, merging common prefixes. */
    public static IncludeExpression fromChains(List<List<RelationshipAttribute>> chains) {
        Node root = new Node();
        for (List<RelationshipAttribute> chain : chains) {
            Node current = root;
            for (RelationshipAttribute relationship : chain) {
                current = current.children.computeIfAbsent(relationship, key -> new Node());
            }
        }
        return new IncludeExpression(root.toElements());
    }

    /** Flattens the tree back into relationship chains, depth-first. */
    public List<List<RelationshipAttribute>> toChains() {
        List<List<RelationshipAttribute>> chains = new ArrayList<>();
        for (IncludeElementExpression element : elements) {
            flatten(element, new ArrayList<>(), chains);
        }
        return chains;
    }

    /** Returns a tree holding the chains of both expressions. */
    public IncludeExpression merge(IncludeExpression other) {
        List<List<RelationshipAttribute>> chains = new ArrayList<>(toChains());
        chains.addAll(other.toChains());
        return fromChains(chains);
    }

    private static void flatten(
            IncludeElementExpression element,
            List<RelationshipAttribute> prefix,
            List<List<RelationshipAttribute>> chains) {
        List<RelationshipAttribute> chain = new ArrayList<>(prefix);
        chain.add(element.relationship());
        if (element.children().isEmpty()) {
            chains.add(chain);
        }
        for (IncludeElementExpression child : element.children()) {
            flatten(child, chain, chains);
        }
    }

    static void collectChains(IncludeElementExpression element, String path, List<String> chains) {
        if (element.children().isEmpty()) {
            chains.add(path);
        }
        for (IncludeElementExpression child : element.children()) {
            collectChains(child, path + "." + child.relationship().getPublicName(), chains);
        }
    }

    @Override
    public String toString() {
        List<String> chains = new ArrayList<>();
        for (IncludeElementExpression element : elements) {
            collectChains(element, element.relationship().getPublicName(), chains);
        }
        return String.join(",", chains);
    }

    private static final class Node {
        private final Map<RelationshipAttribute, Node> children = new LinkedHashMap<>();

        List<IncludeElementExpression> toElements() {
            List<IncludeElementExpression> elements = new ArrayList<>();
            children.forEach((relationship, node) ->
                    elements.add(new IncludeElementExpression(relationship, node.toElements())));
            return elements;
        }
    }
}
