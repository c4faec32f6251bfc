package org.pragmatica.pddl.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Directed graph of type or object inheritance. An edge leads from a child to its parent. Vertices keep
 * the order in which they were first seen.
 */
public final class InheritanceGraph {
    public static final String OBJECT = "object";

    private static final InheritanceGraph EMPTY = builder().build();

    private final Map<String, Set<String>> parents;

    private InheritanceGraph(Map<String, Set<String>> parents) {
        this.parents = parents;
    }

    public static InheritanceGraph empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Edge from a child to its parent.
     */
    public record Edge(String child, String parent) {
        @Override
        public String toString() {
            return child + " -> " + parent;
        }
    }

    public List<String> vertices() {
        return List.copyOf(parents.keySet());
    }

    public List<Edge> edges() {
        var edges = new ArrayList<Edge>();
        parents.forEach((child, childParents) -> childParents.forEach(parent -> edges.add(new Edge(child, parent))));
        return edges;
    }

    public boolean hasVertex(String vertex) {
        return parents.containsKey(vertex);
    }

    public boolean isEmpty() {
        return parents.isEmpty();
    }

    public List<String> parentsOf(String vertex) {
        return List.copyOf(parents.getOrDefault(vertex, Set.of()));
    }

    public List<String> childrenOf(String vertex) {
        return parents.entrySet()
                      .stream()
                      .filter(entry -> entry.getValue()
                                            .contains(vertex))
                      .map(Map.Entry::getKey)
                      .toList();
    }

    /**
     * All vertices inheriting from the given one, directly or transitively.
     */
    public List<String> subtreePointingTo(String vertex) {
        var result = new LinkedHashSet<String>();
        collectDescendants(vertex, result);
        return List.copyOf(result);
    }

    private void collectDescendants(String vertex, Set<String> result) {
        for (var child : childrenOf(vertex)) {
            if (result.add(child)) {
                collectDescendants(child, result);
            }
        }
    }

    @Override
    public String toString() {
        return "InheritanceGraph" + edges();
    }

    public static final class Builder {
        private final Map<String, Set<String>> parents = new LinkedHashMap<>();

        private Builder() {}

        public Builder vertex(String vertex) {
            parents.computeIfAbsent(vertex, key -> new LinkedHashSet<>());
            return this;
        }

        public Builder edge(String child, String parent) {
            vertex(child);
            vertex(parent);
            parents.get(child)
                   .add(parent);
            return this;
        }

        public InheritanceGraph build() {
            var copy = new LinkedHashMap<String, Set<String>>();
            parents.forEach((vertex, vertexParents) -> copy.put(vertex,
                                                                 Collections.unmodifiableSet(new LinkedHashSet<>(vertexParents))));
            return new InheritanceGraph(Collections.unmodifiableMap(copy));
        }
    }
}
