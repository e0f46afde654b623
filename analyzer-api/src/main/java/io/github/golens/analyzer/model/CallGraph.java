package io.github.golens.analyzer.model;

import java.util.List;
import java.util.Optional;

public record CallGraph(List<CallGraphNode> nodes, List<CallGraphEdge> edges) {

    public CallGraph {
        nodes = List.copyOf(nodes);
        edges = List.copyOf(edges);
    }

    public Optional<CallGraphNode> node(String id) {
        return nodes.stream().filter(n -> n.id().equals(id)).findFirst();
    }

    public Optional<CallGraphEdge> edge(String source, String target) {
        return edges.stream()
                .filter(e -> e.source().equals(source) && e.target().equals(target))
                .findFirst();
    }

    public List<CallGraphEdge> edgesFrom(String source) {
        return edges.stream().filter(e -> e.source().equals(source)).toList();
    }
}
