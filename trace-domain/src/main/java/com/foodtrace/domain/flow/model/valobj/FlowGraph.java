package com.foodtrace.domain.flow.model.valobj;

import java.util.List;
import java.util.Objects;

/**
 * Immutable flow graph document: ordered nodes and edges.
 */
public final class FlowGraph {

    private static final FlowGraph EMPTY = new FlowGraph(List.of(), List.of());

    private final List<FlowNode> nodes;
    private final List<FlowEdge> edges;

    private FlowGraph(List<FlowNode> nodes, List<FlowEdge> edges) {
        this.nodes = nodes;
        this.edges = edges;
    }

    public static FlowGraph of(List<FlowNode> nodes, List<FlowEdge> edges) {
        return new FlowGraph(nodes == null ? List.of() : List.copyOf(nodes),
                edges == null ? List.of() : List.copyOf(edges));
    }

    public static FlowGraph empty() {
        return EMPTY;
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public List<FlowEdge> getEdges() {
        return edges;
    }

    public boolean isEmpty() {
        return nodes.isEmpty() && edges.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof FlowGraph other)) {
            return false;
        }
        return nodes.equals(other.nodes) && edges.equals(other.edges);
    }

    @Override
    public int hashCode() {
        return Objects.hash(nodes, edges);
    }

    @Override
    public String toString() {
        return "FlowGraph{nodes=" + nodes.size() + ", edges=" + edges.size() + "}";
    }
}
