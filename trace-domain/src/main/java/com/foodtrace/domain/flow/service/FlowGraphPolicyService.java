package com.foodtrace.domain.flow.service;

import com.foodtrace.domain.flow.model.valobj.FlowEdge;
import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.flow.model.valobj.FlowNode;
import com.foodtrace.domain.flow.model.valobj.NodeConfig;
import com.foodtrace.types.common.GraphValidationIssue;
import com.foodtrace.types.enums.GraphIssueCodeEnum;
import com.foodtrace.types.enums.NodeKindEnum;
import org.springframework.stereotype.Service;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Flow graph structure rules: validation, step counting and the canonical execution order.
 */
@Service
public class FlowGraphPolicyService {

    /**
     * Collects every structural issue of the graph. An empty list means the graph is publishable.
     */
    public List<GraphValidationIssue> validate(FlowGraph graph) {
        List<GraphValidationIssue> issues = new ArrayList<>();
        if (graph == null) {
            issues.add(GraphValidationIssue.of(null, GraphIssueCodeEnum.MISSING_START, "Graph has no START node"));
            issues.add(GraphValidationIssue.of(null, GraphIssueCodeEnum.MISSING_END, "Graph has no END node"));
            return issues;
        }

        Map<String, FlowNode> nodesById = new LinkedHashMap<>();
        for (FlowNode node : graph.getNodes()) {
            if (nodesById.putIfAbsent(node.id(), node) != null) {
                issues.add(GraphValidationIssue.of(node.id(), GraphIssueCodeEnum.DUPLICATE_NODE_ID,
                        "Node id is used more than once"));
            }
        }
        checkParents(graph, nodesById, issues);
        checkConfigs(graph, issues);

        boolean hasStart = graph.getNodes().stream().anyMatch(node -> node.kind() == NodeKindEnum.START);
        boolean hasEnd = graph.getNodes().stream().anyMatch(node -> node.kind() == NodeKindEnum.END);
        if (!hasStart) {
            issues.add(GraphValidationIssue.of(null, GraphIssueCodeEnum.MISSING_START, "Graph has no START node"));
        }
        if (!hasEnd) {
            issues.add(GraphValidationIssue.of(null, GraphIssueCodeEnum.MISSING_END, "Graph has no END node"));
        }

        List<FlowEdge> connectable = collectConnectableEdges(graph, nodesById, issues);

        Set<String> withIncoming = new HashSet<>();
        Set<String> withOutgoing = new HashSet<>();
        for (FlowEdge edge : connectable) {
            withOutgoing.add(edge.source());
            withIncoming.add(edge.target());
        }
        for (FlowNode node : nodesById.values()) {
            if (node.kind().isContainer()) {
                continue;
            }
            if (node.kind() != NodeKindEnum.START && !withIncoming.contains(node.id())) {
                issues.add(GraphValidationIssue.of(node.id(), GraphIssueCodeEnum.NO_INCOMING_EDGE,
                        "Node has no incoming edge"));
            }
            if (node.kind() != NodeKindEnum.END && !withOutgoing.contains(node.id())) {
                issues.add(GraphValidationIssue.of(node.id(), GraphIssueCodeEnum.NO_OUTGOING_EDGE,
                        "Node has no outgoing edge"));
            }
        }

        checkCycles(nodesById, connectable, issues);
        return issues;
    }

    /**
     * Number of nodes taking part in sequential execution; layout containers are excluded.
     */
    public int canonicalStepCount(FlowGraph graph) {
        if (graph == null) {
            return 0;
        }
        return (int) graph.getNodes().stream().filter(node -> !node.kind().isContainer()).count();
    }

    /**
     * Execution sequence of a graph: topological order with loop-back edges ignored and ties broken
     * by document order. The position in the returned list is the step index.
     * For a graph with unique node ids this returns {@link #canonicalStepCount(FlowGraph)} nodes.
     */
    public List<FlowNode> canonicalSteps(FlowGraph graph) {
        if (graph == null) {
            return Collections.emptyList();
        }
        Map<String, Integer> position = new LinkedHashMap<>();
        List<FlowNode> steps = new ArrayList<>();
        for (FlowNode node : graph.getNodes()) {
            if (!node.kind().isContainer() && !position.containsKey(node.id())) {
                position.put(node.id(), steps.size());
                steps.add(node);
            }
        }
        Map<String, FlowNode> nodesById = new HashMap<>();
        for (FlowNode node : graph.getNodes()) {
            nodesById.putIfAbsent(node.id(), node);
        }

        List<FlowEdge> forwardEdges = new ArrayList<>();
        for (FlowEdge edge : graph.getEdges()) {
            if (!position.containsKey(edge.source()) || !position.containsKey(edge.target())) {
                continue;
            }
            if (isLoopBack(edge, nodesById, graph.getEdges())) {
                continue;
            }
            forwardEdges.add(edge);
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> successors = new HashMap<>();
        for (FlowEdge edge : forwardEdges) {
            inDegree.merge(edge.target(), 1, Integer::sum);
            successors.computeIfAbsent(edge.source(), key -> new ArrayList<>()).add(edge.target());
        }

        PriorityQueue<FlowNode> ready = new PriorityQueue<>((a, b) ->
                Integer.compare(position.get(a.id()), position.get(b.id())));
        for (FlowNode node : steps) {
            if (inDegree.getOrDefault(node.id(), 0) == 0) {
                ready.add(node);
            }
        }
        List<FlowNode> ordered = new ArrayList<>(steps.size());
        Set<String> emitted = new HashSet<>();
        while (!ready.isEmpty()) {
            FlowNode node = ready.poll();
            ordered.add(node);
            emitted.add(node.id());
            for (String next : successors.getOrDefault(node.id(), Collections.emptyList())) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(nodesById.get(next));
                }
            }
        }
        // Nodes stuck on an unbroken cycle keep document order so the step count stays intact.
        for (FlowNode node : steps) {
            if (!emitted.contains(node.id())) {
                ordered.add(node);
            }
        }
        return ordered;
    }

    private void checkParents(FlowGraph graph, Map<String, FlowNode> nodesById, List<GraphValidationIssue> issues) {
        for (FlowNode node : graph.getNodes()) {
            if (node.parentId() == null) {
                continue;
            }
            FlowNode parent = nodesById.get(node.parentId());
            if (parent == null || !parent.kind().isContainer() || parent.id().equals(node.id())) {
                issues.add(GraphValidationIssue.of(node.id(), GraphIssueCodeEnum.UNKNOWN_PARENT,
                        "Parent '" + node.parentId() + "' is not a GROUP node"));
            }
        }
    }

    private void checkConfigs(FlowGraph graph, List<GraphValidationIssue> issues) {
        for (FlowNode node : graph.getNodes()) {
            NodeConfig config = node.config();
            if (config instanceof NodeConfig.Buffer buffer) {
                if (buffer.minTempC() != null && buffer.maxTempC() != null
                        && buffer.minTempC() > buffer.maxTempC()) {
                    issues.add(GraphValidationIssue.of(node.id(), GraphIssueCodeEnum.INVALID_NODE_CONFIG,
                            "min_temp_c is greater than max_temp_c"));
                }
            } else if (config instanceof NodeConfig.Process process) {
                if (process.expectedDurationMinutes() != null && process.expectedDurationMinutes() < 0) {
                    issues.add(GraphValidationIssue.of(node.id(), GraphIssueCodeEnum.INVALID_NODE_CONFIG,
                            "expected_duration_minutes cannot be negative"));
                }
            } else if (config instanceof NodeConfig.Rework rework) {
                if (rework.maxLoops() != null && rework.maxLoops() < 1) {
                    issues.add(GraphValidationIssue.of(node.id(), GraphIssueCodeEnum.INVALID_NODE_CONFIG,
                            "max_loops must be at least 1"));
                }
            }
        }
    }

    private List<FlowEdge> collectConnectableEdges(FlowGraph graph,
                                                   Map<String, FlowNode> nodesById,
                                                   List<GraphValidationIssue> issues) {
        Set<String> edgeIds = new HashSet<>();
        List<FlowEdge> connectable = new ArrayList<>();
        for (FlowEdge edge : graph.getEdges()) {
            if (!edgeIds.add(edge.id())) {
                issues.add(GraphValidationIssue.of(edge.id(), GraphIssueCodeEnum.DUPLICATE_EDGE_ID,
                        "Edge id is used more than once"));
            }
            FlowNode source = edge.source() == null ? null : nodesById.get(edge.source());
            FlowNode target = edge.target() == null ? null : nodesById.get(edge.target());
            boolean valid = true;
            if (source == null) {
                issues.add(GraphValidationIssue.of(edge.id(), GraphIssueCodeEnum.UNKNOWN_EDGE_SOURCE,
                        "Edge source '" + edge.source() + "' does not exist"));
                valid = false;
            }
            if (target == null) {
                issues.add(GraphValidationIssue.of(edge.id(), GraphIssueCodeEnum.UNKNOWN_EDGE_TARGET,
                        "Edge target '" + edge.target() + "' does not exist"));
                valid = false;
            }
            if ((source != null && source.kind().isContainer()) || (target != null && target.kind().isContainer())) {
                issues.add(GraphValidationIssue.of(edge.id(), GraphIssueCodeEnum.EDGE_ON_CONTAINER,
                        "Edge touches a GROUP container"));
                valid = false;
            }
            if (valid) {
                connectable.add(edge);
            }
        }
        return connectable;
    }

    /**
     * Edges leaving a REWORK node are allowed to close a cycle; every other cycle is reported once,
     * on the edge that closes it.
     */
    private void checkCycles(Map<String, FlowNode> nodesById,
                             List<FlowEdge> connectable,
                             List<GraphValidationIssue> issues) {
        Map<String, List<FlowEdge>> outgoing = new LinkedHashMap<>();
        for (FlowEdge edge : connectable) {
            if (nodesById.get(edge.source()).kind().permitsLoopBack()) {
                continue;
            }
            outgoing.computeIfAbsent(edge.source(), key -> new ArrayList<>()).add(edge);
        }

        Map<String, Integer> color = new HashMap<>();
        for (String start : nodesById.keySet()) {
            if (color.getOrDefault(start, 0) != 0) {
                continue;
            }
            Deque<Object[]> stack = new ArrayDeque<>();
            color.put(start, 1);
            stack.push(new Object[]{start, 0});
            while (!stack.isEmpty()) {
                Object[] frame = stack.peek();
                String nodeId = (String) frame[0];
                int cursor = (Integer) frame[1];
                List<FlowEdge> edges = outgoing.getOrDefault(nodeId, Collections.emptyList());
                if (cursor >= edges.size()) {
                    color.put(nodeId, 2);
                    stack.pop();
                    continue;
                }
                frame[1] = cursor + 1;
                FlowEdge edge = edges.get(cursor);
                int targetColor = color.getOrDefault(edge.target(), 0);
                if (targetColor == 1) {
                    issues.add(GraphValidationIssue.of(edge.id(), GraphIssueCodeEnum.CYCLE_DETECTED,
                            "Edge " + edge.source() + " -> " + edge.target() + " closes a cycle"));
                } else if (targetColor == 0) {
                    color.put(edge.target(), 1);
                    stack.push(new Object[]{edge.target(), 0});
                }
            }
        }
    }

    /**
     * A REWORK edge is a loop-back when its target can already reach its source.
     */
    private boolean isLoopBack(FlowEdge edge, Map<String, FlowNode> nodesById, List<FlowEdge> allEdges) {
        FlowNode source = nodesById.get(edge.source());
        if (source == null || !source.kind().permitsLoopBack()) {
            return false;
        }
        Map<String, List<String>> adjacency = new HashMap<>();
        for (FlowEdge candidate : allEdges) {
            if (candidate.source() != null && candidate.target() != null) {
                adjacency.computeIfAbsent(candidate.source(), key -> new ArrayList<>()).add(candidate.target());
            }
        }
        Deque<String> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        queue.add(edge.target());
        visited.add(edge.target());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (current.equals(edge.source())) {
                return true;
            }
            for (String next : adjacency.getOrDefault(current, Collections.emptyList())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return false;
    }
}
