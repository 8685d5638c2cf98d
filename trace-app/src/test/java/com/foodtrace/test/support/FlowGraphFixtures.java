package com.foodtrace.test.support;

import com.foodtrace.domain.flow.model.valobj.FlowEdge;
import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.flow.model.valobj.FlowNode;
import com.foodtrace.domain.flow.model.valobj.NodeConfig;
import com.foodtrace.types.enums.NodeKindEnum;

import java.util.ArrayList;
import java.util.List;

/**
 * Ready-made flow graphs for tests.
 */
public final class FlowGraphFixtures {

    private FlowGraphFixtures() {
    }

    /**
     * start -> p1 -> ... -> pN -> end, so {@code processCount + 2} steps.
     */
    public static FlowGraph linear(int processCount) {
        List<FlowNode> nodes = new ArrayList<>();
        List<FlowEdge> edges = new ArrayList<>();
        nodes.add(FlowNode.of("start", NodeKindEnum.START, "Start"));
        String previous = "start";
        for (int i = 1; i <= processCount; i++) {
            String id = "p" + i;
            nodes.add(FlowNode.of(id, NodeKindEnum.PROCESS, "Process " + i,
                    new NodeConfig.Process("op-" + i, 10)));
            edges.add(FlowEdge.of("e-" + previous + "-" + id, previous, id));
            previous = id;
        }
        nodes.add(FlowNode.of("end", NodeKindEnum.END, "End"));
        edges.add(FlowEdge.of("e-" + previous + "-end", previous, "end"));
        return FlowGraph.of(nodes, edges);
    }

    /**
     * start -> receive -> qc (blocking CCP gate) -> pack -> end.
     */
    public static FlowGraph withQcGate() {
        return FlowGraph.of(
                List.of(
                        FlowNode.of("start", NodeKindEnum.START, "Start"),
                        FlowNode.of("receive", NodeKindEnum.PROCESS, "Receive", new NodeConfig.Process("receive", 15)),
                        FlowNode.of("qc", NodeKindEnum.QC_GATE, "Incoming QC",
                                new NodeConfig.QcGate("1", List.of("temperature", "packaging"), true, true)),
                        FlowNode.of("pack", NodeKindEnum.PROCESS, "Pack", new NodeConfig.Process("pack", 30)),
                        FlowNode.of("end", NodeKindEnum.END, "End")),
                List.of(
                        FlowEdge.of("e1", "start", "receive"),
                        FlowEdge.of("e2", "receive", "qc"),
                        FlowEdge.of("e3", "qc", "pack"),
                        FlowEdge.of("e4", "pack", "end")));
    }
}
