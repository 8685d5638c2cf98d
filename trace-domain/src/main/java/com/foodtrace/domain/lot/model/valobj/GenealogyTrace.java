package com.foodtrace.domain.lot.model.valobj;

import com.foodtrace.domain.lot.model.entity.GenealogyEdgeEntity;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.types.enums.TraceDirectionEnum;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Result of a bounded genealogy traversal. {@code nodes} holds the root at depth 0 followed by
 * every reached lot once, in BFS order; {@code edges} holds the edges actually traversed.
 */
public record GenealogyTrace(Long rootLotId,
                             TraceDirectionEnum direction,
                             int maxDepth,
                             List<TraceNode> nodes,
                             List<GenealogyEdgeEntity> edges) {

    public GenealogyTrace {
        nodes = nodes == null ? List.of() : List.copyOf(nodes);
        edges = edges == null ? List.of() : List.copyOf(edges);
    }

    public Set<String> lotCodes() {
        return nodes.stream().map(node -> node.lot().getLotCode()).collect(Collectors.toSet());
    }

    /**
     * Lots reached at exactly the given depth.
     */
    public List<LotEntity> lotsAtDepth(int depth) {
        return nodes.stream()
                .filter(node -> node.depth() == depth)
                .map(TraceNode::lot)
                .collect(Collectors.toList());
    }

    public record TraceNode(LotEntity lot, int depth) {
    }
}
