package com.foodtrace.domain.lot.service;

import com.foodtrace.domain.lot.adapter.repository.IGenealogyEdgeRepository;
import com.foodtrace.domain.lot.adapter.repository.ILotRepository;
import com.foodtrace.domain.lot.model.entity.GenealogyEdgeEntity;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.lot.model.valobj.GenealogyTrace;
import com.foodtrace.domain.lot.model.valobj.ImmediateLineage;
import com.foodtrace.types.enums.TraceDirectionEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Breadth-first walks over the genealogy graph.
 */
@Slf4j
@Service
public class GenealogyTraversalDomainService {

    private final IGenealogyEdgeRepository genealogyEdgeRepository;
    private final ILotRepository lotRepository;

    public GenealogyTraversalDomainService(IGenealogyEdgeRepository genealogyEdgeRepository,
                                           ILotRepository lotRepository) {
        this.genealogyEdgeRepository = genealogyEdgeRepository;
        this.lotRepository = lotRepository;
    }

    /**
     * Level-by-level BFS from the root, bounded by {@code maxDepth} even though the graph is acyclic.
     */
    public GenealogyTrace trace(LotEntity root, TraceDirectionEnum direction, int maxDepth) {
        Map<Long, Integer> depthByLot = new LinkedHashMap<>();
        depthByLot.put(root.getId(), 0);
        Set<Long> seenEdges = new HashSet<>();
        List<GenealogyEdgeEntity> traversed = new ArrayList<>();

        Set<Long> frontier = new LinkedHashSet<>();
        frontier.add(root.getId());
        for (int depth = 1; depth <= maxDepth && !frontier.isEmpty(); depth++) {
            List<GenealogyEdgeEntity> edges = direction == TraceDirectionEnum.BACKWARD
                    ? genealogyEdgeRepository.findByChildLotIds(frontier)
                    : genealogyEdgeRepository.findByParentLotIds(frontier);
            Set<Long> next = new LinkedHashSet<>();
            for (GenealogyEdgeEntity edge : edges) {
                if (edge.getId() != null && !seenEdges.add(edge.getId())) {
                    continue;
                }
                traversed.add(edge);
                Long reached = direction == TraceDirectionEnum.BACKWARD ? edge.getParentLotId() : edge.getChildLotId();
                if (!depthByLot.containsKey(reached)) {
                    depthByLot.put(reached, depth);
                    next.add(reached);
                }
            }
            frontier = next;
        }
        if (!frontier.isEmpty()) {
            log.debug("Genealogy trace stopped at max depth. rootLotId={}, direction={}, maxDepth={}, pending={}",
                    root.getId(), direction, maxDepth, frontier.size());
        }

        Map<Long, LotEntity> lotsById = loadLots(depthByLot.keySet());
        lotsById.put(root.getId(), root);
        List<GenealogyTrace.TraceNode> nodes = new ArrayList<>(depthByLot.size());
        for (Map.Entry<Long, Integer> entry : depthByLot.entrySet()) {
            LotEntity lot = lotsById.get(entry.getKey());
            if (lot != null) {
                nodes.add(new GenealogyTrace.TraceNode(lot, entry.getValue()));
            }
        }
        log.debug("Genealogy trace done. rootLotId={}, direction={}, maxDepth={}, nodes={}, edges={}",
                root.getId(), direction, maxDepth, nodes.size(), traversed.size());
        return new GenealogyTrace(root.getId(), direction, maxDepth, nodes, traversed);
    }

    public ImmediateLineage immediate(LotEntity central) {
        List<Long> parentIds = genealogyEdgeRepository.findByChildLotIds(List.of(central.getId())).stream()
                .map(GenealogyEdgeEntity::getParentLotId)
                .distinct()
                .collect(Collectors.toList());
        List<Long> childIds = genealogyEdgeRepository.findByParentLotIds(List.of(central.getId())).stream()
                .map(GenealogyEdgeEntity::getChildLotId)
                .distinct()
                .collect(Collectors.toList());
        Map<Long, LotEntity> parents = loadLots(parentIds);
        Map<Long, LotEntity> children = loadLots(childIds);
        return new ImmediateLineage(central,
                parentIds.stream().map(parents::get).filter(lot -> lot != null).collect(Collectors.toList()),
                childIds.stream().map(children::get).filter(lot -> lot != null).collect(Collectors.toList()));
    }

    /**
     * Returns the first candidate reachable from {@code startLotId} by following parent to child edges
     * (the start itself counts as reachable), or null when none is.
     */
    public Long findFirstDescendantAmong(Long startLotId, Collection<Long> candidates) {
        Set<Long> targets = new HashSet<>(candidates);
        if (targets.contains(startLotId)) {
            return startLotId;
        }
        Set<Long> visited = new HashSet<>();
        visited.add(startLotId);
        Set<Long> frontier = new LinkedHashSet<>();
        frontier.add(startLotId);
        while (!frontier.isEmpty()) {
            Set<Long> next = new LinkedHashSet<>();
            for (GenealogyEdgeEntity edge : genealogyEdgeRepository.findByParentLotIds(frontier)) {
                Long child = edge.getChildLotId();
                if (targets.contains(child)) {
                    return child;
                }
                if (visited.add(child)) {
                    next.add(child);
                }
            }
            frontier = next;
        }
        return null;
    }

    private Map<Long, LotEntity> loadLots(Collection<Long> ids) {
        if (ids.isEmpty()) {
            return new LinkedHashMap<>();
        }
        return lotRepository.findByIds(ids).stream()
                .collect(Collectors.toMap(LotEntity::getId, Function.identity(), (a, b) -> a, LinkedHashMap::new));
    }
}
