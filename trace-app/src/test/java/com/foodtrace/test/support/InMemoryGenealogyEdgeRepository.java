package com.foodtrace.test.support;

import com.foodtrace.domain.lot.adapter.repository.IGenealogyEdgeRepository;
import com.foodtrace.domain.lot.model.entity.GenealogyEdgeEntity;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

/**
 * In-memory genealogy edge repository. Append-only like the real table.
 */
public class InMemoryGenealogyEdgeRepository implements IGenealogyEdgeRepository {

    private final List<GenealogyEdgeEntity> store = new ArrayList<>();
    private long nextId = 1;
    private int writeLocks;

    @Override
    public GenealogyEdgeEntity save(GenealogyEdgeEntity entity) {
        entity.setId(nextId++);
        store.add(entity);
        return entity;
    }

    @Override
    public void lockForWrite() {
        writeLocks++;
    }

    @Override
    public List<GenealogyEdgeEntity> findByChildLotIds(Collection<Long> childLotIds) {
        return store.stream()
                .filter(edge -> childLotIds.contains(edge.getChildLotId()))
                .collect(Collectors.toList());
    }

    @Override
    public List<GenealogyEdgeEntity> findByParentLotIds(Collection<Long> parentLotIds) {
        return store.stream()
                .filter(edge -> parentLotIds.contains(edge.getParentLotId()))
                .collect(Collectors.toList());
    }

    public List<GenealogyEdgeEntity> findAll() {
        return new ArrayList<>(store);
    }

    public int getWriteLocks() {
        return writeLocks;
    }
}
