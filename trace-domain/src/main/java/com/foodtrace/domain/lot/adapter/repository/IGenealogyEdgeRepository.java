package com.foodtrace.domain.lot.adapter.repository;

import com.foodtrace.domain.lot.model.entity.GenealogyEdgeEntity;

import java.util.Collection;
import java.util.List;

/**
 * Genealogy edge repository. Edges are never updated or deleted.
 */
public interface IGenealogyEdgeRepository {

    GenealogyEdgeEntity save(GenealogyEdgeEntity entity);

    /**
     * Serializes genealogy writes until the surrounding transaction ends, so that two concurrent
     * links cannot jointly close a cycle.
     */
    void lockForWrite();

    List<GenealogyEdgeEntity> findByChildLotIds(Collection<Long> childLotIds);

    List<GenealogyEdgeEntity> findByParentLotIds(Collection<Long> parentLotIds);
}
