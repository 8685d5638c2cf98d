package com.foodtrace.infrastructure.repository.lot;

import com.foodtrace.domain.lot.adapter.repository.IGenealogyEdgeRepository;
import com.foodtrace.domain.lot.model.entity.GenealogyEdgeEntity;
import com.foodtrace.infrastructure.dao.GenealogyEdgeDao;
import com.foodtrace.infrastructure.dao.po.GenealogyEdgePO;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Genealogy edge repository implementation.
 */
@Repository
public class GenealogyEdgeRepositoryImpl implements IGenealogyEdgeRepository {

    private final GenealogyEdgeDao genealogyEdgeDao;

    public GenealogyEdgeRepositoryImpl(GenealogyEdgeDao genealogyEdgeDao) {
        this.genealogyEdgeDao = genealogyEdgeDao;
    }

    @Override
    public GenealogyEdgeEntity save(GenealogyEdgeEntity entity) {
        GenealogyEdgePO po = GenealogyEdgePO.builder()
                .parentLotId(entity.getParentLotId())
                .childLotId(entity.getChildLotId())
                .quantityUsedKg(entity.getQuantityUsedKg())
                .eventRef(entity.getEventRef())
                .linkedAt(entity.getLinkedAt())
                .build();
        genealogyEdgeDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public void lockForWrite() {
        genealogyEdgeDao.advisoryLockGenealogy();
    }

    @Override
    public List<GenealogyEdgeEntity> findByChildLotIds(Collection<Long> childLotIds) {
        if (childLotIds == null || childLotIds.isEmpty()) {
            return Collections.emptyList();
        }
        return genealogyEdgeDao.selectByChildLotIds(childLotIds).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public List<GenealogyEdgeEntity> findByParentLotIds(Collection<Long> parentLotIds) {
        if (parentLotIds == null || parentLotIds.isEmpty()) {
            return Collections.emptyList();
        }
        return genealogyEdgeDao.selectByParentLotIds(parentLotIds).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private GenealogyEdgeEntity toEntity(GenealogyEdgePO po) {
        GenealogyEdgeEntity entity = new GenealogyEdgeEntity();
        entity.setId(po.getId());
        entity.setParentLotId(po.getParentLotId());
        entity.setChildLotId(po.getChildLotId());
        entity.setQuantityUsedKg(po.getQuantityUsedKg());
        entity.setEventRef(po.getEventRef());
        entity.setLinkedAt(po.getLinkedAt());
        return entity;
    }
}
