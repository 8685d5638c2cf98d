package com.foodtrace.infrastructure.repository.flow;

import com.foodtrace.domain.flow.adapter.repository.IFlowDefinitionRepository;
import com.foodtrace.domain.flow.model.entity.FlowDefinitionEntity;
import com.foodtrace.infrastructure.dao.FlowDefinitionDao;
import com.foodtrace.infrastructure.dao.po.FlowDefinitionPO;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flow definition repository implementation.
 */
@Repository
public class FlowDefinitionRepositoryImpl implements IFlowDefinitionRepository {

    private final FlowDefinitionDao flowDefinitionDao;

    public FlowDefinitionRepositoryImpl(FlowDefinitionDao flowDefinitionDao) {
        this.flowDefinitionDao = flowDefinitionDao;
    }

    @Override
    public FlowDefinitionEntity save(FlowDefinitionEntity entity) {
        entity.validate();
        FlowDefinitionPO po = toPO(entity);
        flowDefinitionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public FlowDefinitionEntity findById(Long id) {
        FlowDefinitionPO po = flowDefinitionDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public FlowDefinitionEntity findByIdForUpdate(Long id) {
        FlowDefinitionPO po = flowDefinitionDao.selectByIdForUpdate(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<FlowDefinitionEntity> findAll() {
        return flowDefinitionDao.selectAll().stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public Integer allocateNextVersionNum(Long definitionId) {
        return flowDefinitionDao.incrementLatestVersionNum(definitionId);
    }

    private FlowDefinitionEntity toEntity(FlowDefinitionPO po) {
        FlowDefinitionEntity entity = new FlowDefinitionEntity();
        entity.setId(po.getId());
        entity.setName(po.getName());
        entity.setDescription(po.getDescription());
        entity.setCreatedBy(po.getCreatedBy());
        entity.setLatestVersionNum(po.getLatestVersionNum());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private FlowDefinitionPO toPO(FlowDefinitionEntity entity) {
        return FlowDefinitionPO.builder()
                .id(entity.getId())
                .name(entity.getName())
                .description(entity.getDescription())
                .createdBy(entity.getCreatedBy())
                .latestVersionNum(entity.getLatestVersionNum())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
