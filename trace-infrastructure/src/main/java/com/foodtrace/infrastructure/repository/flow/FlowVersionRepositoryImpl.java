package com.foodtrace.infrastructure.repository.flow;

import com.foodtrace.domain.flow.adapter.repository.IFlowVersionRepository;
import com.foodtrace.domain.flow.model.entity.FlowVersionEntity;
import com.foodtrace.infrastructure.dao.FlowVersionDao;
import com.foodtrace.infrastructure.dao.po.FlowVersionPO;
import com.foodtrace.infrastructure.util.JsonCodec;
import com.foodtrace.types.enums.FlowVersionStatusEnum;
import com.foodtrace.types.exception.ImmutableVersionException;
import com.foodtrace.types.exception.NotDraftException;
import com.foodtrace.types.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Flow version repository implementation. The graph column is written by {@link #save} and
 * {@link #updateGraph} only, and the latter is guarded by {@code status = 'DRAFT'} in SQL.
 */
@Slf4j
@Repository
public class FlowVersionRepositoryImpl implements IFlowVersionRepository {

    private final FlowVersionDao flowVersionDao;
    private final JsonCodec jsonCodec;

    public FlowVersionRepositoryImpl(FlowVersionDao flowVersionDao, JsonCodec jsonCodec) {
        this.flowVersionDao = flowVersionDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public FlowVersionEntity save(FlowVersionEntity entity) {
        entity.validate();
        FlowVersionPO po = toPO(entity);
        flowVersionDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public FlowVersionEntity updateStatus(FlowVersionEntity entity) {
        entity.validate();
        int affected = flowVersionDao.updateStatus(toPO(entity));
        if (affected == 0) {
            throw new ResourceNotFoundException("FlowVersion", entity.getId());
        }
        return entity;
    }

    @Override
    public FlowVersionEntity updateGraph(FlowVersionEntity entity) {
        entity.validate();
        int affected = flowVersionDao.updateGraphIfDraft(toPO(entity));
        if (affected == 0) {
            FlowVersionPO stored = flowVersionDao.selectById(entity.getId());
            if (stored == null) {
                throw new ResourceNotFoundException("FlowVersion", entity.getId());
            }
            log.warn("Graph write rejected by storage guard. versionId={}, storedStatus={}",
                    entity.getId(), stored.getStatus());
            FlowVersionStatusEnum status = stored.getStatus();
            if (status != null && status.isImmutable()) {
                throw new ImmutableVersionException(entity.getId(), status.name());
            }
            throw new NotDraftException(entity.getId(), status == null ? null : status.name());
        }
        return entity;
    }

    @Override
    public FlowVersionEntity findById(Long id) {
        FlowVersionPO po = flowVersionDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public FlowVersionEntity findByIdForUpdate(Long id) {
        FlowVersionPO po = flowVersionDao.selectByIdForUpdate(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<FlowVersionEntity> findByDefinitionId(Long definitionId) {
        return flowVersionDao.selectByDefinitionId(definitionId).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    @Override
    public FlowVersionEntity findOpenDraftByDefinitionId(Long definitionId) {
        FlowVersionPO po = flowVersionDao.selectOpenDraftByDefinitionId(definitionId);
        return po == null ? null : toEntity(po);
    }

    @Override
    public FlowVersionEntity findLatestPublishedByDefinitionId(Long definitionId) {
        FlowVersionPO po = flowVersionDao.selectLatestPublishedByDefinitionId(definitionId);
        return po == null ? null : toEntity(po);
    }

    private FlowVersionEntity toEntity(FlowVersionPO po) {
        FlowVersionEntity entity = new FlowVersionEntity();
        entity.setId(po.getId());
        entity.setFlowDefinitionId(po.getFlowDefinitionId());
        entity.setVersionNum(po.getVersionNum());
        entity.setStatus(po.getStatus());
        entity.setGraph(jsonCodec.readGraph(po.getGraph()));
        entity.setCreatedBy(po.getCreatedBy());
        entity.setReviewedBy(po.getReviewedBy());
        entity.setCommittedAt(po.getCommittedAt());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private FlowVersionPO toPO(FlowVersionEntity entity) {
        FlowVersionPO po = FlowVersionPO.builder()
                .id(entity.getId())
                .flowDefinitionId(entity.getFlowDefinitionId())
                .versionNum(entity.getVersionNum())
                .status(entity.getStatus())
                .createdBy(entity.getCreatedBy())
                .reviewedBy(entity.getReviewedBy())
                .committedAt(entity.getCommittedAt())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
        po.setGraph(jsonCodec.writeGraph(entity.getGraph()));
        return po;
    }
}
