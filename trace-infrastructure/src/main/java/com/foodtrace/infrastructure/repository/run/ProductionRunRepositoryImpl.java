package com.foodtrace.infrastructure.repository.run;

import com.foodtrace.domain.run.adapter.repository.IProductionRunRepository;
import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.infrastructure.dao.ProductionRunDao;
import com.foodtrace.infrastructure.dao.po.ProductionRunPO;
import com.foodtrace.types.enums.ResponseCode;
import com.foodtrace.types.enums.RunStatusEnum;
import com.foodtrace.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Production run repository implementation.
 */
@Repository
public class ProductionRunRepositoryImpl implements IProductionRunRepository {

    private final ProductionRunDao productionRunDao;

    public ProductionRunRepositoryImpl(ProductionRunDao productionRunDao) {
        this.productionRunDao = productionRunDao;
    }

    @Override
    public boolean insertIfAbsent(ProductionRunEntity entity) {
        entity.validate();
        ProductionRunPO po = toPO(entity);
        int affected = productionRunDao.insertIgnoreConflict(po);
        if (affected == 0) {
            return false;
        }
        entity.setId(po.getId());
        return true;
    }

    /**
     * Optimistic update: the stored version must equal the entity's version before the increment.
     */
    @Override
    public ProductionRunEntity update(ProductionRunEntity entity) {
        entity.validate();
        entity.incrementVersion();
        int affected = productionRunDao.updateWithVersion(toPO(entity));
        if (affected == 0) {
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION,
                    "Optimistic lock failed for ProductionRun: " + entity.getId());
        }
        return entity;
    }

    @Override
    public ProductionRunEntity findById(Long id) {
        ProductionRunPO po = productionRunDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public ProductionRunEntity findByIdForUpdate(Long id) {
        ProductionRunPO po = productionRunDao.selectByIdForUpdate(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public ProductionRunEntity findByIdempotencyKey(String idempotencyKey) {
        ProductionRunPO po = productionRunDao.selectByIdempotencyKey(idempotencyKey);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<ProductionRunEntity> findByStatus(RunStatusEnum status) {
        return productionRunDao.selectByStatus(status).stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public void lockRunCodeSequence(String runCodePrefix) {
        productionRunDao.advisoryLockRunCode(runCodePrefix);
    }

    @Override
    public String findMaxRunCodeByPrefix(String runCodePrefix) {
        return productionRunDao.selectMaxRunCodeByPrefix(runCodePrefix);
    }

    private ProductionRunEntity toEntity(ProductionRunPO po) {
        ProductionRunEntity entity = new ProductionRunEntity();
        entity.setId(po.getId());
        entity.setRunCode(po.getRunCode());
        entity.setStatus(po.getStatus());
        entity.setFlowVersionId(po.getFlowVersionId());
        entity.setCurrentStepIndex(po.getCurrentStepIndex());
        entity.setTotalSteps(po.getTotalSteps());
        entity.setStartedBy(po.getStartedBy());
        entity.setIdempotencyKey(po.getIdempotencyKey());
        entity.setHoldReason(po.getHoldReason());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setEndedAt(po.getEndedAt());
        entity.setVersion(po.getVersion());
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private ProductionRunPO toPO(ProductionRunEntity entity) {
        return ProductionRunPO.builder()
                .id(entity.getId())
                .runCode(entity.getRunCode())
                .status(entity.getStatus())
                .flowVersionId(entity.getFlowVersionId())
                .currentStepIndex(entity.getCurrentStepIndex())
                .totalSteps(entity.getTotalSteps())
                .startedBy(entity.getStartedBy())
                .idempotencyKey(entity.getIdempotencyKey())
                .holdReason(entity.getHoldReason())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .endedAt(entity.getEndedAt())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
    }
}
