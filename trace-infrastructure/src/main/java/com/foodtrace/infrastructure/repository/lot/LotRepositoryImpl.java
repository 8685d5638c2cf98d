package com.foodtrace.infrastructure.repository.lot;

import com.foodtrace.domain.lot.adapter.repository.ILotRepository;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.infrastructure.dao.LotDao;
import com.foodtrace.infrastructure.dao.po.LotPO;
import com.foodtrace.infrastructure.util.JsonCodec;
import com.foodtrace.types.enums.ResponseCode;
import com.foodtrace.types.exception.AppException;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Lot repository implementation.
 */
@Repository
public class LotRepositoryImpl implements ILotRepository {

    private final LotDao lotDao;
    private final JsonCodec jsonCodec;

    public LotRepositoryImpl(LotDao lotDao, JsonCodec jsonCodec) {
        this.lotDao = lotDao;
        this.jsonCodec = jsonCodec;
    }

    @Override
    public LotEntity save(LotEntity entity) {
        entity.validate();
        LotPO po = toPO(entity);
        lotDao.insert(po);
        entity.setId(po.getId());
        return entity;
    }

    @Override
    public LotEntity update(LotEntity entity) {
        entity.validate();
        entity.incrementVersion();
        int affected = lotDao.updateWithVersion(toPO(entity));
        if (affected == 0) {
            throw new AppException(ResponseCode.CONCURRENT_MODIFICATION,
                    "Optimistic lock failed for Lot: " + entity.getId());
        }
        return entity;
    }

    @Override
    public LotEntity findById(Long id) {
        LotPO po = lotDao.selectById(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public LotEntity findByIdForUpdate(Long id) {
        LotPO po = lotDao.selectByIdForUpdate(id);
        return po == null ? null : toEntity(po);
    }

    @Override
    public LotEntity findByCode(String lotCode) {
        LotPO po = lotDao.selectByCode(lotCode);
        return po == null ? null : toEntity(po);
    }

    @Override
    public List<LotEntity> findByIds(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return Collections.emptyList();
        }
        return lotDao.selectByIds(ids).stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public List<LotEntity> findByRunId(Long runId) {
        return lotDao.selectByRunId(runId).stream().map(this::toEntity).collect(Collectors.toList());
    }

    @Override
    public List<LotEntity> findByRunIdAndStepIndex(Long runId, int stepIndex) {
        return lotDao.selectByRunIdAndStepIndex(runId, stepIndex).stream()
                .map(this::toEntity)
                .collect(Collectors.toList());
    }

    private LotEntity toEntity(LotPO po) {
        LotEntity entity = LotEntity.restore(po.getStatus(), po.getVersion());
        entity.setId(po.getId());
        entity.setLotCode(po.getLotCode());
        entity.setLotType(po.getLotType());
        entity.setStepIndex(po.getStepIndex());
        entity.setWeightKg(po.getWeightKg());
        entity.setTemperatureC(po.getTemperatureC());
        entity.setProductionRunId(po.getProductionRunId());
        entity.setOperatorId(po.getOperatorId());
        entity.setMetadata(jsonCodec.readMetadata(po.getMetadata()));
        entity.setCreatedAt(po.getCreatedAt());
        entity.setUpdatedAt(po.getUpdatedAt());
        return entity;
    }

    private LotPO toPO(LotEntity entity) {
        LotPO po = LotPO.builder()
                .id(entity.getId())
                .lotCode(entity.getLotCode())
                .lotType(entity.getLotType())
                .status(entity.getStatus())
                .stepIndex(entity.getStepIndex())
                .weightKg(entity.getWeightKg())
                .temperatureC(entity.getTemperatureC())
                .productionRunId(entity.getProductionRunId())
                .operatorId(entity.getOperatorId())
                .version(entity.getVersion())
                .createdAt(entity.getCreatedAt())
                .updatedAt(entity.getUpdatedAt())
                .build();
        po.setMetadata(jsonCodec.writeMetadata(entity.getMetadata()));
        return po;
    }
}
