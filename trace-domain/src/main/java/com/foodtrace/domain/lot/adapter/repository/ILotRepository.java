package com.foodtrace.domain.lot.adapter.repository;

import com.foodtrace.domain.lot.model.entity.LotEntity;

import java.util.Collection;
import java.util.List;

/**
 * Lot repository.
 */
public interface ILotRepository {

    LotEntity save(LotEntity entity);

    /**
     * Optimistic update guarded by {@code version}.
     */
    LotEntity update(LotEntity entity);

    LotEntity findById(Long id);

    LotEntity findByIdForUpdate(Long id);

    LotEntity findByCode(String lotCode);

    List<LotEntity> findByIds(Collection<Long> ids);

    List<LotEntity> findByRunId(Long runId);

    List<LotEntity> findByRunIdAndStepIndex(Long runId, int stepIndex);
}
