package com.foodtrace.domain.run.adapter.repository;

import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.types.enums.RunStatusEnum;

import java.util.List;

/**
 * Production run repository.
 */
public interface IProductionRunRepository {

    /**
     * Inserts the run unless a run with the same idempotency key exists.
     *
     * @return true when inserted (the entity id is then set), false when the key was already taken
     */
    boolean insertIfAbsent(ProductionRunEntity entity);

    /**
     * Optimistic update guarded by {@code version}.
     *
     * @throws com.foodtrace.types.exception.AppException with CONCURRENT_MODIFICATION when the version moved
     */
    ProductionRunEntity update(ProductionRunEntity entity);

    ProductionRunEntity findById(Long id);

    ProductionRunEntity findByIdForUpdate(Long id);

    ProductionRunEntity findByIdempotencyKey(String idempotencyKey);

    /**
     * @param status null for all runs
     */
    List<ProductionRunEntity> findByStatus(RunStatusEnum status);

    /**
     * Serializes run code allocation for one prefix until the surrounding transaction ends.
     */
    void lockRunCodeSequence(String runCodePrefix);

    String findMaxRunCodeByPrefix(String runCodePrefix);
}
