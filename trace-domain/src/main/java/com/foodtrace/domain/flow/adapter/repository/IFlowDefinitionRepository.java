package com.foodtrace.domain.flow.adapter.repository;

import com.foodtrace.domain.flow.model.entity.FlowDefinitionEntity;

import java.util.List;

/**
 * Flow definition repository.
 */
public interface IFlowDefinitionRepository {

    FlowDefinitionEntity save(FlowDefinitionEntity entity);

    FlowDefinitionEntity findById(Long id);

    /**
     * Row-locks the definition until the transaction ends. Draft creation serialises on it.
     */
    FlowDefinitionEntity findByIdForUpdate(Long id);

    List<FlowDefinitionEntity> findAll();

    /**
     * Atomically increments the definition's version counter and returns the new value.
     *
     * @return the allocated version number, or null when the definition does not exist
     */
    Integer allocateNextVersionNum(Long definitionId);
}
