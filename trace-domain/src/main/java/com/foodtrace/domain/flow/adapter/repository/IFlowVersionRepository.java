package com.foodtrace.domain.flow.adapter.repository;

import com.foodtrace.domain.flow.model.entity.FlowVersionEntity;

import java.util.List;

/**
 * Flow version repository.
 */
public interface IFlowVersionRepository {

    FlowVersionEntity save(FlowVersionEntity entity);

    /**
     * Persists status, reviewer and commit time. Never writes the graph.
     */
    FlowVersionEntity updateStatus(FlowVersionEntity entity);

    /**
     * Persists the graph only while the stored row is still DRAFT.
     *
     * @throws com.foodtrace.types.exception.ImmutableVersionException when the stored row is PUBLISHED or DEPRECATED
     * @throws com.foodtrace.types.exception.NotDraftException          when the stored row is in REVIEW
     */
    FlowVersionEntity updateGraph(FlowVersionEntity entity);

    FlowVersionEntity findById(Long id);

    FlowVersionEntity findByIdForUpdate(Long id);

    List<FlowVersionEntity> findByDefinitionId(Long definitionId);

    /**
     * The definition's open draft: the version in DRAFT or REVIEW, if any.
     */
    FlowVersionEntity findOpenDraftByDefinitionId(Long definitionId);

    /**
     * The current published version: the PUBLISHED one with the highest version number.
     */
    FlowVersionEntity findLatestPublishedByDefinitionId(Long definitionId);
}
