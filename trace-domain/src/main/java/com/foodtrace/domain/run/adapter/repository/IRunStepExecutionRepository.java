package com.foodtrace.domain.run.adapter.repository;

import com.foodtrace.domain.run.model.entity.RunStepExecutionEntity;

import java.util.List;

public interface IRunStepExecutionRepository {

    void saveAll(List<RunStepExecutionEntity> steps);

    void update(RunStepExecutionEntity step);

    /**
     * Steps of a run ordered by step index.
     */
    List<RunStepExecutionEntity> findByRunId(Long runId);
}
