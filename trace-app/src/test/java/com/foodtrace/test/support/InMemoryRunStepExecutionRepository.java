package com.foodtrace.test.support;

import com.foodtrace.domain.run.adapter.repository.IRunStepExecutionRepository;
import com.foodtrace.domain.run.model.entity.RunStepExecutionEntity;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * In-memory step repository keyed by (run id, step index).
 */
public class InMemoryRunStepExecutionRepository implements IRunStepExecutionRepository {

    private final List<RunStepExecutionEntity> store = new ArrayList<>();
    private long nextId = 1;

    @Override
    public void saveAll(List<RunStepExecutionEntity> steps) {
        for (RunStepExecutionEntity step : steps) {
            if (find(step.getRunId(), step.getStepIndex()) != null) {
                throw new IllegalStateException("Duplicate step " + step.getRunId() + "/" + step.getStepIndex());
            }
            step.setId(nextId++);
            store.add(step);
        }
    }

    @Override
    public void update(RunStepExecutionEntity step) {
        RunStepExecutionEntity stored = find(step.getRunId(), step.getStepIndex());
        if (stored == null) {
            throw new IllegalStateException("Unknown step " + step.getRunId() + "/" + step.getStepIndex());
        }
        store.set(store.indexOf(stored), step);
    }

    @Override
    public List<RunStepExecutionEntity> findByRunId(Long runId) {
        return store.stream()
                .filter(item -> Objects.equals(runId, item.getRunId()))
                .sorted(Comparator.comparing(RunStepExecutionEntity::getStepIndex))
                .collect(Collectors.toList());
    }

    private RunStepExecutionEntity find(Long runId, Integer stepIndex) {
        return store.stream()
                .filter(item -> Objects.equals(runId, item.getRunId()) && Objects.equals(stepIndex, item.getStepIndex()))
                .findFirst()
                .orElse(null);
    }
}
