package com.foodtrace.infrastructure.repository.run;

import com.foodtrace.domain.run.adapter.repository.IRunStepExecutionRepository;
import com.foodtrace.domain.run.model.entity.RunStepExecutionEntity;
import com.foodtrace.infrastructure.dao.RunStepExecutionDao;
import com.foodtrace.infrastructure.dao.po.RunStepExecutionPO;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.stream.Collectors;

@Repository
public class RunStepExecutionRepositoryImpl implements IRunStepExecutionRepository {

    private final RunStepExecutionDao runStepExecutionDao;

    public RunStepExecutionRepositoryImpl(RunStepExecutionDao runStepExecutionDao) {
        this.runStepExecutionDao = runStepExecutionDao;
    }

    @Override
    public void saveAll(List<RunStepExecutionEntity> steps) {
        if (steps == null || steps.isEmpty()) {
            return;
        }
        runStepExecutionDao.batchInsert(steps.stream().map(this::toPO).collect(Collectors.toList()));
    }

    @Override
    public void update(RunStepExecutionEntity step) {
        runStepExecutionDao.update(toPO(step));
    }

    @Override
    public List<RunStepExecutionEntity> findByRunId(Long runId) {
        return runStepExecutionDao.selectByRunId(runId).stream().map(this::toEntity).collect(Collectors.toList());
    }

    private RunStepExecutionEntity toEntity(RunStepExecutionPO po) {
        RunStepExecutionEntity entity = new RunStepExecutionEntity();
        entity.setId(po.getId());
        entity.setRunId(po.getRunId());
        entity.setStepIndex(po.getStepIndex());
        entity.setNodeId(po.getNodeId());
        entity.setStatus(po.getStatus());
        entity.setStartedAt(po.getStartedAt());
        entity.setCompletedAt(po.getCompletedAt());
        entity.setOperatorId(po.getOperatorId());
        return entity;
    }

    private RunStepExecutionPO toPO(RunStepExecutionEntity entity) {
        return RunStepExecutionPO.builder()
                .id(entity.getId())
                .runId(entity.getRunId())
                .stepIndex(entity.getStepIndex())
                .nodeId(entity.getNodeId())
                .status(entity.getStatus())
                .startedAt(entity.getStartedAt())
                .completedAt(entity.getCompletedAt())
                .operatorId(entity.getOperatorId())
                .build();
    }
}
