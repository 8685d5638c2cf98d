package com.foodtrace.domain.run.model.entity;

import com.foodtrace.types.enums.RunStepStatusEnum;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Execution record of one canonical step of a run.
 */
@Data
public class RunStepExecutionEntity {

    private Long id;
    private Long runId;
    private Integer stepIndex;
    private String nodeId;
    private RunStepStatusEnum status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String operatorId;

    public static RunStepExecutionEntity pending(Long runId, int stepIndex, String nodeId) {
        RunStepExecutionEntity step = new RunStepExecutionEntity();
        step.setRunId(runId);
        step.setStepIndex(stepIndex);
        step.setNodeId(nodeId);
        step.setStatus(RunStepStatusEnum.PENDING);
        return step;
    }

    public void begin() {
        if (status != RunStepStatusEnum.PENDING) {
            throw new IllegalStateException("Step " + stepIndex + " must be PENDING to begin, was " + status);
        }
        this.status = RunStepStatusEnum.IN_PROGRESS;
        this.startedAt = LocalDateTime.now();
    }

    public void complete(String operator) {
        if (status != RunStepStatusEnum.IN_PROGRESS && status != RunStepStatusEnum.PENDING) {
            throw new IllegalStateException("Step " + stepIndex + " cannot be completed from " + status);
        }
        LocalDateTime now = LocalDateTime.now();
        if (startedAt == null) {
            this.startedAt = now;
        }
        this.status = RunStepStatusEnum.COMPLETED;
        this.completedAt = now;
        this.operatorId = operator;
    }

    /**
     * Marks the step SKIPPED unless already completed.
     *
     * @return true when the status changed
     */
    public boolean skipIfOpen() {
        if (status == RunStepStatusEnum.COMPLETED || status == RunStepStatusEnum.SKIPPED) {
            return false;
        }
        this.status = RunStepStatusEnum.SKIPPED;
        return true;
    }
}
