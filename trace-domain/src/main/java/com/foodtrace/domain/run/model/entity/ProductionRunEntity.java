package com.foodtrace.domain.run.model.entity;

import com.foodtrace.types.enums.RunStatusEnum;
import com.foodtrace.types.exception.IllegalTransitionException;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Production run: one execution of a published flow version.
 */
@Data
public class ProductionRunEntity {

    private static final String ENTITY = "ProductionRun";

    private Long id;
    private String runCode;
    private RunStatusEnum status;

    /**
     * Pinned at creation, never reassigned.
     */
    private Long flowVersionId;

    /**
     * Monotonic, 0..totalSteps-1. Stays on the last step once the run completes.
     */
    private Integer currentStepIndex;

    private Integer totalSteps;
    private String startedBy;
    private String idempotencyKey;
    private String holdReason;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime endedAt;

    /**
     * Optimistic lock version.
     */
    private Integer version;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static ProductionRunEntity newRun(String runCode, Long flowVersionId, int totalSteps,
                                             String startedBy, String idempotencyKey) {
        ProductionRunEntity run = new ProductionRunEntity();
        run.setRunCode(runCode);
        run.setStatus(RunStatusEnum.IDLE);
        run.setFlowVersionId(flowVersionId);
        run.setCurrentStepIndex(0);
        run.setTotalSteps(totalSteps);
        run.setStartedBy(startedBy);
        run.setIdempotencyKey(idempotencyKey);
        run.setVersion(0);
        LocalDateTime now = LocalDateTime.now();
        run.setCreatedAt(now);
        run.setUpdatedAt(now);
        return run;
    }

    public void validate() {
        if (runCode == null || runCode.trim().isEmpty()) {
            throw new IllegalStateException("Run code cannot be empty");
        }
        if (flowVersionId == null) {
            throw new IllegalStateException("Flow version id cannot be null");
        }
        if (idempotencyKey == null || idempotencyKey.trim().isEmpty()) {
            throw new IllegalStateException("Idempotency key cannot be empty");
        }
        if (totalSteps == null || totalSteps < 1) {
            throw new IllegalStateException("Total steps must be greater than 0");
        }
        if (currentStepIndex == null || currentStepIndex < 0 || currentStepIndex >= totalSteps) {
            throw new IllegalStateException("Current step index out of range: " + currentStepIndex);
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
    }

    public boolean isLastStep() {
        return currentStepIndex != null && totalSteps != null && currentStepIndex == totalSteps - 1;
    }

    public void start() {
        transit(RunStatusEnum.RUNNING, RunStatusEnum.IDLE);
        this.startedAt = this.updatedAt;
    }

    public void hold(String reason) {
        transit(RunStatusEnum.HOLD, RunStatusEnum.RUNNING);
        this.holdReason = reason;
    }

    public void resume() {
        transit(RunStatusEnum.RUNNING, RunStatusEnum.HOLD);
        this.holdReason = null;
    }

    /**
     * Moves the pointer to the next step. Only valid while RUNNING and not on the last step.
     */
    public void moveToNextStep() {
        if (status != RunStatusEnum.RUNNING) {
            throw new IllegalStateException("Only running runs can move to the next step");
        }
        if (isLastStep()) {
            throw new IllegalStateException("Run is already on its last step");
        }
        this.currentStepIndex = currentStepIndex + 1;
        this.updatedAt = LocalDateTime.now();
    }

    /**
     * Last step completed.
     */
    public void complete() {
        transit(RunStatusEnum.COMPLETED, RunStatusEnum.RUNNING);
        this.completedAt = this.updatedAt;
        this.endedAt = this.updatedAt;
    }

    /**
     * Ended early but accepted.
     */
    public void finish() {
        transit(RunStatusEnum.COMPLETED, RunStatusEnum.RUNNING, RunStatusEnum.HOLD);
        this.completedAt = this.updatedAt;
        this.endedAt = this.updatedAt;
    }

    public void abort() {
        transit(RunStatusEnum.ABORTED, RunStatusEnum.IDLE, RunStatusEnum.RUNNING, RunStatusEnum.HOLD);
        this.endedAt = this.updatedAt;
    }

    public void archive() {
        transit(RunStatusEnum.ARCHIVED, RunStatusEnum.COMPLETED, RunStatusEnum.ABORTED);
    }

    public void incrementVersion() {
        this.version = version == null ? 1 : version + 1;
    }

    private void transit(RunStatusEnum target, RunStatusEnum... allowedSources) {
        for (RunStatusEnum source : allowedSources) {
            if (source == status) {
                this.status = target;
                this.updatedAt = LocalDateTime.now();
                return;
            }
        }
        throw new IllegalTransitionException(ENTITY, status, target);
    }
}
