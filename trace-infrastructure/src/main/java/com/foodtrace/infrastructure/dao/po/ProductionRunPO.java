package com.foodtrace.infrastructure.dao.po;

import com.foodtrace.types.enums.RunStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * production_runs row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProductionRunPO {

    private Long id;
    private String runCode;
    private RunStatusEnum status;
    private Long flowVersionId;
    private Integer currentStepIndex;
    private Integer totalSteps;
    private String startedBy;
    private String idempotencyKey;
    private String holdReason;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private LocalDateTime endedAt;
    private Integer version;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
