package com.foodtrace.infrastructure.dao.po;

import com.foodtrace.types.enums.RunStepStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * run_step_executions row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RunStepExecutionPO {

    private Long id;
    private Long runId;
    private Integer stepIndex;
    private String nodeId;
    private RunStepStatusEnum status;
    private LocalDateTime startedAt;
    private LocalDateTime completedAt;
    private String operatorId;
}
