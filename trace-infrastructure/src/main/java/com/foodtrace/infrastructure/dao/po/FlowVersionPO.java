package com.foodtrace.infrastructure.dao.po;

import com.foodtrace.types.enums.FlowVersionStatusEnum;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * flow_versions row. {@code graph} is the jsonb document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowVersionPO {

    private Long id;
    private Long flowDefinitionId;
    private Integer versionNum;
    private FlowVersionStatusEnum status;
    private String graph;
    private String createdBy;
    private String reviewedBy;
    private LocalDateTime committedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
