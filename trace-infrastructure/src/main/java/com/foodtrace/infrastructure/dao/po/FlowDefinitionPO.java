package com.foodtrace.infrastructure.dao.po;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * flow_definitions row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FlowDefinitionPO {

    private Long id;
    private String name;
    private String description;
    private String createdBy;
    private Integer latestVersionNum;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
