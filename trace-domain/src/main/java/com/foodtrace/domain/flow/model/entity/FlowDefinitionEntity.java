package com.foodtrace.domain.flow.model.entity;

import lombok.Data;

import java.time.LocalDateTime;

/**
 * Flow definition: durable identity of a production process, owner of its versions.
 */
@Data
public class FlowDefinitionEntity {

    private Long id;
    private String name;
    private String description;
    private String createdBy;

    /**
     * Highest version number handed out so far. Only advanced by the repository's atomic increment.
     */
    private Integer latestVersionNum;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public void validate() {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalStateException("Flow definition name cannot be empty");
        }
        if (latestVersionNum == null || latestVersionNum < 0) {
            throw new IllegalStateException("Latest version number cannot be negative");
        }
    }
}
