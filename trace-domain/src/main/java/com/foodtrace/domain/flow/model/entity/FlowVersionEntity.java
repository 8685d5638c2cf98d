package com.foodtrace.domain.flow.model.entity;

import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.types.enums.FlowVersionStatusEnum;
import com.foodtrace.types.exception.IllegalTransitionException;
import com.foodtrace.types.exception.ImmutableVersionException;
import com.foodtrace.types.exception.NotDraftException;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * Flow version: one point-in-time graph document of a definition.
 * <p>
 * Status moves DRAFT -> REVIEW -> PUBLISHED -> DEPRECATED; REVIEW may return to DRAFT and
 * DRAFT/REVIEW may be abandoned straight to DEPRECATED. The graph can only be replaced while DRAFT.
 * </p>
 */
@Data
public class FlowVersionEntity {

    private static final String ENTITY = "FlowVersion";

    private Long id;
    private Long flowDefinitionId;
    private Integer versionNum;
    private FlowVersionStatusEnum status;
    private FlowGraph graph;
    private String createdBy;
    private String reviewedBy;
    private LocalDateTime committedAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;

    public static FlowVersionEntity newDraft(Long flowDefinitionId, Integer versionNum, FlowGraph graph, String createdBy) {
        FlowVersionEntity entity = new FlowVersionEntity();
        entity.setFlowDefinitionId(flowDefinitionId);
        entity.setVersionNum(versionNum);
        entity.setStatus(FlowVersionStatusEnum.DRAFT);
        entity.setGraph(graph == null ? FlowGraph.empty() : graph);
        entity.setCreatedBy(createdBy);
        LocalDateTime now = LocalDateTime.now();
        entity.setCreatedAt(now);
        entity.setUpdatedAt(now);
        return entity;
    }

    public void validate() {
        if (flowDefinitionId == null) {
            throw new IllegalStateException("Flow definition id cannot be null");
        }
        if (versionNum == null || versionNum < 1) {
            throw new IllegalStateException("Version number must be greater than 0");
        }
        if (status == null) {
            throw new IllegalStateException("Status cannot be null");
        }
        if (graph == null) {
            throw new IllegalStateException("Graph cannot be null");
        }
    }

    public boolean isDraft() {
        return status == FlowVersionStatusEnum.DRAFT;
    }

    /**
     * Replaces the graph wholesale.
     *
     * @throws ImmutableVersionException when PUBLISHED or DEPRECATED
     * @throws NotDraftException         when in REVIEW
     */
    public void replaceGraph(FlowGraph newGraph) {
        assertGraphWritable();
        this.graph = newGraph == null ? FlowGraph.empty() : newGraph;
        this.updatedAt = LocalDateTime.now();
    }

    public void assertGraphWritable() {
        if (status != null && status.isImmutable()) {
            throw new ImmutableVersionException(id, status.name());
        }
        if (status != FlowVersionStatusEnum.DRAFT) {
            throw new NotDraftException(id, status == null ? null : status.name());
        }
    }

    public void requestReview() {
        transit(FlowVersionStatusEnum.REVIEW, FlowVersionStatusEnum.DRAFT);
    }

    public void returnToDraft() {
        transit(FlowVersionStatusEnum.DRAFT, FlowVersionStatusEnum.REVIEW);
    }

    public void publish(String reviewer) {
        transit(FlowVersionStatusEnum.PUBLISHED, FlowVersionStatusEnum.DRAFT, FlowVersionStatusEnum.REVIEW);
        this.reviewedBy = reviewer;
        this.committedAt = this.updatedAt;
    }

    public void deprecate() {
        transit(FlowVersionStatusEnum.DEPRECATED,
                FlowVersionStatusEnum.DRAFT, FlowVersionStatusEnum.REVIEW, FlowVersionStatusEnum.PUBLISHED);
    }

    private void transit(FlowVersionStatusEnum target, FlowVersionStatusEnum... allowedSources) {
        for (FlowVersionStatusEnum source : allowedSources) {
            if (source == status) {
                this.status = target;
                this.updatedAt = LocalDateTime.now();
                return;
            }
        }
        throw new IllegalTransitionException(ENTITY, status, target);
    }
}
