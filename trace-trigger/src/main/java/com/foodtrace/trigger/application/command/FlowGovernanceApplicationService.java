package com.foodtrace.trigger.application.command;

import com.foodtrace.domain.flow.adapter.repository.IFlowDefinitionRepository;
import com.foodtrace.domain.flow.adapter.repository.IFlowVersionRepository;
import com.foodtrace.domain.flow.model.entity.FlowDefinitionEntity;
import com.foodtrace.domain.flow.model.entity.FlowVersionEntity;
import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.flow.service.FlowGraphPolicyService;
import com.foodtrace.types.common.GraphValidationIssue;
import com.foodtrace.types.enums.FlowVersionStatusEnum;
import com.foodtrace.types.exception.DraftConflictException;
import com.foodtrace.types.exception.GraphInvalidException;
import com.foodtrace.types.exception.IllegalTransitionException;
import com.foodtrace.types.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Flow version governance: draft editing, review, publish and deprecation.
 * <p>
 * Every mutation locks the version row first, so validate-then-write is one unit. Version numbers
 * come from the definition's atomic counter, never from {@code max + 1}.
 * </p>
 */
@Slf4j
@Service
public class FlowGovernanceApplicationService {

    private static final String VERSION = "FlowVersion";

    private final IFlowDefinitionRepository flowDefinitionRepository;
    private final IFlowVersionRepository flowVersionRepository;
    private final FlowGraphPolicyService flowGraphPolicyService;

    public FlowGovernanceApplicationService(IFlowDefinitionRepository flowDefinitionRepository,
                                            IFlowVersionRepository flowVersionRepository,
                                            FlowGraphPolicyService flowGraphPolicyService) {
        this.flowDefinitionRepository = flowDefinitionRepository;
        this.flowVersionRepository = flowVersionRepository;
        this.flowGraphPolicyService = flowGraphPolicyService;
    }

    /**
     * Creates a definition together with its first (empty) draft, version 1.
     */
    @Transactional(rollbackFor = Exception.class)
    public FlowDefinitionEntity createDefinition(String name, String description, String createdBy) {
        if (StringUtils.isBlank(name)) {
            throw new IllegalArgumentException("Flow definition name cannot be blank");
        }
        FlowDefinitionEntity definition = new FlowDefinitionEntity();
        definition.setName(name.trim());
        definition.setDescription(description);
        definition.setCreatedBy(createdBy);
        definition.setLatestVersionNum(0);
        LocalDateTime now = LocalDateTime.now();
        definition.setCreatedAt(now);
        definition.setUpdatedAt(now);
        flowDefinitionRepository.save(definition);

        FlowVersionEntity draft = insertDraft(definition.getId(), FlowGraph.empty(), createdBy);
        definition.setLatestVersionNum(draft.getVersionNum());
        log.info("Flow definition created. definitionId={}, name={}, draftId={}",
                definition.getId(), definition.getName(), draft.getId());
        return definition;
    }

    /**
     * New DRAFT with the next version number. Concurrent calls for one definition queue on the
     * definition row, so the loser sees the winner's draft.
     *
     * @throws DraftConflictException when the definition already has a version in DRAFT or REVIEW
     */
    @Transactional(rollbackFor = Exception.class)
    public FlowVersionEntity createDraft(Long definitionId, FlowGraph graph, String createdBy) {
        requireDefinition(definitionId, true);
        FlowVersionEntity open = flowVersionRepository.findOpenDraftByDefinitionId(definitionId);
        if (open != null) {
            throw new DraftConflictException(definitionId, open.getId());
        }
        FlowVersionEntity draft = insertDraft(definitionId, graph, createdBy);
        log.info("Flow draft created. definitionId={}, versionId={}, versionNum={}",
                definitionId, draft.getId(), draft.getVersionNum());
        return draft;
    }

    /**
     * {@link #createDraft} seeded with the graph of any existing version.
     */
    @Transactional(rollbackFor = Exception.class)
    public FlowVersionEntity forkVersion(Long versionId, String createdBy) {
        FlowVersionEntity source = requireVersion(versionId, false);
        return createDraft(source.getFlowDefinitionId(), source.getGraph(), createdBy);
    }

    /**
     * Replaces the draft graph wholesale; last writer wins.
     */
    @Transactional(rollbackFor = Exception.class)
    public FlowVersionEntity saveDraft(Long versionId, FlowGraph graph) {
        FlowVersionEntity version = requireVersion(versionId, true);
        try {
            version.replaceGraph(graph);
        } catch (RuntimeException ex) {
            log.warn("Draft save rejected. versionId={}, status={}", versionId, version.getStatus());
            throw ex;
        }
        flowVersionRepository.updateGraph(version);
        log.debug("Draft saved. versionId={}, nodes={}, edges={}", versionId,
                version.getGraph().getNodes().size(), version.getGraph().getEdges().size());
        return version;
    }

    @Transactional(rollbackFor = Exception.class)
    public FlowVersionEntity requestReview(Long versionId) {
        FlowVersionEntity version = requireVersion(versionId, true);
        version.requestReview();
        flowVersionRepository.updateStatus(version);
        log.info("Flow version sent to review. versionId={}", versionId);
        return version;
    }

    @Transactional(rollbackFor = Exception.class)
    public FlowVersionEntity returnToDraft(Long versionId) {
        FlowVersionEntity version = requireVersion(versionId, true);
        version.returnToDraft();
        flowVersionRepository.updateStatus(version);
        log.info("Flow version returned to draft. versionId={}", versionId);
        return version;
    }

    /**
     * Validates and freezes the version, then opens the next draft seeded with the same graph.
     *
     * @throws GraphInvalidException with every issue found; nothing is changed
     */
    @Transactional(rollbackFor = Exception.class)
    public FlowVersionEntity publish(Long versionId, String reviewedBy) {
        FlowVersionEntity version = requireVersion(versionId, true);
        if (version.getStatus() != FlowVersionStatusEnum.DRAFT && version.getStatus() != FlowVersionStatusEnum.REVIEW) {
            throw new IllegalTransitionException(VERSION, version.getStatus(), FlowVersionStatusEnum.PUBLISHED);
        }
        List<GraphValidationIssue> issues = flowGraphPolicyService.validate(version.getGraph());
        if (!issues.isEmpty()) {
            log.warn("Publish rejected, graph invalid. versionId={}, issueCount={}", versionId, issues.size());
            throw new GraphInvalidException(issues);
        }
        version.publish(reviewedBy);
        flowVersionRepository.updateStatus(version);

        FlowVersionEntity nextDraft = insertDraft(version.getFlowDefinitionId(), version.getGraph(), reviewedBy);
        log.info("Flow version published. versionId={}, versionNum={}, reviewedBy={}, nextDraftId={}, nextVersionNum={}",
                versionId, version.getVersionNum(), reviewedBy, nextDraft.getId(), nextDraft.getVersionNum());
        return version;
    }

    /**
     * PUBLISHED, DRAFT or REVIEW to DEPRECATED. Terminal.
     */
    @Transactional(rollbackFor = Exception.class)
    public FlowVersionEntity deprecate(Long versionId) {
        FlowVersionEntity version = requireVersion(versionId, true);
        FlowVersionStatusEnum previous = version.getStatus();
        version.deprecate();
        flowVersionRepository.updateStatus(version);
        log.info("Flow version deprecated. versionId={}, previousStatus={}", versionId, previous);
        return version;
    }

    public FlowVersionEntity get(Long versionId) {
        return requireVersion(versionId, false);
    }

    public List<FlowVersionEntity> listVersions(Long definitionId) {
        requireDefinition(definitionId, false);
        return flowVersionRepository.findByDefinitionId(definitionId);
    }

    /**
     * The open draft (DRAFT or REVIEW), or null.
     */
    public FlowVersionEntity findLatestDraft(Long definitionId) {
        return flowVersionRepository.findOpenDraftByDefinitionId(definitionId);
    }

    /**
     * The current published version, or null when nothing has been published yet.
     */
    public FlowVersionEntity findCurrentPublished(Long definitionId) {
        return flowVersionRepository.findLatestPublishedByDefinitionId(definitionId);
    }

    public List<FlowDefinitionEntity> listDefinitions() {
        return flowDefinitionRepository.findAll();
    }

    private FlowVersionEntity insertDraft(Long definitionId, FlowGraph graph, String createdBy) {
        Integer versionNum = flowDefinitionRepository.allocateNextVersionNum(definitionId);
        if (versionNum == null) {
            throw new ResourceNotFoundException("FlowDefinition", definitionId);
        }
        FlowVersionEntity draft = FlowVersionEntity.newDraft(definitionId, versionNum, graph, createdBy);
        return flowVersionRepository.save(draft);
    }

    private FlowDefinitionEntity requireDefinition(Long definitionId, boolean forUpdate) {
        FlowDefinitionEntity definition = null;
        if (definitionId != null) {
            definition = forUpdate ? flowDefinitionRepository.findByIdForUpdate(definitionId)
                    : flowDefinitionRepository.findById(definitionId);
        }
        if (definition == null) {
            throw new ResourceNotFoundException("FlowDefinition", definitionId);
        }
        return definition;
    }

    private FlowVersionEntity requireVersion(Long versionId, boolean forUpdate) {
        FlowVersionEntity version = null;
        if (versionId != null) {
            version = forUpdate ? flowVersionRepository.findByIdForUpdate(versionId) : flowVersionRepository.findById(versionId);
        }
        if (version == null) {
            throw new ResourceNotFoundException(VERSION, versionId);
        }
        return version;
    }
}
