package com.foodtrace.trigger.application.command;

import com.foodtrace.domain.flow.adapter.repository.IFlowVersionRepository;
import com.foodtrace.domain.flow.model.entity.FlowVersionEntity;
import com.foodtrace.domain.flow.model.valobj.FlowNode;
import com.foodtrace.domain.flow.model.valobj.NodeConfig;
import com.foodtrace.domain.flow.service.FlowGraphPolicyService;
import com.foodtrace.domain.lot.adapter.repository.ILotRepository;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.qc.adapter.repository.IQcDecisionRepository;
import com.foodtrace.domain.qc.adapter.repository.IQcGateRepository;
import com.foodtrace.domain.qc.model.entity.QcDecisionEntity;
import com.foodtrace.domain.qc.model.entity.QcGateEntity;
import com.foodtrace.domain.qc.service.QcDecisionPolicyDomainService;
import com.foodtrace.domain.run.adapter.repository.IProductionRunRepository;
import com.foodtrace.domain.run.adapter.repository.IRunStepExecutionRepository;
import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.domain.run.model.entity.RunStepExecutionEntity;
import com.foodtrace.domain.run.service.RunCodeDomainService;
import com.foodtrace.domain.run.service.RunProgressionDomainService;
import com.foodtrace.types.enums.FlowVersionStatusEnum;
import com.foodtrace.types.enums.RunStatusEnum;
import com.foodtrace.types.exception.ResourceNotFoundException;
import com.foodtrace.types.exception.StepBlockedException;
import com.foodtrace.types.exception.StepOutOfOrderException;
import com.foodtrace.types.exception.VersionNotPublishedException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Production run lifecycle: creation from a published version, step progression, hold, resume
 * and the terminal transitions.
 * <p>
 * Mutations lock the run row and write back through the optimistic version check.
 * </p>
 */
@Slf4j
@Service
public class RunExecutionApplicationService {

    private static final String RUN = "ProductionRun";

    private final IProductionRunRepository productionRunRepository;
    private final IRunStepExecutionRepository runStepExecutionRepository;
    private final IFlowVersionRepository flowVersionRepository;
    private final ILotRepository lotRepository;
    private final IQcDecisionRepository qcDecisionRepository;
    private final IQcGateRepository qcGateRepository;
    private final FlowGraphPolicyService flowGraphPolicyService;
    private final RunProgressionDomainService runProgressionDomainService;
    private final RunCodeDomainService runCodeDomainService;
    private final QcDecisionPolicyDomainService qcDecisionPolicyDomainService;

    @Value("${trace.run.site-code:DUNA}")
    private String siteCode;

    public RunExecutionApplicationService(IProductionRunRepository productionRunRepository,
                                          IRunStepExecutionRepository runStepExecutionRepository,
                                          IFlowVersionRepository flowVersionRepository,
                                          ILotRepository lotRepository,
                                          IQcDecisionRepository qcDecisionRepository,
                                          IQcGateRepository qcGateRepository,
                                          FlowGraphPolicyService flowGraphPolicyService,
                                          RunProgressionDomainService runProgressionDomainService,
                                          RunCodeDomainService runCodeDomainService,
                                          QcDecisionPolicyDomainService qcDecisionPolicyDomainService) {
        this.productionRunRepository = productionRunRepository;
        this.runStepExecutionRepository = runStepExecutionRepository;
        this.flowVersionRepository = flowVersionRepository;
        this.lotRepository = lotRepository;
        this.qcDecisionRepository = qcDecisionRepository;
        this.qcGateRepository = qcGateRepository;
        this.flowGraphPolicyService = flowGraphPolicyService;
        this.runProgressionDomainService = runProgressionDomainService;
        this.runCodeDomainService = runCodeDomainService;
        this.qcDecisionPolicyDomainService = qcDecisionPolicyDomainService;
    }

    /**
     * Creates an IDLE run pinned to a published version, with one PENDING step per canonical node.
     * A repeated idempotency key returns the stored run unchanged.
     *
     * @throws VersionNotPublishedException when the version is not PUBLISHED
     */
    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity createRun(Long flowVersionId, String idempotencyKey, String startedBy) {
        if (StringUtils.isBlank(idempotencyKey)) {
            throw new IllegalArgumentException("Idempotency key cannot be blank");
        }
        ProductionRunEntity existing = productionRunRepository.findByIdempotencyKey(idempotencyKey);
        if (existing != null) {
            log.info("Run creation replayed. idempotencyKey={}, runId={}", idempotencyKey, existing.getId());
            return existing;
        }

        FlowVersionEntity version = flowVersionId == null ? null : flowVersionRepository.findById(flowVersionId);
        if (version == null) {
            throw new ResourceNotFoundException("FlowVersion", flowVersionId);
        }
        if (version.getStatus() != FlowVersionStatusEnum.PUBLISHED) {
            throw new VersionNotPublishedException(flowVersionId, version.getStatus().name());
        }
        List<FlowNode> canonicalSteps = flowGraphPolicyService.canonicalSteps(version.getGraph());

        String prefix = runCodeDomainService.prefix(LocalDate.now(), siteCode);
        productionRunRepository.lockRunCodeSequence(prefix);
        int sequence = runCodeDomainService.nextSequence(prefix, productionRunRepository.findMaxRunCodeByPrefix(prefix));
        String runCode = runCodeDomainService.format(prefix, sequence);

        ProductionRunEntity run = ProductionRunEntity.newRun(runCode, flowVersionId, canonicalSteps.size(),
                startedBy, idempotencyKey);
        run.validate();
        if (!productionRunRepository.insertIfAbsent(run)) {
            ProductionRunEntity winner = productionRunRepository.findByIdempotencyKey(idempotencyKey);
            log.info("Run creation lost idempotency race. idempotencyKey={}, runId={}", idempotencyKey,
                    winner == null ? null : winner.getId());
            return winner;
        }
        runStepExecutionRepository.saveAll(runProgressionDomainService.instantiateSteps(run.getId(), canonicalSteps));
        log.info("Run created. runId={}, runCode={}, flowVersionId={}, totalSteps={}, startedBy={}",
                run.getId(), runCode, flowVersionId, run.getTotalSteps(), startedBy);
        return run;
    }

    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity start(Long runId) {
        ProductionRunEntity run = requireRun(runId, true);
        List<RunStepExecutionEntity> steps = runStepExecutionRepository.findByRunId(runId);
        List<RunStepExecutionEntity> changed = runProgressionDomainService.start(run, steps);
        changed.forEach(runStepExecutionRepository::update);
        productionRunRepository.update(run);
        log.info("Run started. runId={}, runCode={}", runId, run.getRunCode());
        return run;
    }

    /**
     * Completes the current step and moves on, completing the run on the last step.
     *
     * @param fromStepIndex step the caller means to complete; null means the current one. When that step
     *                      is already COMPLETED the call returns the run unchanged.
     * @throws StepOutOfOrderException when the run is not RUNNING or {@code fromStepIndex} is not current
     * @throws StepBlockedException    when a lot at the current step is held by a blocking gate
     */
    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity advanceStep(Long runId, String operatorId, Integer fromStepIndex) {
        ProductionRunEntity run = requireRun(runId, true);
        List<RunStepExecutionEntity> steps = runStepExecutionRepository.findByRunId(runId);
        int requested = fromStepIndex == null ? run.getCurrentStepIndex() : fromStepIndex;
        if (runProgressionDomainService.isStepCompleted(steps, requested)) {
            log.info("Step already completed, advance ignored. runId={}, stepIndex={}", runId, requested);
            return run;
        }
        if (run.getStatus() != RunStatusEnum.RUNNING) {
            throw new StepOutOfOrderException("Run " + runId + " is " + run.getStatus() + ", steps advance only while RUNNING");
        }
        if (requested != run.getCurrentStepIndex()) {
            throw new StepOutOfOrderException("Run " + runId + " is at step " + run.getCurrentStepIndex()
                    + ", cannot complete step " + requested);
        }
        List<String> blockingLots = findBlockingLotCodes(run);
        if (!blockingLots.isEmpty()) {
            log.warn("Step advance blocked by QC. runId={}, stepIndex={}, lots={}", runId,
                    run.getCurrentStepIndex(), blockingLots);
            throw new StepBlockedException(runId, run.getCurrentStepIndex(), blockingLots);
        }

        List<RunStepExecutionEntity> changed = runProgressionDomainService.advance(run, steps, operatorId);
        changed.forEach(runStepExecutionRepository::update);
        productionRunRepository.update(run);
        log.info("Run step completed. runId={}, completedStep={}, currentStep={}, status={}, operatorId={}",
                runId, requested, run.getCurrentStepIndex(), run.getStatus(), operatorId);
        return run;
    }

    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity hold(Long runId, String reason) {
        if (StringUtils.isBlank(reason)) {
            throw new IllegalArgumentException("Hold reason cannot be blank");
        }
        ProductionRunEntity run = requireRun(runId, true);
        run.hold(reason.trim());
        productionRunRepository.update(run);
        log.info("Run put on hold. runId={}, reason={}", runId, run.getHoldReason());
        return run;
    }

    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity resume(Long runId) {
        ProductionRunEntity run = requireRun(runId, true);
        run.resume();
        productionRunRepository.update(run);
        log.info("Run resumed. runId={}, currentStep={}", runId, run.getCurrentStepIndex());
        return run;
    }

    /**
     * Ends the run as ABORTED; every step not yet COMPLETED becomes SKIPPED.
     */
    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity abort(Long runId) {
        ProductionRunEntity run = requireRun(runId, true);
        run.abort();
        int skipped = skipOpenSteps(runId);
        productionRunRepository.update(run);
        log.info("Run aborted. runId={}, skippedSteps={}", runId, skipped);
        return run;
    }

    /**
     * Ends the run early as COMPLETED; every step not yet COMPLETED becomes SKIPPED.
     */
    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity finish(Long runId) {
        ProductionRunEntity run = requireRun(runId, true);
        run.finish();
        int skipped = skipOpenSteps(runId);
        productionRunRepository.update(run);
        log.info("Run finished. runId={}, skippedSteps={}", runId, skipped);
        return run;
    }

    @Transactional(rollbackFor = Exception.class)
    public ProductionRunEntity archive(Long runId) {
        ProductionRunEntity run = requireRun(runId, true);
        run.archive();
        productionRunRepository.update(run);
        log.info("Run archived. runId={}", runId);
        return run;
    }

    public ProductionRunEntity getRun(Long runId) {
        return requireRun(runId, false);
    }

    /**
     * @param status null lists every run
     */
    public List<ProductionRunEntity> listRuns(RunStatusEnum status) {
        return productionRunRepository.findByStatus(status);
    }

    public List<RunStepExecutionEntity> listSteps(Long runId) {
        requireRun(runId, false);
        return runStepExecutionRepository.findByRunId(runId);
    }

    private int skipOpenSteps(Long runId) {
        List<RunStepExecutionEntity> changed =
                runProgressionDomainService.skipOpenSteps(runStepExecutionRepository.findByRunId(runId));
        changed.forEach(runStepExecutionRepository::update);
        return changed.size();
    }

    private List<String> findBlockingLotCodes(ProductionRunEntity run) {
        List<LotEntity> lots = lotRepository.findByRunIdAndStepIndex(run.getId(), run.getCurrentStepIndex());
        if (lots.isEmpty()) {
            return List.of();
        }
        List<QcDecisionEntity> decisions = qcDecisionRepository.findByLotIds(
                lots.stream().map(LotEntity::getId).collect(Collectors.toList()));
        List<Long> gateIds = qcDecisionPolicyDomainService.gateIdsOf(decisions);
        Map<Long, QcGateEntity> gatesById = gateIds.isEmpty() ? Map.of()
                : qcGateRepository.findByIds(gateIds).stream()
                .collect(Collectors.toMap(QcGateEntity::getId, Function.identity()));
        NodeConfig.QcGate stepGate = qcDecisionPolicyDomainService.stepGateConfig(
                canonicalStepsOf(run.getFlowVersionId()), run.getCurrentStepIndex());
        return qcDecisionPolicyDomainService.findBlockedLots(lots, decisions, gatesById, stepGate).stream()
                .map(LotEntity::getLotCode)
                .collect(Collectors.toList());
    }

    private List<FlowNode> canonicalStepsOf(Long flowVersionId) {
        FlowVersionEntity version = flowVersionId == null ? null : flowVersionRepository.findById(flowVersionId);
        return version == null ? List.of() : flowGraphPolicyService.canonicalSteps(version.getGraph());
    }

    private ProductionRunEntity requireRun(Long runId, boolean forUpdate) {
        ProductionRunEntity run = null;
        if (runId != null) {
            run = forUpdate ? productionRunRepository.findByIdForUpdate(runId) : productionRunRepository.findById(runId);
        }
        if (run == null) {
            throw new ResourceNotFoundException(RUN, runId);
        }
        return run;
    }
}
