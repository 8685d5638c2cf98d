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
import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.trigger.application.query.GenealogyQueryService;
import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.QcDecisionEnum;
import com.foodtrace.types.enums.QcGateTypeEnum;
import com.foodtrace.types.enums.RunStatusEnum;
import com.foodtrace.types.exception.NotesRequiredException;
import com.foodtrace.types.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * QC decisions and the gates they are recorded against.
 */
@Slf4j
@Service
public class QcDecisionApplicationService {

    private final IQcDecisionRepository qcDecisionRepository;
    private final IQcGateRepository qcGateRepository;
    private final ILotRepository lotRepository;
    private final IProductionRunRepository productionRunRepository;
    private final IFlowVersionRepository flowVersionRepository;
    private final FlowGraphPolicyService flowGraphPolicyService;
    private final QcDecisionPolicyDomainService qcDecisionPolicyDomainService;
    private final GenealogyQueryService genealogyQueryService;

    public QcDecisionApplicationService(IQcDecisionRepository qcDecisionRepository,
                                        IQcGateRepository qcGateRepository,
                                        ILotRepository lotRepository,
                                        IProductionRunRepository productionRunRepository,
                                        IFlowVersionRepository flowVersionRepository,
                                        FlowGraphPolicyService flowGraphPolicyService,
                                        QcDecisionPolicyDomainService qcDecisionPolicyDomainService,
                                        GenealogyQueryService genealogyQueryService) {
        this.qcDecisionRepository = qcDecisionRepository;
        this.qcGateRepository = qcGateRepository;
        this.lotRepository = lotRepository;
        this.productionRunRepository = productionRunRepository;
        this.flowVersionRepository = flowVersionRepository;
        this.flowGraphPolicyService = flowGraphPolicyService;
        this.qcDecisionPolicyDomainService = qcDecisionPolicyDomainService;
        this.genealogyQueryService = genealogyQueryService;
    }

    /**
     * @param qcGateId null for an inspection outside a registered gate
     */
    public record RecordDecisionCommand(Long lotId,
                                        Long qcGateId,
                                        String operatorId,
                                        QcDecisionEnum decision,
                                        String notes,
                                        BigDecimal temperatureC,
                                        String signature) {
    }

    /**
     * Records the decision and moves the lot accordingly. A non-PASS from a blocking gate on a lot at
     * the current step of a RUNNING run also puts that run on HOLD.
     * <p>
     * The owning run is locked before the lot, the same order step advances use, so an advance
     * cannot slip past a decision still being recorded.
     * </p>
     *
     * @throws NotesRequiredException when HOLD or FAIL comes without sufficient notes
     * @throws com.foodtrace.types.exception.IllegalTransitionException when the lot cannot take the
     *         decision's status; nothing is recorded then
     */
    @Transactional(rollbackFor = Exception.class)
    public QcDecisionEntity recordDecision(RecordDecisionCommand command) {
        if (command == null || command.decision() == null) {
            throw new IllegalArgumentException("QC decision cannot be null");
        }
        qcDecisionPolicyDomainService.checkNotes(command.decision(), command.notes());
        qcDecisionPolicyDomainService.checkTemperature(command.temperatureC());

        LotEntity target = command.lotId() == null ? null : lotRepository.findById(command.lotId());
        if (target == null) {
            throw new ResourceNotFoundException("Lot", command.lotId());
        }
        ProductionRunEntity run = target.getProductionRunId() == null ? null
                : productionRunRepository.findByIdForUpdate(target.getProductionRunId());
        LotEntity lot = lotRepository.findByIdForUpdate(target.getId());
        QcGateEntity gate = null;
        if (command.qcGateId() != null) {
            gate = qcGateRepository.findById(command.qcGateId());
            if (gate == null) {
                throw new ResourceNotFoundException("QcGate", command.qcGateId());
            }
        }

        LotStatusEnum lotTarget = qcDecisionPolicyDomainService.resolveLotTarget(lot, command.decision());
        if (lotTarget != null) {
            LotStatusEnum previous = lot.getStatus();
            try {
                lot.transitionTo(lotTarget);
            } catch (RuntimeException ex) {
                log.warn("QC decision rejected, lot cannot move. lotId={}, from={}, to={}, decision={}",
                        lot.getId(), previous, lotTarget, command.decision());
                throw ex;
            }
            lotRepository.update(lot);
            genealogyQueryService.evictAll();
        }

        QcDecisionEntity decision = new QcDecisionEntity();
        decision.setLotId(lot.getId());
        decision.setQcGateId(command.qcGateId());
        decision.setOperatorId(command.operatorId());
        decision.setDecision(command.decision());
        decision.setNotes(StringUtils.trimToNull(command.notes()));
        decision.setTemperatureC(command.temperatureC());
        decision.setSignature(command.signature());
        decision.setDecidedAt(LocalDateTime.now());
        qcDecisionRepository.save(decision);
        log.info("QC decision recorded. decisionId={}, lotId={}, lotCode={}, gateId={}, decision={}, lotStatus={}",
                decision.getId(), lot.getId(), lot.getLotCode(), command.qcGateId(), command.decision(), lot.getStatus());

        holdRunIfBlocked(run, gate, lot, command.decision());
        return decision;
    }

    public List<QcDecisionEntity> listDecisions(Long lotId) {
        return qcDecisionRepository.findByLotId(lotId);
    }

    @Transactional(rollbackFor = Exception.class)
    public QcGateEntity registerGate(Integer gateNumber, String name, QcGateTypeEnum gateType, boolean ccp,
                                     List<String> checklist) {
        if (gateNumber != null && qcGateRepository.findByGateNumber(gateNumber) != null) {
            throw new IllegalArgumentException("QC gate number already registered: " + gateNumber);
        }
        QcGateEntity gate = new QcGateEntity();
        gate.setGateNumber(gateNumber);
        gate.setName(StringUtils.trimToNull(name));
        gate.setGateType(gateType);
        gate.setCcp(ccp);
        gate.setChecklist(checklist == null ? List.of() : List.copyOf(checklist));
        gate.setCreatedAt(LocalDateTime.now());
        try {
            gate.validate();
        } catch (IllegalStateException ex) {
            throw new IllegalArgumentException(ex.getMessage(), ex);
        }
        qcGateRepository.save(gate);
        log.info("QC gate registered. gateId={}, gateNumber={}, gateType={}, ccp={}",
                gate.getId(), gateNumber, gateType, ccp);
        return gate;
    }

    public QcGateEntity getGate(Long gateId) {
        QcGateEntity gate = gateId == null ? null : qcGateRepository.findById(gateId);
        if (gate == null) {
            throw new ResourceNotFoundException("QcGate", gateId);
        }
        return gate;
    }

    public List<QcGateEntity> listGates() {
        return qcGateRepository.findAll();
    }

    private void holdRunIfBlocked(ProductionRunEntity run, QcGateEntity gate, LotEntity lot, QcDecisionEnum decision) {
        if (gate == null || run == null || run.getStatus() != RunStatusEnum.RUNNING
                || !Objects.equals(run.getCurrentStepIndex(), lot.getStepIndex())) {
            return;
        }
        NodeConfig.QcGate stepGate = qcDecisionPolicyDomainService.stepGateConfig(
                canonicalStepsOf(run.getFlowVersionId()), lot.getStepIndex());
        if (!qcDecisionPolicyDomainService.blocksRun(gate, stepGate, decision)) {
            return;
        }
        run.hold(qcDecisionPolicyDomainService.holdReason(gate, lot, decision));
        productionRunRepository.update(run);
        log.warn("Run put on hold by QC gate. runId={}, runCode={}, gateNumber={}, lotCode={}, decision={}",
                run.getId(), run.getRunCode(), gate.getGateNumber(), lot.getLotCode(), decision);
    }

    private List<FlowNode> canonicalStepsOf(Long flowVersionId) {
        FlowVersionEntity version = flowVersionId == null ? null : flowVersionRepository.findById(flowVersionId);
        return version == null ? List.of() : flowGraphPolicyService.canonicalSteps(version.getGraph());
    }
}
