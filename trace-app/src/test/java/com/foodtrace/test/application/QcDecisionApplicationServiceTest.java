package com.foodtrace.test.application;

import com.foodtrace.domain.flow.service.FlowGraphPolicyService;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.lot.model.valobj.GenealogyTrace;
import com.foodtrace.domain.lot.service.GenealogyTraversalDomainService;
import com.foodtrace.domain.qc.model.entity.QcDecisionEntity;
import com.foodtrace.domain.qc.model.entity.QcGateEntity;
import com.foodtrace.domain.qc.service.QcDecisionPolicyDomainService;
import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.test.support.InMemoryFlowVersionRepository;
import com.foodtrace.test.support.InMemoryGenealogyEdgeRepository;
import com.foodtrace.test.support.InMemoryLotRepository;
import com.foodtrace.test.support.InMemoryProductionRunRepository;
import com.foodtrace.test.support.InMemoryQcDecisionRepository;
import com.foodtrace.test.support.InMemoryQcGateRepository;
import com.foodtrace.trigger.application.command.QcDecisionApplicationService;
import com.foodtrace.trigger.application.command.QcDecisionApplicationService.RecordDecisionCommand;
import com.foodtrace.trigger.application.query.GenealogyQueryService;
import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.LotTypeEnum;
import com.foodtrace.types.enums.QcDecisionEnum;
import com.foodtrace.types.enums.QcGateTypeEnum;
import com.foodtrace.types.enums.RunStatusEnum;
import com.foodtrace.types.exception.IllegalTransitionException;
import com.foodtrace.types.exception.NotesRequiredException;
import com.foodtrace.types.exception.ResourceNotFoundException;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.math.BigDecimal;
import java.util.List;

public class QcDecisionApplicationServiceTest {

    private InMemoryLotRepository lotRepository;
    private InMemoryQcDecisionRepository qcDecisionRepository;
    private InMemoryProductionRunRepository productionRunRepository;
    private Cache<String, GenealogyTrace> cache;
    private GenealogyQueryService queryService;
    private QcDecisionApplicationService service;

    @BeforeEach
    public void setUp() {
        lotRepository = Mockito.spy(new InMemoryLotRepository());
        qcDecisionRepository = new InMemoryQcDecisionRepository();
        productionRunRepository = Mockito.spy(new InMemoryProductionRunRepository());
        cache = CacheBuilder.newBuilder().build();
        queryService = new GenealogyQueryService(
                new GenealogyTraversalDomainService(new InMemoryGenealogyEdgeRepository(), lotRepository),
                lotRepository, cache);
        service = new QcDecisionApplicationService(qcDecisionRepository, new InMemoryQcGateRepository(),
                lotRepository, productionRunRepository, new InMemoryFlowVersionRepository(),
                new FlowGraphPolicyService(), new QcDecisionPolicyDomainService(), queryService);
    }

    @Test
    public void shouldRequireNotesBeforeTouchingLot() {
        LotEntity lot = lot("RAW-001", null, 0);

        Assertions.assertThrows(NotesRequiredException.class, () -> service.recordDecision(
                new RecordDecisionCommand(lot.getId(), null, "qa", QcDecisionEnum.HOLD, "too short", null, null)));

        Assertions.assertEquals(LotStatusEnum.CREATED, lotRepository.findById(lot.getId()).getStatus());
        Assertions.assertTrue(qcDecisionRepository.findAll().isEmpty());
    }

    @Test
    public void shouldHoldLotWithTenCharacterNotes() {
        LotEntity lot = lot("RAW-001", null, 0);

        QcDecisionEntity decision = service.recordDecision(new RecordDecisionCommand(lot.getId(), null, "qa",
                QcDecisionEnum.HOLD, "  smell is off  ", new BigDecimal("4.1"), "sig-qa"));

        Assertions.assertNotNull(decision.getId());
        Assertions.assertEquals("smell is off", decision.getNotes());
        Assertions.assertEquals(LotStatusEnum.HOLD, lotRepository.findById(lot.getId()).getStatus());
        Assertions.assertEquals(1, service.listDecisions(lot.getId()).size());
    }

    @Test
    public void shouldRecordNothingWhenLotCannotTakeDecision() {
        LotEntity lot = lot("RAW-001", null, 0);

        IllegalTransitionException ex = Assertions.assertThrows(IllegalTransitionException.class,
                () -> service.recordDecision(new RecordDecisionCommand(lot.getId(), null, "qa",
                        QcDecisionEnum.PASS, null, null, null)));

        Assertions.assertEquals("CREATED", ex.getFrom());
        Assertions.assertEquals("RELEASED", ex.getTo());
        Assertions.assertTrue(qcDecisionRepository.findAll().isEmpty());
    }

    @Test
    public void shouldRecordRepeatedDecisionWithoutMovingLot() {
        LotEntity lot = lot("RAW-001", null, 0);
        service.recordDecision(new RecordDecisionCommand(lot.getId(), null, "qa", QcDecisionEnum.HOLD,
                "label missing on crate", null, null));

        service.recordDecision(new RecordDecisionCommand(lot.getId(), null, "qa2", QcDecisionEnum.HOLD,
                "label still missing", null, null));

        Assertions.assertEquals(2, qcDecisionRepository.findAll().size());
        Assertions.assertEquals(1, lotRepository.findById(lot.getId()).getVersion());
    }

    @Test
    public void shouldHoldRunningRunWhenBlockingGateFailsLotAtCurrentStep() {
        ProductionRunEntity run = runningRun("key-1", 2);
        QcGateEntity gate = service.registerGate(3, "Cooking CCP", QcGateTypeEnum.CHECKPOINT, true,
                List.of("core temperature"));
        LotEntity lot = quarantined(lot("MIX-001", run.getId(), 2));

        service.recordDecision(new RecordDecisionCommand(lot.getId(), gate.getId(), "qa", QcDecisionEnum.FAIL,
                "core temperature 61 C", new BigDecimal("61"), null));

        ProductionRunEntity held = productionRunRepository.findById(run.getId());
        Assertions.assertEquals(RunStatusEnum.HOLD, held.getStatus());
        Assertions.assertTrue(held.getHoldReason().contains("MIX-001"));
        Assertions.assertEquals(LotStatusEnum.REJECTED, lotRepository.findById(lot.getId()).getStatus());
    }

    @Test
    public void shouldLockOwningRunBeforeLot() {
        ProductionRunEntity run = runningRun("key-1", 2);
        QcGateEntity gate = service.registerGate(3, "Cooking CCP", QcGateTypeEnum.BLOCKING, true, null);
        LotEntity lot = lot("MIX-001", run.getId(), 2);
        Mockito.clearInvocations(productionRunRepository, lotRepository);

        service.recordDecision(new RecordDecisionCommand(lot.getId(), gate.getId(), "qa", QcDecisionEnum.HOLD,
                "core temperature 68 C", new BigDecimal("68"), null));

        InOrder inOrder = Mockito.inOrder(productionRunRepository, lotRepository);
        inOrder.verify(productionRunRepository).findByIdForUpdate(run.getId());
        inOrder.verify(lotRepository).findByIdForUpdate(lot.getId());
        inOrder.verify(lotRepository).update(Mockito.any(LotEntity.class));
        inOrder.verify(productionRunRepository).update(Mockito.any(ProductionRunEntity.class));
    }

    @Test
    public void shouldDropCachedTracesWhenDecisionMovesLot() {
        LotEntity lot = lot("RAW-001", null, 0);
        queryService.traceForward(lot.getId(), 3);
        Assertions.assertEquals(1, cache.size());

        service.recordDecision(new RecordDecisionCommand(lot.getId(), null, "qa", QcDecisionEnum.HOLD,
                "label missing on crate", null, null));
        Assertions.assertEquals(0, cache.size());
        Assertions.assertEquals(LotStatusEnum.HOLD,
                queryService.traceForward(lot.getId(), 3).nodes().get(0).lot().getStatus());

        service.recordDecision(new RecordDecisionCommand(lot.getId(), null, "qa", QcDecisionEnum.HOLD,
                "label still missing", null, null));
        Assertions.assertEquals(1, cache.size());
    }

    @Test
    public void shouldRejectOutOfRangeTemperatureAndOverlongNotes() {
        LotEntity lot = lot("RAW-001", null, 0);

        Assertions.assertThrows(IllegalArgumentException.class, () -> service.recordDecision(
                new RecordDecisionCommand(lot.getId(), null, "qa", QcDecisionEnum.HOLD, "probe reads hot",
                        new BigDecimal("100.1"), null)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> service.recordDecision(
                new RecordDecisionCommand(lot.getId(), null, "qa", QcDecisionEnum.HOLD, "n".repeat(1001),
                        null, null)));

        Assertions.assertTrue(qcDecisionRepository.findAll().isEmpty());
        Assertions.assertEquals(LotStatusEnum.CREATED, lotRepository.findById(lot.getId()).getStatus());
    }

    @Test
    public void shouldLeaveRunAloneForOtherStepOrNonBlockingGate() {
        ProductionRunEntity run = runningRun("key-1", 2);
        QcGateEntity blocking = service.registerGate(1, "Incoming", QcGateTypeEnum.BLOCKING, false, null);
        QcGateEntity info = service.registerGate(2, "Visual", QcGateTypeEnum.INFO, false, null);
        LotEntity earlier = lot("RAW-001", run.getId(), 1);
        LotEntity current = lot("RAW-002", run.getId(), 2);
        Mockito.clearInvocations(productionRunRepository);

        service.recordDecision(new RecordDecisionCommand(earlier.getId(), blocking.getId(), "qa",
                QcDecisionEnum.HOLD, "packaging torn open", null, null));
        service.recordDecision(new RecordDecisionCommand(current.getId(), info.getId(), "qa",
                QcDecisionEnum.HOLD, "packaging torn open", null, null));

        Assertions.assertEquals(RunStatusEnum.RUNNING, productionRunRepository.findById(run.getId()).getStatus());
        Mockito.verify(productionRunRepository, Mockito.never()).update(Mockito.any(ProductionRunEntity.class));
    }

    @Test
    public void shouldRejectUnknownGateAndDuplicateGateNumber() {
        LotEntity lot = lot("RAW-001", null, 0);
        service.registerGate(1, "Incoming", QcGateTypeEnum.BLOCKING, true, List.of("temperature"));

        Assertions.assertThrows(ResourceNotFoundException.class, () -> service.recordDecision(
                new RecordDecisionCommand(lot.getId(), 42L, "qa", QcDecisionEnum.PASS, null, null, null)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> service.registerGate(1, "Again", QcGateTypeEnum.INFO, false, null));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> service.registerGate(0, "Zero", QcGateTypeEnum.INFO, false, null));
        Assertions.assertEquals(1, service.listGates().size());
    }

    private LotEntity lot(String code, Long runId, int stepIndex) {
        return lotRepository.save(LotEntity.create(code, LotTypeEnum.RAW, new BigDecimal("20"), new BigDecimal("3"),
                runId, stepIndex, "op", null));
    }

    private LotEntity quarantined(LotEntity lot) {
        lot.transitionTo(LotStatusEnum.QUARANTINE);
        return lotRepository.update(lot);
    }

    private ProductionRunEntity runningRun(String key, int stepIndex) {
        ProductionRunEntity run = ProductionRunEntity.newRun("RUN-20261019-DUNA-0001", 1L, 5, "alice", key);
        productionRunRepository.insertIfAbsent(run);
        run.start();
        run.setCurrentStepIndex(stepIndex);
        return productionRunRepository.update(run);
    }
}
