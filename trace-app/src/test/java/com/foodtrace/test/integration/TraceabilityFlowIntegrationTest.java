package com.foodtrace.test.integration;

import com.foodtrace.Application;
import com.foodtrace.domain.flow.model.entity.FlowDefinitionEntity;
import com.foodtrace.domain.flow.model.entity.FlowVersionEntity;
import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.lot.model.valobj.GenealogyTrace;
import com.foodtrace.domain.qc.model.entity.QcGateEntity;
import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.test.support.FlowGraphFixtures;
import com.foodtrace.trigger.application.command.FlowGovernanceApplicationService;
import com.foodtrace.trigger.application.command.LotLifecycleApplicationService;
import com.foodtrace.trigger.application.command.QcDecisionApplicationService;
import com.foodtrace.trigger.application.command.RunExecutionApplicationService;
import com.foodtrace.trigger.application.query.GenealogyQueryService;
import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.LotTypeEnum;
import com.foodtrace.types.enums.QcDecisionEnum;
import com.foodtrace.types.enums.QcGateTypeEnum;
import com.foodtrace.types.enums.RunStatusEnum;
import com.foodtrace.types.enums.RunStepStatusEnum;
import com.foodtrace.types.exception.CycleDetectedException;
import com.foodtrace.types.exception.DraftConflictException;
import com.foodtrace.types.exception.ImmutableVersionException;
import com.foodtrace.types.exception.StepBlockedException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.EnabledIfSystemProperty;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.dao.DataAccessException;
import org.springframework.test.context.ActiveProfiles;

import java.math.BigDecimal;
import java.util.List;
import java.util.Set;

@SpringBootTest(classes = Application.class)
@ActiveProfiles("test")
@EnabledIfSystemProperty(named = "it.docker.enabled", matches = "true")
public class TraceabilityFlowIntegrationTest extends PostgresIntegrationTestSupport {

    @Autowired
    private FlowGovernanceApplicationService flowService;

    @Autowired
    private RunExecutionApplicationService runService;

    @Autowired
    private LotLifecycleApplicationService lotService;

    @Autowired
    private QcDecisionApplicationService qcService;

    @Autowired
    private GenealogyQueryService genealogyQueryService;

    @BeforeEach
    public void clearTraceCache() {
        genealogyQueryService.evictAll();
    }

    @Test
    public void shouldPublishAndCreateRunIdempotently() {
        FlowVersionEntity published = publish(FlowGraphFixtures.linear(2));

        ProductionRunEntity first = runService.createRun(published.getId(), "it-key-1", "alice");
        ProductionRunEntity replay = runService.createRun(published.getId(), "it-key-1", "bob");

        Assertions.assertEquals(first.getId(), replay.getId());
        Assertions.assertTrue(first.getRunCode().matches("RUN-\\d{8}-ITEST-0001"), first.getRunCode());
        Assertions.assertEquals(1, count("production_runs"));
        Assertions.assertEquals(4, count("run_step_executions"));
        Assertions.assertEquals(2, flowService.listVersions(published.getFlowDefinitionId()).size());
        Assertions.assertEquals(FlowGraphFixtures.linear(2), flowService.get(published.getId()).getGraph());
    }

    @Test
    public void shouldKeepPublishedVersionFrozen() {
        FlowVersionEntity published = publish(FlowGraphFixtures.linear(1));

        Assertions.assertThrows(ImmutableVersionException.class,
                () -> flowService.saveDraft(published.getId(), FlowGraphFixtures.linear(4)));
        Assertions.assertThrows(DataAccessException.class, () -> jdbcTemplate.update(
                "UPDATE flow_versions SET graph = CAST(? AS jsonb) WHERE id = ?",
                "{\"nodes\":[],\"edges\":[]}", published.getId()));
        Assertions.assertThrows(DraftConflictException.class,
                () -> flowService.createDraft(published.getFlowDefinitionId(), FlowGraph.empty(), "carol"));

        flowService.deprecate(published.getId());
        Assertions.assertEquals(FlowGraphFixtures.linear(1), flowService.get(published.getId()).getGraph());
    }

    @Test
    public void shouldPersistRunProgressionWithOptimisticVersion() {
        FlowVersionEntity published = publish(FlowGraphFixtures.linear(1));
        ProductionRunEntity run = runService.createRun(published.getId(), "it-key-2", "alice");

        runService.start(run.getId());
        runService.advanceStep(run.getId(), "op", 0);
        runService.advanceStep(run.getId(), "op", 0);

        ProductionRunEntity stored = runService.getRun(run.getId());
        Assertions.assertEquals(RunStatusEnum.RUNNING, stored.getStatus());
        Assertions.assertEquals(1, stored.getCurrentStepIndex());
        Assertions.assertEquals(2, stored.getVersion());
        Assertions.assertEquals(RunStepStatusEnum.COMPLETED, runService.listSteps(run.getId()).get(0).getStatus());
        Assertions.assertEquals(RunStepStatusEnum.IN_PROGRESS, runService.listSteps(run.getId()).get(1).getStatus());
    }

    @Test
    public void shouldTraceGenealogyAndRejectCycles() {
        LotEntity raw1 = lot("RAW-001", LotTypeEnum.RAW, "100");
        LotEntity raw2 = lot("RAW-002", LotTypeEnum.RAW, "50");
        LotEntity mix = lot("MIX-001", LotTypeEnum.MIX, "150");

        lotService.linkGenealogy(List.of(raw1.getId(), raw2.getId()), mix.getId(),
                List.of(new BigDecimal("100"), new BigDecimal("50")), "mix-1");

        GenealogyTrace backward = genealogyQueryService.traceBackward(mix.getId(), 5);
        Assertions.assertEquals(Set.of("MIX-001", "RAW-001", "RAW-002"), backward.lotCodes());
        Assertions.assertEquals(Set.of("RAW-001", "MIX-001"), genealogyQueryService.traceForward(raw1.getId(), 5).lotCodes());
        Assertions.assertThrows(CycleDetectedException.class,
                () -> lotService.linkGenealogy(List.of(mix.getId()), raw1.getId(), null, null));
        Assertions.assertEquals(2, count("lot_genealogy"));
    }

    @Test
    public void shouldServeFreshLotStatusInTraceAfterQcRejection() {
        LotEntity raw = lot("RAW-020", LotTypeEnum.RAW, "40");
        LotEntity mix = lot("MIX-020", LotTypeEnum.MIX, "40");
        lotService.linkGenealogy(List.of(raw.getId()), mix.getId(), null, "mixing-20");
        genealogyQueryService.traceForward(raw.getId(), 5);

        lotService.transition(mix.getId(), LotStatusEnum.QUARANTINE);
        qcService.recordDecision(new QcDecisionApplicationService.RecordDecisionCommand(mix.getId(), null,
                "qa", QcDecisionEnum.FAIL, "foreign body found in mix", null, null));

        GenealogyTrace trace = genealogyQueryService.traceForward(raw.getId(), 5);
        Assertions.assertEquals(LotStatusEnum.REJECTED, trace.lotsAtDepth(1).get(0).getStatus());
    }

    @Test
    public void shouldHoldRunAndBlockStepOnBlockingGate() {
        FlowVersionEntity published = publish(FlowGraphFixtures.withQcGate());
        ProductionRunEntity run = runService.createRun(published.getId(), "it-key-3", "alice");
        runService.start(run.getId());
        QcGateEntity gate = qcService.registerGate(1, "Incoming QC", QcGateTypeEnum.BLOCKING, true,
                List.of("temperature"));
        LotEntity lot = lotService.createLot(new LotLifecycleApplicationService.CreateLotCommand("RAW-010",
                LotTypeEnum.RAW, new BigDecimal("80"), new BigDecimal("6.5"), run.getId(), 0, "op", null));

        qcService.recordDecision(new QcDecisionApplicationService.RecordDecisionCommand(lot.getId(), gate.getId(),
                "qa", QcDecisionEnum.HOLD, "core temperature 6.5 C", new BigDecimal("6.5"), null));

        Assertions.assertEquals(RunStatusEnum.HOLD, runService.getRun(run.getId()).getStatus());
        runService.resume(run.getId());
        Assertions.assertThrows(StepBlockedException.class, () -> runService.advanceStep(run.getId(), "op", null));
        Assertions.assertEquals(1, qcService.listDecisions(lot.getId()).size());
    }

    private FlowVersionEntity publish(FlowGraph graph) {
        FlowDefinitionEntity definition = flowService.createDefinition("Kebab line", "integration", "alice");
        FlowVersionEntity draft = flowService.findLatestDraft(definition.getId());
        flowService.saveDraft(draft.getId(), graph);
        return flowService.publish(draft.getId(), "bob");
    }

    private LotEntity lot(String code, LotTypeEnum type, String weightKg) {
        return lotService.createLot(new LotLifecycleApplicationService.CreateLotCommand(code, type,
                new BigDecimal(weightKg), new BigDecimal("2.5"), null, null, "op", null));
    }

    private int count(String table) {
        Integer rows = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM " + table, Integer.class);
        return rows == null ? 0 : rows;
    }
}
