package com.foodtrace.test.application;

import com.foodtrace.domain.flow.model.entity.FlowDefinitionEntity;
import com.foodtrace.domain.flow.model.entity.FlowVersionEntity;
import com.foodtrace.domain.flow.model.valobj.FlowGraph;
import com.foodtrace.domain.flow.service.FlowGraphPolicyService;
import com.foodtrace.test.support.FlowGraphFixtures;
import com.foodtrace.test.support.InMemoryFlowDefinitionRepository;
import com.foodtrace.test.support.InMemoryFlowVersionRepository;
import com.foodtrace.trigger.application.command.FlowGovernanceApplicationService;
import com.foodtrace.types.common.GraphValidationIssue;
import com.foodtrace.types.enums.FlowVersionStatusEnum;
import com.foodtrace.types.enums.GraphIssueCodeEnum;
import com.foodtrace.types.exception.DraftConflictException;
import com.foodtrace.types.exception.GraphInvalidException;
import com.foodtrace.types.exception.IllegalTransitionException;
import com.foodtrace.types.exception.ImmutableVersionException;
import com.foodtrace.types.exception.NotDraftException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.mockito.Mockito;

import java.util.List;
import java.util.stream.Collectors;

public class FlowGovernanceApplicationServiceTest {

    private InMemoryFlowDefinitionRepository flowDefinitionRepository;
    private InMemoryFlowVersionRepository flowVersionRepository;
    private FlowGovernanceApplicationService service;

    @BeforeEach
    public void setUp() {
        flowDefinitionRepository = Mockito.spy(new InMemoryFlowDefinitionRepository());
        flowVersionRepository = Mockito.spy(new InMemoryFlowVersionRepository());
        service = new FlowGovernanceApplicationService(flowDefinitionRepository,
                flowVersionRepository, new FlowGraphPolicyService());
    }

    @Test
    public void shouldCreateDefinitionWithFirstDraft() {
        FlowDefinitionEntity definition = service.createDefinition("Kebab line", "Doner production", "alice");

        FlowVersionEntity draft = service.findLatestDraft(definition.getId());
        Assertions.assertNotNull(draft);
        Assertions.assertEquals(1, draft.getVersionNum());
        Assertions.assertEquals(FlowVersionStatusEnum.DRAFT, draft.getStatus());
        Assertions.assertTrue(draft.getGraph().getNodes().isEmpty());
        Assertions.assertNull(service.findCurrentPublished(definition.getId()));
    }

    @Test
    public void shouldPublishAndOpenNextDraftWithSameGraph() {
        FlowVersionEntity draft = draftWith(FlowGraphFixtures.linear(2));

        FlowVersionEntity published = service.publish(draft.getId(), "bob");

        Assertions.assertEquals(FlowVersionStatusEnum.PUBLISHED, published.getStatus());
        Assertions.assertEquals("bob", published.getReviewedBy());
        Assertions.assertNotNull(published.getCommittedAt());
        FlowVersionEntity next = service.findLatestDraft(draft.getFlowDefinitionId());
        Assertions.assertEquals(2, next.getVersionNum());
        Assertions.assertEquals(published.getGraph(), next.getGraph());
        Assertions.assertEquals(published.getId(), service.findCurrentPublished(draft.getFlowDefinitionId()).getId());
    }

    @Test
    public void shouldRejectInvalidGraphWithEveryIssueAndLeaveDraftUntouched() {
        FlowDefinitionEntity definition = service.createDefinition("Empty", null, "alice");
        FlowVersionEntity draft = service.findLatestDraft(definition.getId());

        GraphInvalidException ex = Assertions.assertThrows(GraphInvalidException.class,
                () -> service.publish(draft.getId(), "bob"));

        List<GraphIssueCodeEnum> codes = ex.getIssues().stream()
                .map(GraphValidationIssue::code)
                .collect(Collectors.toList());
        Assertions.assertTrue(codes.contains(GraphIssueCodeEnum.MISSING_START));
        Assertions.assertTrue(codes.contains(GraphIssueCodeEnum.MISSING_END));
        Assertions.assertEquals(FlowVersionStatusEnum.DRAFT, service.get(draft.getId()).getStatus());
        Assertions.assertEquals(1, service.listVersions(definition.getId()).size());
    }

    @Test
    public void shouldRefuseGraphChangesOutsideDraft() {
        FlowVersionEntity draft = draftWith(FlowGraphFixtures.linear(1));
        service.publish(draft.getId(), "bob");

        Assertions.assertThrows(ImmutableVersionException.class,
                () -> service.saveDraft(draft.getId(), FlowGraphFixtures.linear(3)));
        Assertions.assertEquals(3, service.get(draft.getId()).getGraph().getNodes().size());

        FlowVersionEntity next = service.findLatestDraft(draft.getFlowDefinitionId());
        service.requestReview(next.getId());
        Assertions.assertThrows(NotDraftException.class,
                () -> service.saveDraft(next.getId(), FlowGraphFixtures.linear(3)));

        service.returnToDraft(next.getId());
        FlowVersionEntity saved = service.saveDraft(next.getId(), FlowGraphFixtures.linear(3));
        Assertions.assertEquals(5, saved.getGraph().getNodes().size());
    }

    @Test
    public void shouldAllowOnlyOneOpenDraft() {
        FlowDefinitionEntity definition = service.createDefinition("Kebab line", null, "alice");
        FlowVersionEntity open = service.findLatestDraft(definition.getId());
        service.requestReview(open.getId());

        DraftConflictException ex = Assertions.assertThrows(DraftConflictException.class,
                () -> service.createDraft(definition.getId(), FlowGraph.empty(), "carol"));
        Assertions.assertEquals(open.getId(), ex.getExistingDraftId());

        service.deprecate(open.getId());
        FlowVersionEntity fresh = service.createDraft(definition.getId(), FlowGraph.empty(), "carol");
        Assertions.assertEquals(2, fresh.getVersionNum());
    }

    @Test
    public void shouldLockDefinitionBeforeCheckingOpenDraft() {
        FlowDefinitionEntity definition = service.createDefinition("Kebab line", null, "alice");
        service.deprecate(service.findLatestDraft(definition.getId()).getId());
        Mockito.clearInvocations(flowDefinitionRepository, flowVersionRepository);

        service.createDraft(definition.getId(), FlowGraph.empty(), "carol");

        InOrder inOrder = Mockito.inOrder(flowDefinitionRepository, flowVersionRepository);
        inOrder.verify(flowDefinitionRepository).findByIdForUpdate(definition.getId());
        inOrder.verify(flowVersionRepository).findOpenDraftByDefinitionId(definition.getId());
        inOrder.verify(flowDefinitionRepository).allocateNextVersionNum(definition.getId());
        Mockito.verify(flowDefinitionRepository, Mockito.never()).findById(Mockito.anyLong());
    }

    @Test
    public void shouldForkPublishedVersionOnceOpenDraftIsGone() {
        FlowVersionEntity draft = draftWith(FlowGraphFixtures.withQcGate());
        service.publish(draft.getId(), "bob");
        service.deprecate(service.findLatestDraft(draft.getFlowDefinitionId()).getId());

        FlowVersionEntity fork = service.forkVersion(draft.getId(), "carol");

        Assertions.assertEquals(3, fork.getVersionNum());
        Assertions.assertEquals(FlowGraphFixtures.withQcGate(), fork.getGraph());
    }

    @Test
    public void shouldTreatDeprecatedAsTerminal() {
        FlowVersionEntity draft = draftWith(FlowGraphFixtures.linear(1));
        service.publish(draft.getId(), "bob");

        service.deprecate(draft.getId());

        Assertions.assertEquals(FlowVersionStatusEnum.DEPRECATED, service.get(draft.getId()).getStatus());
        Assertions.assertThrows(IllegalTransitionException.class, () -> service.deprecate(draft.getId()));
        Assertions.assertThrows(IllegalTransitionException.class, () -> service.publish(draft.getId(), "bob"));
    }

    private FlowVersionEntity draftWith(FlowGraph graph) {
        FlowDefinitionEntity definition = service.createDefinition("Kebab line", null, "alice");
        FlowVersionEntity draft = service.findLatestDraft(definition.getId());
        return service.saveDraft(draft.getId(), graph);
    }
}
