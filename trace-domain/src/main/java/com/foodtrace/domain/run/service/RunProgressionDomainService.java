package com.foodtrace.domain.run.service;

import com.foodtrace.domain.flow.model.valobj.FlowNode;
import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.domain.run.model.entity.RunStepExecutionEntity;
import com.foodtrace.types.enums.RunStepStatusEnum;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Step progression rules of a production run. Works on a run and its loaded step records; persistence
 * is left to the caller.
 */
@Slf4j
@Service
public class RunProgressionDomainService {

    public List<RunStepExecutionEntity> instantiateSteps(Long runId, List<FlowNode> canonicalSteps) {
        List<RunStepExecutionEntity> steps = new ArrayList<>(canonicalSteps.size());
        for (int i = 0; i < canonicalSteps.size(); i++) {
            steps.add(RunStepExecutionEntity.pending(runId, i, canonicalSteps.get(i).id()));
        }
        return steps;
    }

    /**
     * Step indices of a run must be exactly {0..totalSteps-1}.
     */
    public void verifyStepCompleteness(ProductionRunEntity run, List<RunStepExecutionEntity> steps) {
        int total = run.getTotalSteps() == null ? 0 : run.getTotalSteps();
        if (steps == null || steps.size() != total) {
            throw new IllegalStateException("Run " + run.getId() + " expects " + total + " steps, found "
                    + (steps == null ? 0 : steps.size()));
        }
        for (int i = 0; i < total; i++) {
            Integer index = steps.get(i).getStepIndex();
            if (index == null || index != i) {
                throw new IllegalStateException("Run " + run.getId() + " has a gap at step index " + i);
            }
        }
    }

    /**
     * IDLE -> RUNNING, first step goes IN_PROGRESS.
     *
     * @return the step records that changed
     */
    public List<RunStepExecutionEntity> start(ProductionRunEntity run, List<RunStepExecutionEntity> steps) {
        verifyStepCompleteness(run, steps);
        run.start();
        RunStepExecutionEntity first = steps.get(run.getCurrentStepIndex());
        first.begin();
        return List.of(first);
    }

    public boolean isStepCompleted(List<RunStepExecutionEntity> steps, int stepIndex) {
        if (stepIndex < 0 || stepIndex >= steps.size()) {
            return false;
        }
        return steps.get(stepIndex).getStatus() == RunStepStatusEnum.COMPLETED;
    }

    /**
     * Completes the current step. Moves on to the next one, or completes the run on the last step.
     * The run must be RUNNING.
     *
     * @return the step records that changed
     */
    public List<RunStepExecutionEntity> advance(ProductionRunEntity run,
                                                List<RunStepExecutionEntity> steps,
                                                String operatorId) {
        verifyStepCompleteness(run, steps);
        int currentIndex = run.getCurrentStepIndex();
        RunStepExecutionEntity current = steps.get(currentIndex);
        current.complete(operatorId);
        List<RunStepExecutionEntity> changed = new ArrayList<>(2);
        changed.add(current);

        if (run.isLastStep()) {
            run.complete();
            log.info("Run completed on last step. runId={}, runCode={}, stepIndex={}",
                    run.getId(), run.getRunCode(), currentIndex);
            return changed;
        }
        run.moveToNextStep();
        RunStepExecutionEntity next = steps.get(run.getCurrentStepIndex());
        next.begin();
        changed.add(next);
        log.debug("Run step advanced. runId={}, from={}, to={}", run.getId(), currentIndex, run.getCurrentStepIndex());
        return changed;
    }

    /**
     * Marks every step that is not COMPLETED as SKIPPED, used when a run ends early.
     *
     * @return the step records that changed
     */
    public List<RunStepExecutionEntity> skipOpenSteps(List<RunStepExecutionEntity> steps) {
        List<RunStepExecutionEntity> changed = new ArrayList<>();
        for (RunStepExecutionEntity step : steps) {
            if (step.skipIfOpen()) {
                changed.add(step);
            }
        }
        return changed;
    }
}
