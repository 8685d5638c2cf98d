package com.foodtrace.domain.qc.service;

import com.foodtrace.domain.flow.model.valobj.FlowNode;
import com.foodtrace.domain.flow.model.valobj.NodeConfig;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.qc.model.entity.QcDecisionEntity;
import com.foodtrace.domain.qc.model.entity.QcGateEntity;
import com.foodtrace.types.common.Constants;
import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.NodeKindEnum;
import com.foodtrace.types.enums.QcDecisionEnum;
import com.foodtrace.types.exception.NotesRequiredException;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * QC decision rules: notes contract, lot side effect and gate blocking.
 */
@Service
public class QcDecisionPolicyDomainService {

    private static final Comparator<QcDecisionEntity> CHRONOLOGICAL = Comparator
            .comparing(QcDecisionEntity::getDecidedAt, Comparator.nullsFirst(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(QcDecisionEntity::getId, Comparator.nullsFirst(Comparator.<Long>naturalOrder()));

    public void checkNotes(QcDecisionEnum decision, String notes) {
        int length = StringUtils.trimToEmpty(notes).length();
        if (decision != null && decision.requiresNotes() && length < Constants.QC_NOTES_MIN_LENGTH) {
            throw new NotesRequiredException(decision.name(), Constants.QC_NOTES_MIN_LENGTH);
        }
        if (length > Constants.QC_NOTES_MAX_LENGTH) {
            throw new IllegalArgumentException("Notes cannot exceed " + Constants.QC_NOTES_MAX_LENGTH
                    + " characters: " + length);
        }
    }

    /**
     * Product temperature measured at inspection, optional.
     */
    public void checkTemperature(BigDecimal temperatureC) {
        if (temperatureC == null) {
            return;
        }
        if (temperatureC.compareTo(BigDecimal.valueOf(Constants.LOT_TEMPERATURE_MIN_C)) < 0
                || temperatureC.compareTo(BigDecimal.valueOf(Constants.LOT_TEMPERATURE_MAX_C)) > 0) {
            throw new IllegalArgumentException("temperatureC must be within [" + Constants.LOT_TEMPERATURE_MIN_C
                    + ", " + Constants.LOT_TEMPERATURE_MAX_C + "]: " + temperatureC);
        }
    }

    /**
     * Status the lot must move to, or null when it is already there.
     */
    public LotStatusEnum resolveLotTarget(LotEntity lot, QcDecisionEnum decision) {
        LotStatusEnum target = decision.targetLotStatus();
        return lot.getStatus() == target ? null : target;
    }

    public boolean blocksRun(QcGateEntity gate, QcDecisionEnum decision) {
        return blocksRun(gate, null, decision);
    }

    /**
     * @param stepGate QC config of the flow node the lot's step runs, null when that node is no QC gate
     */
    public boolean blocksRun(QcGateEntity gate, NodeConfig.QcGate stepGate, QcDecisionEnum decision) {
        return isBlocking(gate, stepGate) && decision != QcDecisionEnum.PASS;
    }

    /**
     * A registered gate blocks by its own type, or because the step's QC node refers to it and is
     * flagged blocking or ccp.
     */
    public boolean isBlocking(QcGateEntity gate, NodeConfig.QcGate stepGate) {
        if (gate == null) {
            return false;
        }
        if (gate.isBlocking()) {
            return true;
        }
        return stepGate != null && (stepGate.blocking() || stepGate.ccp()) && refersTo(stepGate.gateRef(), gate);
    }

    /**
     * A gate reference names the gate by number or, ignoring case, by name.
     */
    public boolean refersTo(String gateRef, QcGateEntity gate) {
        String ref = StringUtils.trimToNull(gateRef);
        if (ref == null || gate == null) {
            return false;
        }
        return (gate.getGateNumber() != null && ref.equals(String.valueOf(gate.getGateNumber())))
                || StringUtils.equalsIgnoreCase(ref, gate.getName());
    }

    /**
     * QC config of the canonical step at {@code stepIndex}, or null when that node is no QC gate.
     */
    public NodeConfig.QcGate stepGateConfig(List<FlowNode> canonicalSteps, Integer stepIndex) {
        if (canonicalSteps == null || stepIndex == null || stepIndex < 0 || stepIndex >= canonicalSteps.size()) {
            return null;
        }
        FlowNode node = canonicalSteps.get(stepIndex);
        if (node.kind() == NodeKindEnum.QC_GATE && node.config() instanceof NodeConfig.QcGate qcGate) {
            return qcGate;
        }
        return null;
    }

    public String holdReason(QcGateEntity gate, LotEntity lot, QcDecisionEnum decision) {
        return String.format("QC gate %s (%s) recorded %s on lot %s",
                gate.getGateNumber(), gate.getName(), decision.name(), lot.getLotCode());
    }

    /**
     * Lots whose latest decision from some blocking gate is not PASS. REJECTED lots are out of
     * production and never block.
     */
    public List<LotEntity> findBlockedLots(List<LotEntity> lots,
                                           List<QcDecisionEntity> decisions,
                                           Map<Long, QcGateEntity> gatesById,
                                           NodeConfig.QcGate stepGate) {
        List<LotEntity> blocked = new ArrayList<>();
        if (lots == null || lots.isEmpty() || decisions == null || decisions.isEmpty()) {
            return blocked;
        }
        Map<Long, List<QcDecisionEntity>> byLot = decisions.stream()
                .filter(decision -> decision.getQcGateId() != null)
                .collect(Collectors.groupingBy(QcDecisionEntity::getLotId));
        for (LotEntity lot : lots) {
            if (lot.getStatus() == LotStatusEnum.REJECTED) {
                continue;
            }
            Map<Long, QcDecisionEntity> latestByGate = new LinkedHashMap<>();
            for (QcDecisionEntity decision : byLot.getOrDefault(lot.getId(), List.of())) {
                latestByGate.merge(decision.getQcGateId(), decision,
                        (a, b) -> CHRONOLOGICAL.compare(a, b) >= 0 ? a : b);
            }
            boolean isBlocked = latestByGate.values().stream()
                    .anyMatch(latest -> blocksRun(gatesById.get(latest.getQcGateId()), stepGate, latest.getDecision()));
            if (isBlocked) {
                blocked.add(lot);
            }
        }
        return blocked;
    }

    public List<Long> gateIdsOf(List<QcDecisionEntity> decisions) {
        return decisions.stream()
                .map(QcDecisionEntity::getQcGateId)
                .filter(Objects::nonNull)
                .distinct()
                .collect(Collectors.toList());
    }
}
