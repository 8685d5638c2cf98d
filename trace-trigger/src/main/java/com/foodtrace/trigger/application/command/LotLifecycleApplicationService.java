package com.foodtrace.trigger.application.command;

import com.foodtrace.domain.lot.adapter.repository.IGenealogyEdgeRepository;
import com.foodtrace.domain.lot.adapter.repository.ILotRepository;
import com.foodtrace.domain.lot.model.entity.GenealogyEdgeEntity;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.lot.service.GenealogyTraversalDomainService;
import com.foodtrace.domain.run.adapter.repository.IProductionRunRepository;
import com.foodtrace.domain.run.model.entity.ProductionRunEntity;
import com.foodtrace.trigger.application.query.GenealogyQueryService;
import com.foodtrace.types.enums.LotStatusEnum;
import com.foodtrace.types.enums.LotTypeEnum;
import com.foodtrace.types.exception.CycleDetectedException;
import com.foodtrace.types.exception.ResourceNotFoundException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Lot creation, status changes and genealogy links.
 */
@Slf4j
@Service
public class LotLifecycleApplicationService {

    private static final String LOT = "Lot";

    private final ILotRepository lotRepository;
    private final IGenealogyEdgeRepository genealogyEdgeRepository;
    private final IProductionRunRepository productionRunRepository;
    private final GenealogyTraversalDomainService genealogyTraversalDomainService;
    private final GenealogyQueryService genealogyQueryService;

    public LotLifecycleApplicationService(ILotRepository lotRepository,
                                          IGenealogyEdgeRepository genealogyEdgeRepository,
                                          IProductionRunRepository productionRunRepository,
                                          GenealogyTraversalDomainService genealogyTraversalDomainService,
                                          GenealogyQueryService genealogyQueryService) {
        this.lotRepository = lotRepository;
        this.genealogyEdgeRepository = genealogyEdgeRepository;
        this.productionRunRepository = productionRunRepository;
        this.genealogyTraversalDomainService = genealogyTraversalDomainService;
        this.genealogyQueryService = genealogyQueryService;
    }

    /**
     * Lot creation input. {@code productionRunId} and {@code stepIndex} are optional; a lot outside a
     * run is received stock.
     */
    public record CreateLotCommand(String lotCode,
                                   LotTypeEnum lotType,
                                   BigDecimal weightKg,
                                   BigDecimal temperatureC,
                                   Long productionRunId,
                                   Integer stepIndex,
                                   String operatorId,
                                   Map<String, Object> metadata) {
    }

    @Transactional(rollbackFor = Exception.class)
    public LotEntity createLot(CreateLotCommand command) {
        if (command == null) {
            throw new IllegalArgumentException("Create lot command cannot be null");
        }
        LotEntity lot = LotEntity.create(command.lotCode(), command.lotType(), command.weightKg(),
                command.temperatureC(), command.productionRunId(), command.stepIndex(), command.operatorId(),
                command.metadata());
        if (lotRepository.findByCode(lot.getLotCode()) != null) {
            throw new IllegalArgumentException("Lot code already exists: " + lot.getLotCode());
        }
        if (command.productionRunId() != null) {
            ProductionRunEntity run = productionRunRepository.findById(command.productionRunId());
            if (run == null) {
                throw new ResourceNotFoundException("ProductionRun", command.productionRunId());
            }
            if (lot.getStepIndex() >= run.getTotalSteps()) {
                throw new IllegalArgumentException("Step index " + lot.getStepIndex() + " is outside run "
                        + run.getRunCode() + " with " + run.getTotalSteps() + " steps");
            }
        }
        lotRepository.save(lot);
        log.info("Lot created. lotId={}, lotCode={}, lotType={}, runId={}, stepIndex={}",
                lot.getId(), lot.getLotCode(), lot.getLotType(), lot.getProductionRunId(), lot.getStepIndex());
        return lot;
    }

    /**
     * Moves the lot and drops cached traces, which hold lot snapshots.
     */
    @Transactional(rollbackFor = Exception.class)
    public LotEntity transition(Long lotId, LotStatusEnum target) {
        LotEntity lot = requireLot(lotId, true);
        LotStatusEnum previous = lot.getStatus();
        try {
            lot.transitionTo(target);
        } catch (RuntimeException ex) {
            log.warn("Lot transition rejected. lotId={}, from={}, to={}", lotId, previous, target);
            throw ex;
        }
        lotRepository.update(lot);
        genealogyQueryService.evictAll();
        log.info("Lot transitioned. lotId={}, lotCode={}, from={}, to={}", lotId, lot.getLotCode(), previous, target);
        return lot;
    }

    /**
     * Records that the child was made from each parent, one edge per parent.
     *
     * @param quantities kilograms used per parent, index-aligned with {@code parentIds}; may be null
     * @throws CycleDetectedException when a parent is the child itself or one of its descendants
     */
    @Transactional(rollbackFor = Exception.class)
    public List<GenealogyEdgeEntity> linkGenealogy(List<Long> parentIds, Long childId,
                                                   List<BigDecimal> quantities, String eventRef) {
        if (parentIds == null || parentIds.isEmpty()) {
            throw new IllegalArgumentException("At least one parent lot is required");
        }
        Set<Long> distinctParents = new LinkedHashSet<>(parentIds);
        if (distinctParents.contains(null)) {
            throw new IllegalArgumentException("Parent lot id cannot be null");
        }
        if (distinctParents.size() != parentIds.size()) {
            throw new IllegalArgumentException("Duplicate parent lots: " + parentIds);
        }
        if (quantities != null) {
            if (quantities.size() != parentIds.size()) {
                throw new IllegalArgumentException("Expected " + parentIds.size() + " quantities, got " + quantities.size());
            }
            for (BigDecimal quantity : quantities) {
                if (quantity != null && quantity.signum() < 0) {
                    throw new IllegalArgumentException("Quantity used cannot be negative: " + quantity);
                }
            }
        }

        genealogyEdgeRepository.lockForWrite();
        LotEntity child = requireLot(childId, false);
        if (distinctParents.contains(child.getId())) {
            throw new CycleDetectedException(child.getId(), child.getId());
        }
        List<LotEntity> parents = lotRepository.findByIds(distinctParents);
        if (parents.size() != distinctParents.size()) {
            throw new ResourceNotFoundException(LOT, parentIds);
        }
        Long closing = genealogyTraversalDomainService.findFirstDescendantAmong(child.getId(), distinctParents);
        if (closing != null) {
            log.warn("Genealogy link rejected, cycle. parentLotId={}, childLotId={}", closing, child.getId());
            throw new CycleDetectedException(closing, child.getId());
        }

        List<GenealogyEdgeEntity> edges = new ArrayList<>(parentIds.size());
        for (int i = 0; i < parentIds.size(); i++) {
            BigDecimal quantity = quantities == null ? null : quantities.get(i);
            edges.add(genealogyEdgeRepository.save(
                    GenealogyEdgeEntity.link(parentIds.get(i), child.getId(), quantity, eventRef)));
        }
        genealogyQueryService.evictAll();
        log.info("Genealogy linked. childLotId={}, childLotCode={}, parentLotIds={}, eventRef={}",
                child.getId(), child.getLotCode(), parentIds, eventRef);
        return edges;
    }

    public LotEntity getLot(Long lotId) {
        return requireLot(lotId, false);
    }

    /**
     * @return the lot, or null when no lot carries the code
     */
    public LotEntity findByCode(String lotCode) {
        if (StringUtils.isBlank(lotCode)) {
            return null;
        }
        return lotRepository.findByCode(lotCode.trim());
    }

    public List<LotEntity> listLotsByRun(Long runId) {
        return lotRepository.findByRunId(runId);
    }

    private LotEntity requireLot(Long lotId, boolean forUpdate) {
        LotEntity lot = null;
        if (lotId != null) {
            lot = forUpdate ? lotRepository.findByIdForUpdate(lotId) : lotRepository.findById(lotId);
        }
        if (lot == null) {
            throw new ResourceNotFoundException(LOT, lotId);
        }
        return lot;
    }
}
