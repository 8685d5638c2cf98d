package com.foodtrace.trigger.application.query;

import com.foodtrace.domain.lot.adapter.repository.ILotRepository;
import com.foodtrace.domain.lot.model.entity.LotEntity;
import com.foodtrace.domain.lot.model.valobj.GenealogyTrace;
import com.foodtrace.domain.lot.model.valobj.ImmediateLineage;
import com.foodtrace.domain.lot.service.GenealogyTraversalDomainService;
import com.foodtrace.types.enums.TraceDirectionEnum;
import com.foodtrace.types.exception.ResourceNotFoundException;
import com.google.common.cache.Cache;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

/**
 * Recall queries over the lot genealogy. Deep traces are cached until the next genealogy link or
 * lot status change.
 */
@Slf4j
@Service
public class GenealogyQueryService {

    private final GenealogyTraversalDomainService genealogyTraversalDomainService;
    private final ILotRepository lotRepository;
    private final Cache<String, GenealogyTrace> genealogyTraceCache;

    @Value("${trace.genealogy.max-depth:10}")
    private int maxDepthLimit = 10;

    public GenealogyQueryService(GenealogyTraversalDomainService genealogyTraversalDomainService,
                                 ILotRepository lotRepository,
                                 @Qualifier("genealogyTraceCache") Cache<String, GenealogyTrace> genealogyTraceCache) {
        this.genealogyTraversalDomainService = genealogyTraversalDomainService;
        this.lotRepository = lotRepository;
        this.genealogyTraceCache = genealogyTraceCache;
    }

    /**
     * Ancestors of the lot, up to {@code maxDepth} levels.
     */
    public GenealogyTrace traceBackward(Long lotId, int maxDepth) {
        return trace(lotId, TraceDirectionEnum.BACKWARD, maxDepth);
    }

    /**
     * Descendants of the lot, up to {@code maxDepth} levels.
     */
    public GenealogyTrace traceForward(Long lotId, int maxDepth) {
        return trace(lotId, TraceDirectionEnum.FORWARD, maxDepth);
    }

    /**
     * Direct parents and children of the lot with the given code.
     */
    public ImmediateLineage traceImmediate(String lotCode) {
        if (StringUtils.isBlank(lotCode)) {
            throw new IllegalArgumentException("Lot code cannot be blank");
        }
        LotEntity central = lotRepository.findByCode(lotCode.trim());
        if (central == null) {
            throw new ResourceNotFoundException("Lot", lotCode);
        }
        return genealogyTraversalDomainService.immediate(central);
    }

    /**
     * Drops every cached trace now and, inside a transaction, once more after commit so that a
     * concurrent reader cannot repopulate the cache with pre-commit data.
     */
    public void evictAll() {
        genealogyTraceCache.invalidateAll();
        if (TransactionSynchronizationManager.isSynchronizationActive()) {
            TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
                @Override
                public void afterCommit() {
                    genealogyTraceCache.invalidateAll();
                }
            });
        }
    }

    private GenealogyTrace trace(Long lotId, TraceDirectionEnum direction, int maxDepth) {
        if (maxDepth < 1 || maxDepth > maxDepthLimit) {
            throw new IllegalArgumentException("maxDepth must be within [1, " + maxDepthLimit + "]: " + maxDepth);
        }
        if (lotId == null) {
            throw new IllegalArgumentException("Lot id cannot be null");
        }
        String cacheKey = direction.name() + ":" + lotId + ":" + maxDepth;
        GenealogyTrace cached = genealogyTraceCache.getIfPresent(cacheKey);
        if (cached != null) {
            log.debug("Genealogy trace cache hit. key={}", cacheKey);
            return cached;
        }
        LotEntity root = lotRepository.findById(lotId);
        if (root == null) {
            throw new ResourceNotFoundException("Lot", lotId);
        }
        GenealogyTrace trace = genealogyTraversalDomainService.trace(root, direction, maxDepth);
        genealogyTraceCache.put(cacheKey, trace);
        return trace;
    }
}
