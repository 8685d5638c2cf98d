/**
 * Lot domain: lot lifecycle and the append-only, acyclic genealogy graph between lots.
 *
 * <p>{@link com.foodtrace.domain.lot.service.LotTransitionPolicy} is the single source of legal
 * status moves; {@link com.foodtrace.domain.lot.service.GenealogyTraversalDomainService} answers
 * bounded lineage queries and the reachability check used before linking.</p>
 */
package com.foodtrace.domain.lot;
