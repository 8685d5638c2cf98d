/**
 * Flow domain: versioned production process graphs.
 *
 * <h3>Aggregates</h3>
 * <ul>
 *   <li>{@link com.foodtrace.domain.flow.model.entity.FlowDefinitionEntity} owns its versions and the version counter</li>
 *   <li>{@link com.foodtrace.domain.flow.model.entity.FlowVersionEntity} holds one immutable-once-published graph</li>
 * </ul>
 *
 * <h3>Domain services</h3>
 * <ul>
 *   <li>FlowGraphPolicyService - structural validation, step count, canonical step order</li>
 *   <li>FlowGraphDocumentParser - editor JSON document to typed graph and back</li>
 * </ul>
 */
package com.foodtrace.domain.flow;
