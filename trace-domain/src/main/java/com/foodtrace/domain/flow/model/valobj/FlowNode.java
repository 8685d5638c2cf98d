package com.foodtrace.domain.flow.model.valobj;

import com.foodtrace.types.enums.NodeKindEnum;
import org.apache.commons.lang3.StringUtils;

/**
 * One node of a flow graph.
 *
 * @param parentId id of the enclosing GROUP node, null when top level
 */
public record FlowNode(String id, NodeKindEnum kind, String label, NodeConfig config, String parentId) {

    public FlowNode {
        if (StringUtils.isBlank(id)) {
            throw new IllegalArgumentException("Node id cannot be blank");
        }
        if (kind == null) {
            throw new IllegalArgumentException("Node kind cannot be null. nodeId=" + id);
        }
        if (config == null) {
            config = NodeConfig.defaultFor(kind);
        }
        if (!config.appliesTo(kind)) {
            throw new IllegalArgumentException("Config " + config.getClass().getSimpleName()
                    + " is not allowed for node kind " + kind + ". nodeId=" + id);
        }
        parentId = StringUtils.trimToNull(parentId);
    }

    public static FlowNode of(String id, NodeKindEnum kind, String label) {
        return new FlowNode(id, kind, label, null, null);
    }

    public static FlowNode of(String id, NodeKindEnum kind, String label, NodeConfig config) {
        return new FlowNode(id, kind, label, config, null);
    }
}
