package com.foodtrace.domain.flow.model.valobj;

import org.apache.commons.lang3.StringUtils;

/**
 * Directed edge between two node ids. Endpoints are checked by graph validation, not here.
 */
public record FlowEdge(String id, String source, String target) {

    public FlowEdge {
        if (StringUtils.isBlank(id)) {
            throw new IllegalArgumentException("Edge id cannot be blank");
        }
    }

    public static FlowEdge of(String id, String source, String target) {
        return new FlowEdge(id, source, target);
    }
}
