package com.foodtrace.types.common;

import com.foodtrace.types.enums.GraphIssueCodeEnum;

/**
 * One structural problem found in a flow graph.
 *
 * @param elementId id of the offending node or edge, null for graph-level issues
 * @param code      machine-readable reason
 * @param message   human-readable detail
 */
public record GraphValidationIssue(String elementId, GraphIssueCodeEnum code, String message) {

    public static GraphValidationIssue of(String elementId, GraphIssueCodeEnum code, String message) {
        return new GraphValidationIssue(elementId, code, message);
    }

    @Override
    public String toString() {
        return code + (elementId == null ? "" : "[" + elementId + "]") + ": " + message;
    }
}
