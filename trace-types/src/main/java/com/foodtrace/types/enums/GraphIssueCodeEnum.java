package com.foodtrace.types.enums;

/**
 * Reason codes reported by flow graph validation.
 */
public enum GraphIssueCodeEnum {
    MISSING_START,
    MISSING_END,
    NO_INCOMING_EDGE,
    NO_OUTGOING_EDGE,
    UNKNOWN_EDGE_SOURCE,
    UNKNOWN_EDGE_TARGET,
    EDGE_ON_CONTAINER,
    CYCLE_DETECTED,
    DUPLICATE_NODE_ID,
    DUPLICATE_EDGE_ID,
    UNKNOWN_PARENT,
    INVALID_NODE_CONFIG
}
