package com.foodtrace.types.enums;

/**
 * Genealogy traversal direction.
 */
public enum TraceDirectionEnum {

    /**
     * Child to parents, towards raw materials.
     */
    BACKWARD,

    /**
     * Parent to children, towards finished goods.
     */
    FORWARD
}
