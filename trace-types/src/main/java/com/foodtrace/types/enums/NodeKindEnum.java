package com.foodtrace.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of a flow graph node.
 */
public enum NodeKindEnum {

    START("start"),

    END("end"),

    PROCESS("process"),

    QC_GATE("qc_gate"),

    BUFFER("buffer"),

    /**
     * Rework station; the only kind whose outgoing edges may loop back.
     */
    REWORK("rework"),

    /**
     * Layout container, not executed and never connected by edges.
     */
    GROUP("group");

    private final String code;

    NodeKindEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public boolean isContainer() {
        return this == GROUP;
    }

    public boolean permitsLoopBack() {
        return this == REWORK;
    }

    public static NodeKindEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (NodeKindEnum value : NodeKindEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown node kind: " + text);
    }
}
