package com.foodtrace.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of a QC inspection.
 */
public enum QcDecisionEnum {

    PASS("pass"),
    HOLD("hold"),
    FAIL("fail");

    private final String code;

    QcDecisionEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static QcDecisionEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (QcDecisionEnum value : QcDecisionEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown qc decision: " + text);
    }

    /**
     * HOLD and FAIL must be justified with notes.
     */
    public boolean requiresNotes() {
        return this != PASS;
    }

    /**
     * Lot status a decision drives the inspected lot into.
     */
    public LotStatusEnum targetLotStatus() {
        return switch (this) {
            case PASS -> LotStatusEnum.RELEASED;
            case HOLD -> LotStatusEnum.HOLD;
            case FAIL -> LotStatusEnum.REJECTED;
        };
    }
}
