package com.foodtrace.types.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * QC gate type. BLOCKING gates stop run progression on a non-PASS decision.
 */
public enum QcGateTypeEnum {

    CHECKPOINT("checkpoint"),
    BLOCKING("blocking"),
    INFO("info");

    private final String code;

    QcGateTypeEnum(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public static QcGateTypeEnum fromText(String text) {
        if (text == null) {
            return null;
        }
        String normalized = text.trim();
        if (normalized.isEmpty()) {
            return null;
        }
        for (QcGateTypeEnum value : QcGateTypeEnum.values()) {
            if (value.code.equalsIgnoreCase(normalized) || value.name().equalsIgnoreCase(normalized)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown qc gate type: " + text);
    }
}
