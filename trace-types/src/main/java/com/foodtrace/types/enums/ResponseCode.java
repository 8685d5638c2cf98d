package com.foodtrace.types.enums;

import lombok.Getter;

/**
 * Response codes carried by every {@link com.foodtrace.types.exception.AppException}.
 */
@Getter
public enum ResponseCode {

    UN_ERROR("0001", "Unknown failure"),

    ILLEGAL_PARAMETER("0002", "Illegal parameter"),

    RESOURCE_NOT_FOUND("0003", "Resource not found"),

    CONCURRENT_MODIFICATION("0004", "Concurrent modification, retry the operation"),

    GRAPH_INVALID("1001", "Flow graph is structurally invalid"),

    NOT_DRAFT("1002", "Flow version is not a draft"),

    IMMUTABLE_VERSION("1003", "Flow version is immutable"),

    DRAFT_CONFLICT("1004", "Flow definition already has an open draft"),

    VERSION_NOT_PUBLISHED("1005", "Flow version is not published"),

    STEP_OUT_OF_ORDER("2001", "Run step out of order"),

    STEP_BLOCKED("2002", "Run step blocked by a QC gate"),

    ILLEGAL_TRANSITION("3001", "Illegal status transition"),

    CYCLE_DETECTED("3002", "Genealogy cycle detected"),

    NOTES_REQUIRED("4001", "QC notes required");

    private final String code;
    private final String info;

    ResponseCode(String code, String info) {
        this.code = code;
        this.info = info;
    }

}
