package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;
import lombok.Getter;

/**
 * Requested status change is not in the entity's transition table.
 */
@Getter
public class IllegalTransitionException extends AppException {

    private final String entity;
    private final String from;
    private final String to;

    public IllegalTransitionException(String entity, Enum<?> from, Enum<?> to) {
        super(ResponseCode.ILLEGAL_TRANSITION, String.format("Illegal %s transition %s -> %s",
                entity, from == null ? null : from.name(), to == null ? null : to.name()));
        this.entity = entity;
        this.from = from == null ? null : from.name();
        this.to = to == null ? null : to.name();
    }
}
