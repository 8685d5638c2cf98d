package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;
import lombok.Getter;

/**
 * Linking the parent to the child would make a lot reachable from itself.
 */
@Getter
public class CycleDetectedException extends AppException {

    private final Long parentLotId;
    private final Long childLotId;

    public CycleDetectedException(Long parentLotId, Long childLotId) {
        super(ResponseCode.CYCLE_DETECTED, ResponseCode.CYCLE_DETECTED.getInfo()
                + ". parentLotId=" + parentLotId + ", childLotId=" + childLotId);
        this.parentLotId = parentLotId;
        this.childLotId = childLotId;
    }
}
