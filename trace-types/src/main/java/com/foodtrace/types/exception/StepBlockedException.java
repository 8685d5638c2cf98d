package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;
import lombok.Getter;

import java.util.List;

/**
 * The current step holds lots with an unresolved non-PASS decision from a blocking gate.
 */
@Getter
public class StepBlockedException extends AppException {

    private final Long runId;
    private final int stepIndex;
    private final List<String> blockingLotCodes;

    public StepBlockedException(Long runId, int stepIndex, List<String> blockingLotCodes) {
        super(ResponseCode.STEP_BLOCKED, ResponseCode.STEP_BLOCKED.getInfo()
                + ". runId=" + runId + ", stepIndex=" + stepIndex + ", lots=" + blockingLotCodes);
        this.runId = runId;
        this.stepIndex = stepIndex;
        this.blockingLotCodes = blockingLotCodes == null ? List.of() : List.copyOf(blockingLotCodes);
    }
}
