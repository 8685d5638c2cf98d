package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;

/**
 * Step advance requested on a run that is not RUNNING, or for a step other than the current one.
 */
public class StepOutOfOrderException extends AppException {

    public StepOutOfOrderException(String message) {
        super(ResponseCode.STEP_OUT_OF_ORDER, message);
    }
}
