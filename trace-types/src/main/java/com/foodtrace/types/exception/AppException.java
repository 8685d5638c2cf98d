package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;
import lombok.Getter;

/**
 * Base of every traceability error. Carries the {@link ResponseCode} so callers can map failures
 * to their own transport without parsing messages.
 */
@Getter
public class AppException extends RuntimeException {

    private static final long serialVersionUID = 5317680961212299217L;

    private final ResponseCode responseCode;

    /** Detail shown to the caller, defaults to the code's info. */
    private final String info;

    public AppException(ResponseCode responseCode, String info) {
        this(responseCode, info, null);
    }

    public AppException(ResponseCode responseCode, String info, Throwable cause) {
        super(info == null ? responseCode.getInfo() : info, cause);
        this.responseCode = responseCode;
        this.info = info == null ? responseCode.getInfo() : info;
    }

    public String getCode() {
        return responseCode.getCode();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{code='" + getCode() + "', info='" + info + "'}";
    }
}
