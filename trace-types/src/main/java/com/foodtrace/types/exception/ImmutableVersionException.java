package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;

/**
 * Graph write attempted on a PUBLISHED or DEPRECATED version.
 */
public class ImmutableVersionException extends NotDraftException {

    public ImmutableVersionException(Long versionId, String status) {
        super(ResponseCode.IMMUTABLE_VERSION, versionId, status);
    }
}
