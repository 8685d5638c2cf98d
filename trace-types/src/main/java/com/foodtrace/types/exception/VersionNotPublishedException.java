package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;

public class VersionNotPublishedException extends AppException {

    public VersionNotPublishedException(Long versionId, String status) {
        super(ResponseCode.VERSION_NOT_PUBLISHED, ResponseCode.VERSION_NOT_PUBLISHED.getInfo()
                + ". versionId=" + versionId + ", status=" + status);
    }
}
