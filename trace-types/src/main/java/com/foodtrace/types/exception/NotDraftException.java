package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;
import lombok.Getter;

/**
 * Graph write attempted on a version that is not DRAFT.
 */
@Getter
public class NotDraftException extends AppException {

    private final Long versionId;

    public NotDraftException(Long versionId, String status) {
        this(ResponseCode.NOT_DRAFT, versionId, status);
    }

    protected NotDraftException(ResponseCode responseCode, Long versionId, String status) {
        super(responseCode, responseCode.getInfo() + ". versionId=" + versionId + ", status=" + status);
        this.versionId = versionId;
    }
}
