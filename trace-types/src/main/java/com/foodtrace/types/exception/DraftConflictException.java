package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;
import lombok.Getter;

/**
 * A definition can hold only one open draft.
 */
@Getter
public class DraftConflictException extends AppException {

    private final Long existingDraftId;

    public DraftConflictException(Long definitionId, Long existingDraftId) {
        super(ResponseCode.DRAFT_CONFLICT, ResponseCode.DRAFT_CONFLICT.getInfo()
                + ". definitionId=" + definitionId + ", draftId=" + existingDraftId);
        this.existingDraftId = existingDraftId;
    }
}
