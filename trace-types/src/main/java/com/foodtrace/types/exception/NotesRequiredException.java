package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;

public class NotesRequiredException extends AppException {

    public NotesRequiredException(String decision, int minLength) {
        super(ResponseCode.NOTES_REQUIRED, "Notes of at least " + minLength
                + " characters are required for decision " + decision);
    }
}
