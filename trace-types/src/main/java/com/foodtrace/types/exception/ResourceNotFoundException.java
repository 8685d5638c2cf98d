package com.foodtrace.types.exception;

import com.foodtrace.types.enums.ResponseCode;

public class ResourceNotFoundException extends AppException {

    public ResourceNotFoundException(String resource, Object key) {
        super(ResponseCode.RESOURCE_NOT_FOUND, resource + " not found: " + key);
    }
}
