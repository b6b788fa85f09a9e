package com.shinobi.error.exception;

import com.shinobi.error.ErrorCode;

public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String resource) {
        super(ErrorCode.RESOURCE_NOT_FOUND, resource);
    }
}
