package com.shinobi.error.exception;

import com.shinobi.error.ErrorCode;

public class InternalServerException extends BaseException {

    public InternalServerException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(errorCode, cause, args);
    }
}
