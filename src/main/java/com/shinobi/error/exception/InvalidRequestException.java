package com.shinobi.error.exception;

import com.shinobi.error.ErrorCode;

public class InvalidRequestException extends BaseException {

    public InvalidRequestException(ErrorCode errorCode, Object... args) {
        super(errorCode, args);
    }

    public InvalidRequestException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(errorCode, cause, args);
    }
}
