package com.shinobi.error.exception;

import com.shinobi.error.ErrorCode;
import lombok.Getter;

/**
 * Domain failure whose message is safe to return to the client.
 */
@Getter
public abstract class BaseException extends RuntimeException {

    private final ErrorCode errorCode;

    protected BaseException(ErrorCode errorCode, Object... args) {
        super(errorCode.format(args));
        this.errorCode = errorCode;
    }

    protected BaseException(ErrorCode errorCode, Throwable cause, Object... args) {
        super(errorCode.format(args), cause);
        this.errorCode = errorCode;
    }
}
