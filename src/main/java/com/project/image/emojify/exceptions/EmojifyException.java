package com.project.image.emojify.exceptions;

import org.springframework.http.HttpStatus;

/** Domain-specific exception for a request that cannot be emojified. */
public class EmojifyException extends RuntimeException {
    private final ErrorCode errorCode;
    private final HttpStatus status;

    public EmojifyException(ErrorCode errorCode, HttpStatus status) {
        this(errorCode, status, errorCode.defaultMessage());
    }

    public EmojifyException(ErrorCode errorCode, HttpStatus status, String message) {
        super(message != null ? message : errorCode.defaultMessage());
        this.errorCode = errorCode;
        this.status = status;
    }

    public EmojifyException(ErrorCode errorCode, HttpStatus status, String message, Throwable cause) {
        super(message != null ? message : errorCode.defaultMessage(), cause);
        this.errorCode = errorCode;
        this.status = status;
    }

    public ErrorCode getErrorCode() { return errorCode; }

    public HttpStatus getStatus() { return status; }
}
