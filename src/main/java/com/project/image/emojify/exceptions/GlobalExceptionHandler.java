package com.project.image.emojify.exceptions;

import com.project.image.emojify.DTOs.EmojifyResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.mvc.method.annotation.ResponseEntityExceptionHandler;

/**
 * Last-resort mapping of exceptions that escape a controller onto the emojify
 * response envelope. Spring MVC's own exceptions (unknown path, wrong method, ...)
 * keep their framework status through {@link ResponseEntityExceptionHandler}.
 */
@RestControllerAdvice
public class GlobalExceptionHandler extends ResponseEntityExceptionHandler {
    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler(Exception.class)
    public ResponseEntity<EmojifyResult> handleUnknownException(Exception ex) {
        log.error("Unhandled error occurred", ex);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR)
                .body(EmojifyResult.failure(HttpStatus.INTERNAL_SERVER_ERROR, ErrorCode.OTHER, ex.getMessage()));
    }
}
