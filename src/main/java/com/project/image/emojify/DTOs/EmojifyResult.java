package com.project.image.emojify.DTOs;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.project.image.emojify.exceptions.ErrorCode;
import org.springframework.http.HttpStatus;

/**
 * Response body of {@code GET /emojify}. Either the success pair
 * ({@code objectPath}, {@code emojifiedUrl}) or the failure pair
 * ({@code errorCode}, {@code errorMessage}) is set, never both.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EmojifyResult(
        String objectPath,
        String emojifiedUrl,
        int statusCode,
        Integer errorCode,
        String errorMessage
) {
    public static EmojifyResult success(String objectPath, String emojifiedUrl) {
        return new EmojifyResult(objectPath, emojifiedUrl, HttpStatus.OK.value(), null, null);
    }

    public static EmojifyResult failure(HttpStatus status, ErrorCode errorCode, String message) {
        String msg = message != null ? message : errorCode.defaultMessage();
        return new EmojifyResult(null, null, status.value(), errorCode.code(), msg);
    }

    @JsonIgnore
    public boolean isSuccess() {
        return errorCode == null;
    }
}
