package com.project.image.emojify.exceptions;

/**
 * Error taxonomy of the emojify endpoint. The integer codes are part of the public
 * response contract and must not change.
 */
public enum ErrorCode {
    OTHER(100, "Other"),
    SLASHES_FORBIDDEN(101, "Slashes are intentionally forbidden in objectName."),
    BUCKET_MISSING(102, "storage.bucket.name is missing in application.properties."),
    BLOB_MISSING(103, "Blob specified doesn't exist in bucket."),
    CONTENT_TYPE_MISSING(104, "blob ContentType is null."),
    RESPONSE_COUNT(105, "Size of responsesList is not 1."),
    OBJECT_NAME_MISSING(106, "objectName is null."),
    NO_FACES(107, "We couldn't detect faces in your image.");

    private final int code;
    private final String defaultMessage;

    ErrorCode(int code, String defaultMessage) {
        this.code = code;
        this.defaultMessage = defaultMessage;
    }

    public int code() {
        return code;
    }

    public String defaultMessage() {
        return defaultMessage;
    }
}
