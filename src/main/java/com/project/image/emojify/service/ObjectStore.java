package com.project.image.emojify.service;

import java.util.Optional;

/**
 * Blob storage as seen by the emojify flow. Implementations report provider faults as
 * {@link com.project.image.emojify.exceptions.EmojifyException}.
 */
public interface ObjectStore {

    boolean bucketExists(String bucket);

    /** Metadata of {@code name}, or empty when the object does not exist. */
    Optional<StoredObject> find(String bucket, String name);

    byte[] read(String bucket, String name);

    void write(String bucket, String name, byte[] content, String contentType, boolean publicRead);

    record StoredObject(String name, String contentType) {}
}
