package com.project.image.emojify.service;

import com.google.cloud.storage.Blob;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.project.image.emojify.exceptions.EmojifyException;
import com.project.image.emojify.exceptions.ErrorCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.Optional;

/** {@link ObjectStore} backed by Google Cloud Storage. */
@Service
public class GcsObjectStore implements ObjectStore {
    private static final Logger log = LoggerFactory.getLogger(GcsObjectStore.class);

    private final Storage storage;

    public GcsObjectStore(Storage storage) {
        this.storage = storage;
    }

    @Override
    public boolean bucketExists(String bucket) {
        try {
            return storage.get(bucket) != null;
        } catch (StorageException e) {
            throw providerFault("Bucket lookup failed for " + bucket, e);
        }
    }

    @Override
    public Optional<StoredObject> find(String bucket, String name) {
        try {
            Blob blob = storage.get(BlobId.of(bucket, name));
            if (blob == null) {
                return Optional.empty();
            }
            return Optional.of(new StoredObject(blob.getName(), blob.getContentType()));
        } catch (StorageException e) {
            throw providerFault("Blob lookup failed for " + bucket + "/" + name, e);
        }
    }

    @Override
    public byte[] read(String bucket, String name) {
        try {
            byte[] content = storage.readAllBytes(BlobId.of(bucket, name));
            log.debug("Read {} bytes from gs://{}/{}", content.length, bucket, name);
            return content;
        } catch (StorageException e) {
            throw providerFault("Download failed for " + bucket + "/" + name, e);
        }
    }

    @Override
    public void write(String bucket, String name, byte[] content, String contentType, boolean publicRead) {
        BlobInfo info = BlobInfo.newBuilder(BlobId.of(bucket, name))
                .setContentType(contentType)
                .build();
        try {
            if (publicRead) {
                storage.create(info, content, Storage.BlobTargetOption.predefinedAcl(Storage.PredefinedAcl.PUBLIC_READ));
            } else {
                storage.create(info, content);
            }
            log.info("Uploaded {} bytes to gs://{}/{} (publicRead={})", content.length, bucket, name, publicRead);
        } catch (StorageException e) {
            throw providerFault("Upload failed for " + bucket + "/" + name, e);
        }
    }

    private static EmojifyException providerFault(String context, StorageException e) {
        log.warn("{}: {}", context, e.getMessage());
        return new EmojifyException(ErrorCode.OTHER, HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
    }
}
