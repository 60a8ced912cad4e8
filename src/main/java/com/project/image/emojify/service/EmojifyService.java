package com.project.image.emojify.service;

import com.project.image.emojify.DTOs.EmojifyResult;
import com.project.image.emojify.config.EmojifyProperties;
import com.project.image.emojify.exceptions.EmojifyException;
import com.project.image.emojify.exceptions.ErrorCode;
import com.project.image.emojify.model.FaceAnnotation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.List;
import javax.imageio.ImageIO;

/**
 * Runs one emojify request: validate, look up the blob, detect faces, draw the
 * overlays and publish the result. Every failure ends up as a failure
 * {@link EmojifyResult}; nothing is retried.
 */
@Service
public class EmojifyService {
    private static final Logger log = LoggerFactory.getLogger(EmojifyService.class);

    private final ObjectStore objectStore;
    private final FaceClassifier faceClassifier;
    private final FaceCompositor compositor;
    private final EmojiAssetTable emojis;
    private final EmojifyProperties properties;
    private final String bucketName;

    public EmojifyService(ObjectStore objectStore,
                          FaceClassifier faceClassifier,
                          FaceCompositor compositor,
                          EmojiAssetTable emojis,
                          EmojifyProperties properties,
                          @Value("${storage.bucket.name}") String bucketName) {
        this.objectStore = objectStore;
        this.faceClassifier = faceClassifier;
        this.compositor = compositor;
        this.emojis = emojis;
        this.properties = properties;
        this.bucketName = bucketName;
    }

    public EmojifyResult emojify(String objectName) {
        try {
            return process(objectName);
        } catch (EmojifyException e) {
            log.error("Emojify failed for objectName={}: [{}] {}", objectName, e.getErrorCode().code(), e.getMessage());
            return EmojifyResult.failure(e.getStatus(), e.getErrorCode(), e.getMessage());
        }
    }

    private EmojifyResult process(String objectName) {
        if (objectName == null || objectName.isEmpty()) {
            throw new EmojifyException(ErrorCode.OBJECT_NAME_MISSING, HttpStatus.BAD_REQUEST);
        }
        if (objectName.contains("/")) {
            throw new EmojifyException(ErrorCode.SLASHES_FORBIDDEN, HttpStatus.BAD_REQUEST);
        }
        if (bucketName == null || bucketName.isBlank() || !objectStore.bucketExists(bucketName)) {
            throw new EmojifyException(ErrorCode.BUCKET_MISSING, HttpStatus.INTERNAL_SERVER_ERROR);
        }
        log.info("Emojifying gs://{}/{}", bucketName, objectName);

        ObjectStore.StoredObject blob = objectStore.find(bucketName, objectName)
                .orElseThrow(() -> new EmojifyException(ErrorCode.BLOB_MISSING, HttpStatus.BAD_REQUEST));
        String contentType = blob.contentType();
        if (contentType == null || contentType.isBlank()) {
            throw new EmojifyException(ErrorCode.CONTENT_TYPE_MISSING, HttpStatus.BAD_REQUEST);
        }
        String imageType = contentType.substring(contentType.indexOf('/') + 1);
        log.debug("Found {} with content type {}", blob.name(), contentType);

        List<FaceAnnotation> faces = faceClassifier.detectFaces("gs://" + bucketName + "/" + objectName);
        if (faces.isEmpty()) {
            throw new EmojifyException(ErrorCode.NO_FACES, HttpStatus.BAD_REQUEST);
        }
        log.info("Detected {} faces in {}", faces.size(), blob.name());

        BufferedImage image = decode(objectStore.read(bucketName, objectName));
        compositor.composite(image, faces, emojis);
        byte[] encoded = encode(image, imageType);

        String objectPath = properties.outputPrefix() + objectName;
        objectStore.write(bucketName, objectPath, encoded, contentType, true);

        String publicUrl = String.format(properties.publicUrlTemplate(), bucketName, objectPath);
        log.info("Emojified {} -> {}", objectName, publicUrl);
        return EmojifyResult.success(objectPath, publicUrl);
    }

    private static BufferedImage decode(byte[] content) {
        try {
            BufferedImage image = ImageIO.read(new ByteArrayInputStream(content));
            if (image == null) {
                throw new EmojifyException(ErrorCode.OTHER, HttpStatus.INTERNAL_SERVER_ERROR,
                        "Stored object is not a readable image.");
            }
            return image;
        } catch (IOException e) {
            throw new EmojifyException(ErrorCode.OTHER, HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }
    }

    private static byte[] encode(BufferedImage image, String imageType) {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            if (!ImageIO.write(image, imageType, out)) {
                throw new EmojifyException(ErrorCode.OTHER, HttpStatus.INTERNAL_SERVER_ERROR,
                        "No image writer for type " + imageType + ".");
            }
            return out.toByteArray();
        } catch (IOException e) {
            throw new EmojifyException(ErrorCode.OTHER, HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }
    }
}
