package com.project.image.emojify.service;

import com.google.api.gax.rpc.ApiException;
import com.google.cloud.vision.v1.AnnotateImageRequest;
import com.google.cloud.vision.v1.AnnotateImageResponse;
import com.google.cloud.vision.v1.BatchAnnotateImagesResponse;
import com.google.cloud.vision.v1.Feature;
import com.google.cloud.vision.v1.Image;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import com.google.cloud.vision.v1.ImageSource;
import com.project.image.emojify.config.EmojifyProperties;
import com.project.image.emojify.exceptions.EmojifyException;
import com.project.image.emojify.exceptions.ErrorCode;
import com.project.image.emojify.model.FaceAnnotation;
import com.project.image.emojify.model.Likelihood;
import com.project.image.emojify.model.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;

import java.util.List;

/** {@link FaceClassifier} backed by the Cloud Vision FACE_DETECTION feature. */
@Service
public class VisionFaceClassifier implements FaceClassifier {
    private static final Logger log = LoggerFactory.getLogger(VisionFaceClassifier.class);

    private final ImageAnnotatorClient vision;
    private final int maxResults;

    public VisionFaceClassifier(ImageAnnotatorClient vision, EmojifyProperties properties) {
        this.vision = vision;
        this.maxResults = properties.maxResults();
    }

    @Override
    public List<FaceAnnotation> detectFaces(String imageUri) {
        // The image is referenced by URI; Vision reads it from storage directly.
        Image image = Image.newBuilder()
                .setSource(ImageSource.newBuilder().setGcsImageUri(imageUri).build())
                .build();
        Feature feature = Feature.newBuilder()
                .setType(Feature.Type.FACE_DETECTION)
                .setMaxResults(maxResults)
                .build();
        AnnotateImageRequest request = AnnotateImageRequest.newBuilder()
                .addFeatures(feature)
                .setImage(image)
                .build();

        BatchAnnotateImagesResponse batch;
        try {
            batch = vision.batchAnnotateImages(List.of(request));
        } catch (ApiException e) {
            log.warn("Vision call failed for {}: {}", imageUri, e.getMessage());
            throw new EmojifyException(ErrorCode.OTHER, HttpStatus.INTERNAL_SERVER_ERROR, e.getMessage(), e);
        }

        if (batch.getResponsesCount() != 1) {
            throw new EmojifyException(ErrorCode.RESPONSE_COUNT, HttpStatus.INTERNAL_SERVER_ERROR);
        }
        AnnotateImageResponse response = batch.getResponses(0);
        if (response.hasError()) {
            throw new EmojifyException(ErrorCode.OTHER, HttpStatus.INTERNAL_SERVER_ERROR, response.getError().getMessage());
        }

        log.debug("Vision found {} faces in {}", response.getFaceAnnotationsCount(), imageUri);
        return response.getFaceAnnotationsList().stream()
                .map(VisionFaceClassifier::toFaceAnnotation)
                .toList();
    }

    static FaceAnnotation toFaceAnnotation(com.google.cloud.vision.v1.FaceAnnotation face) {
        List<Vertex> poly = face.getFdBoundingPoly().getVerticesList().stream()
                .map(v -> new Vertex(v.getX(), v.getY()))
                .toList();
        return new FaceAnnotation(
                toLikelihood(face.getJoyLikelihood()),
                toLikelihood(face.getAngerLikelihood()),
                toLikelihood(face.getSurpriseLikelihood()),
                toLikelihood(face.getSorrowLikelihood()),
                toLikelihood(face.getHeadwearLikelihood()),
                poly
        );
    }

    static Likelihood toLikelihood(com.google.cloud.vision.v1.Likelihood likelihood) {
        return switch (likelihood) {
            case VERY_UNLIKELY -> Likelihood.VERY_UNLIKELY;
            case UNLIKELY -> Likelihood.UNLIKELY;
            case POSSIBLE -> Likelihood.POSSIBLE;
            case LIKELY -> Likelihood.LIKELY;
            case VERY_LIKELY -> Likelihood.VERY_LIKELY;
            default -> Likelihood.UNKNOWN;
        };
    }
}
