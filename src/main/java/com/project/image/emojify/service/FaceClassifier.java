package com.project.image.emojify.service;

import com.project.image.emojify.model.FaceAnnotation;

import java.util.List;

/** Face detection backend. */
public interface FaceClassifier {

    /**
     * Runs face detection on an image already in storage.
     *
     * @param imageUri storage URI of the image, e.g. {@code gs://bucket/face.jpg}
     * @return detected faces in provider order, possibly empty
     */
    List<FaceAnnotation> detectFaces(String imageUri);
}
