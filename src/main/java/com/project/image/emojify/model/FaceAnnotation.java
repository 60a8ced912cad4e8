package com.project.image.emojify.model;

import java.util.List;

/**
 * One detected face.
 *
 * @param boundingPoly vertices clockwise from top-left, as returned by the classifier
 */
public record FaceAnnotation(
        Likelihood joy,
        Likelihood anger,
        Likelihood surprise,
        Likelihood sorrow,
        Likelihood headwear,
        List<Vertex> boundingPoly
) {
    public FaceAnnotation {
        boundingPoly = List.copyOf(boundingPoly);
    }
}
