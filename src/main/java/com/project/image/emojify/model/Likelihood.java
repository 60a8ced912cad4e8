package com.project.image.emojify.model;

/** Classifier confidence for a single face attribute. */
public enum Likelihood {
    UNKNOWN,
    VERY_UNLIKELY,
    UNLIKELY,
    POSSIBLE,
    LIKELY,
    VERY_LIKELY
}
