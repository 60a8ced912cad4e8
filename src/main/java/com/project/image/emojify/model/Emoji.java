package com.project.image.emojify.model;

/**
 * Overlay categories. The four emotions and HAT are independent axes, but only one
 * overlay is picked per face so they share one enumeration.
 */
public enum Emoji {
    JOY("joy.png"),
    ANGER("anger.png"),
    SURPRISE("surprise.png"),
    SORROW("sorrow.png"),
    HAT("hat.png"),
    NONE("none.png");

    private final String assetName;

    Emoji(String assetName) {
        this.assetName = assetName;
    }

    public String assetName() {
        return assetName;
    }
}
