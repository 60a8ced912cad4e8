package com.project.image.emojify.service;

import com.project.image.emojify.config.EmojifyProperties;
import com.project.image.emojify.model.Emoji;
import com.project.image.emojify.model.FaceAnnotation;
import com.project.image.emojify.model.Vertex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Draws one emoji per detected face onto the request's image.
 */
@Service
public class FaceCompositor {
    private static final Logger log = LoggerFactory.getLogger(FaceCompositor.class);

    private final EmojiSelector selector;
    private final boolean hatLayering;

    public FaceCompositor(EmojiSelector selector, EmojifyProperties properties) {
        this.selector = selector;
        this.hatLayering = properties.hatLayering();
    }

    /**
     * Draws onto {@code image} in place, in annotation order, and returns it.
     *
     * <p>The box comes from the classifier's vertex order, not from a min/max bounding box:
     * width is {@code x[1] - x[0]}, height is {@code y[2] - y[0]} and the anchor is
     * {@code (x[0], y[1])}. Overlapping faces are not guarded against; the later one wins.
     */
    public BufferedImage composite(BufferedImage image, List<FaceAnnotation> annotations, EmojiAssetTable emojis) {
        Graphics2D graphics = image.createGraphics();
        try {
            graphics.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            for (FaceAnnotation annotation : annotations) {
                List<Vertex> poly = annotation.boundingPoly();
                if (poly.size() < 4) {
                    log.warn("Skipping face with {} bounding vertices", poly.size());
                    continue;
                }
                int x = poly.get(0).x();
                int y = poly.get(1).y();
                int width = poly.get(1).x() - poly.get(0).x();
                int height = poly.get(2).y() - poly.get(0).y();

                Emoji emoji = selector.selectEmotionEmoji(annotation);
                log.debug("Drawing {} at ({}, {}) size {}x{}", emoji, x, y, width, height);
                graphics.drawImage(emojis.get(emoji), x, y, width, height, null);

                if (hatLayering && selector.selectHatOverlay(annotation)) {
                    log.debug("Layering hat at ({}, {})", x, y);
                    graphics.drawImage(emojis.get(Emoji.HAT), x, y, width, height, null);
                }
            }
        } finally {
            graphics.dispose();
        }
        return image;
    }
}
