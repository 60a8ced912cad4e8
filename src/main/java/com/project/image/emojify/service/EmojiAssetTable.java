package com.project.image.emojify.service;

import com.project.image.emojify.model.Emoji;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.ClassPathResource;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import javax.imageio.ImageIO;

/**
 * Overlay image for every {@link Emoji}. Built once at startup and only read afterwards,
 * so it is shared by all requests without locking.
 */
public final class EmojiAssetTable {
    private static final Logger log = LoggerFactory.getLogger(EmojiAssetTable.class);

    private final Map<Emoji, BufferedImage> images;

    public EmojiAssetTable(Map<Emoji, BufferedImage> images) {
        EnumMap<Emoji, BufferedImage> copy = new EnumMap<>(Emoji.class);
        for (Emoji emoji : Emoji.values()) {
            BufferedImage image = images.get(emoji);
            if (image == null) {
                throw new IllegalArgumentException("No overlay image for " + emoji);
            }
            copy.put(emoji, image);
        }
        this.images = Collections.unmodifiableMap(copy);
    }

    /**
     * Reads {@code <location><emoji asset name>} for each emoji from the classpath.
     *
     * @throws IllegalStateException if an asset is missing or is not a readable image
     */
    public static EmojiAssetTable loadFromClasspath(String location) {
        String folder = location.endsWith("/") ? location : location + "/";
        EnumMap<Emoji, BufferedImage> images = new EnumMap<>(Emoji.class);
        for (Emoji emoji : Emoji.values()) {
            ClassPathResource resource = new ClassPathResource(folder + emoji.assetName());
            if (!resource.exists()) {
                throw new IllegalStateException("Missing emoji asset: " + resource.getPath());
            }
            try (InputStream in = resource.getInputStream()) {
                BufferedImage image = ImageIO.read(in);
                if (image == null) {
                    throw new IllegalStateException("Emoji asset is not a readable image: " + resource.getPath());
                }
                images.put(emoji, image);
                log.debug("Loaded {} ({}x{})", resource.getPath(), image.getWidth(), image.getHeight());
            } catch (IOException e) {
                throw new IllegalStateException("Cannot read emoji asset: " + resource.getPath(), e);
            }
        }
        log.info("Loaded {} emoji assets from classpath:{}", images.size(), folder);
        return new EmojiAssetTable(images);
    }

    public BufferedImage get(Emoji emoji) {
        return images.get(emoji);
    }
}
