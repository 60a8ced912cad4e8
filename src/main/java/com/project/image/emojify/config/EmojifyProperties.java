package com.project.image.emojify.config;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

/**
 * Settings under {@code emojify.*}. The bucket name stays under {@code storage.bucket.name}.
 *
 * @param outputPrefix      prepended to the source object name to build the result path
 * @param publicUrlTemplate format string taking the bucket and the result path
 * @param maxResults        upper bound on faces requested from the classifier
 * @param emojiLocation     classpath folder holding the overlay images
 * @param hatLayering       draw the hat over the emotion overlay when headwear is detected
 */
@Validated
@ConfigurationProperties(prefix = "emojify")
public record EmojifyProperties(
        @DefaultValue("emojified/emojified-") @NotBlank String outputPrefix,
        @DefaultValue("https://storage.googleapis.com/%s/%s") @NotBlank String publicUrlTemplate,
        @DefaultValue("100") @Min(1) int maxResults,
        @DefaultValue("emojis/") @NotBlank String emojiLocation,
        @DefaultValue("false") boolean hatLayering
) {}
