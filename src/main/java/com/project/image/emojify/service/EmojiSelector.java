package com.project.image.emojify.service;

import com.project.image.emojify.model.Emoji;
import com.project.image.emojify.model.FaceAnnotation;
import com.project.image.emojify.model.Likelihood;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.function.Function;

/**
 * Picks the overlay for a face from the classifier's likelihoods.
 *
 * <p>The most confident level wins. Among axes at the same level the order is
 * joy, anger, surprise, sorrow. UNLIKELY and below never select an emotion.
 */
@Component
public class EmojiSelector {

    private static final List<Likelihood> ACCEPTED_LIKELIHOODS =
            List.of(Likelihood.VERY_LIKELY, Likelihood.LIKELY, Likelihood.POSSIBLE);

    // Order matters: it is the tie-break between equally confident emotions.
    private static final List<EmotionAxis> EMOTION_AXES = List.of(
            new EmotionAxis(Emoji.JOY, FaceAnnotation::joy),
            new EmotionAxis(Emoji.ANGER, FaceAnnotation::anger),
            new EmotionAxis(Emoji.SURPRISE, FaceAnnotation::surprise),
            new EmotionAxis(Emoji.SORROW, FaceAnnotation::sorrow)
    );

    public Emoji selectEmotionEmoji(FaceAnnotation annotation) {
        for (Likelihood likelihood : ACCEPTED_LIKELIHOODS) {
            for (EmotionAxis axis : EMOTION_AXES) {
                if (axis.likelihood().apply(annotation) == likelihood) {
                    return axis.emoji();
                }
            }
        }
        return Emoji.NONE;
    }

    public boolean selectHatOverlay(FaceAnnotation annotation) {
        return ACCEPTED_LIKELIHOODS.contains(annotation.headwear());
    }

    private record EmotionAxis(Emoji emoji, Function<FaceAnnotation, Likelihood> likelihood) {}
}
