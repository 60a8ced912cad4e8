package com.project.image.emojify;

import com.project.image.emojify.config.EmojifyProperties;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EmojifyPropertiesTest {

    private static EmojifyProperties bind(Map<String, String> values) {
        return new Binder(new MapConfigurationPropertySource(values))
                .bindOrCreate("emojify", EmojifyProperties.class);
    }

    @Test
    void defaults_apply_when_nothing_is_set() {
        EmojifyProperties properties = bind(Map.of());

        assertThat(properties.outputPrefix()).isEqualTo("emojified/emojified-");
        assertThat(properties.publicUrlTemplate()).isEqualTo("https://storage.googleapis.com/%s/%s");
        assertThat(properties.maxResults()).isEqualTo(100);
        assertThat(properties.emojiLocation()).isEqualTo("emojis/");
        assertThat(properties.hatLayering()).isFalse();
    }

    @Test
    void hat_layering_binds_with_the_other_emojify_settings() {
        EmojifyProperties properties = bind(Map.of(
                "emojify.hat-layering", "true",
                "emojify.max-results", "5"));

        assertThat(properties.hatLayering()).isTrue();
        assertThat(properties.maxResults()).isEqualTo(5);
    }
}
