package com.project.image.emojify.config;

import com.project.image.emojify.service.EmojiAssetTable;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(EmojifyProperties.class)
public class EmojifyConfig {

    // Loaded once; a missing asset aborts startup.
    @Bean
    public EmojiAssetTable emojiAssetTable(EmojifyProperties properties) {
        return EmojiAssetTable.loadFromClasspath(properties.emojiLocation());
    }
}
