package com.project.image.emojify.config;

import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageOptions;
import com.google.cloud.vision.v1.ImageAnnotatorClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.io.IOException;

/**
 * Google Cloud clients. Credentials and project come from Application Default Credentials.
 */
@Configuration
public class GcpConfig {
    private static final Logger log = LoggerFactory.getLogger(GcpConfig.class);

    @Bean
    public Storage storage() {
        Storage storage = StorageOptions.getDefaultInstance().getService();
        log.info("Cloud Storage client created for project {}", storage.getOptions().getProjectId());
        return storage;
    }

    @Bean(destroyMethod = "close")
    public ImageAnnotatorClient imageAnnotatorClient() throws IOException {
        log.info("Creating Cloud Vision image annotator client");
        return ImageAnnotatorClient.create();
    }
}
