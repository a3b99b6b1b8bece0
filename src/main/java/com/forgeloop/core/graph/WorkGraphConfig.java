package com.forgeloop.core.graph;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.config.KernelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;

/**
 * Default {@link WorkGraphClient}: the JSON file named by {@code forgeloop.graph-file},
 * resolved against {@code forgeloop.repo-root}.
 */
@Configuration
public class WorkGraphConfig {

    private static final Logger log = LoggerFactory.getLogger(WorkGraphConfig.class);

    @Bean
    @ConditionalOnMissingBean(WorkGraphClient.class)
    public WorkGraphClient workGraphClient(KernelProperties properties, ObjectMapper objectMapper) {
        Path file = Path.of(properties.getRepoRoot()).resolve(properties.getGraphFile()).normalize();
        log.info("Using file-backed work graph at {}", file);
        return new FileWorkGraphClient(file, objectMapper);
    }
}
