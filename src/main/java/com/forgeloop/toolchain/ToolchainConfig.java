package com.forgeloop.toolchain;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.forgeloop.core.config.KernelProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the {@link ToolchainRegistry} from {@code forgeloop.toolchains}: one
 * {@link CommandToolchainAdapter} per configured toolchain.
 */
@Configuration
public class ToolchainConfig {

    private static final Logger log = LoggerFactory.getLogger(ToolchainConfig.class);

    @Bean
    @ConditionalOnMissingBean(ToolchainRegistry.class)
    public ToolchainRegistry toolchainRegistry(KernelProperties properties, ObjectMapper objectMapper) {
        List<ToolchainAdapter> adapters = new ArrayList<>();
        for (Map.Entry<String, KernelProperties.Toolchain> entry : properties.getToolchains().entrySet()) {
            if (!entry.getValue().isEnabled()) {
                log.info("Toolchain '{}' is disabled", entry.getKey());
                continue;
            }
            adapters.add(new CommandToolchainAdapter(entry.getKey(), entry.getValue(), objectMapper));
        }
        return new ToolchainRegistry(adapters, properties.getToolchainPriority());
    }
}
