package com.firesim.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firesim.config.FiresimProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Selects the active generation backend from {@code firesim.provider.type}.
 */
@Configuration
public class ProviderConfig {

    @Bean
    @ConditionalOnProperty(name = "firesim.provider.type", havingValue = "placeholder", matchIfMissing = true)
    public ImageGenerationProvider placeholderImageProvider() {
        return new PlaceholderImageProvider();
    }

    @Bean
    @ConditionalOnProperty(name = "firesim.provider.type", havingValue = "http")
    public ImageGenerationProvider httpImageProvider(FiresimProperties properties, ObjectMapper objectMapper) {
        return new HttpImageProvider(properties.getProvider(), objectMapper);
    }
}
