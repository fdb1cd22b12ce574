package com.firesim.provider;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.firesim.config.FiresimProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;

import static org.junit.jupiter.api.Assertions.*;

class ProviderConfigTest {

    @Configuration
    @EnableConfigurationProperties(FiresimProperties.class)
    static class PropertiesConfig {
    }

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
            .withUserConfiguration(PropertiesConfig.class, ProviderConfig.class)
            .withBean(ObjectMapper.class, ObjectMapper::new);

    @Test
    @DisplayName("placeholder backend is the default")
    void placeholderByDefault() {
        runner.run(context -> {
            var provider = context.getBean(ImageGenerationProvider.class);
            assertInstanceOf(PlaceholderImageProvider.class, provider);
        });
    }

    @Test
    @DisplayName("http backend is selected by type and takes its settings from properties")
    void httpBackend() {
        runner.withPropertyValues(
                        "firesim.provider.type=http",
                        "firesim.provider.model-id=flux-kontext-pro",
                        "firesim.provider.max-concurrent=4",
                        "firesim.provider.base-url=https://images.example.org/v1/generate",
                        "firesim.provider.api-key=secret")
                .run(context -> {
                    var provider = context.getBean(ImageGenerationProvider.class);
                    assertInstanceOf(HttpImageProvider.class, provider);
                    assertEquals("flux-kontext-pro", provider.modelId());
                    assertEquals(4, provider.maxConcurrent());
                    assertTrue(provider.isAvailable());
                });
    }
}
