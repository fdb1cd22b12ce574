package com.firesim.storage;

import com.firesim.config.FiresimProperties;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

@Configuration
public class StorageConfig {

    @Bean
    @ConditionalOnProperty(name = "firesim.storage.type", havingValue = "local", matchIfMissing = true)
    public ArtifactStore localArtifactStore(FiresimProperties properties, Clock clock) {
        var storage = properties.getStorage();
        return new LocalArtifactStore(Path.of(storage.getRootDir()), storage.getPublicBaseUrl(), clock);
    }

    @Bean
    @ConditionalOnProperty(name = "firesim.storage.type", havingValue = "memory")
    public ArtifactStore inMemoryArtifactStore(FiresimProperties properties, Clock clock) {
        return new InMemoryArtifactStore(properties.getStorage().getPublicBaseUrl(), clock);
    }
}
