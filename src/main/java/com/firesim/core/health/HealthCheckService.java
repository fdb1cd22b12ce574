package com.firesim.core.health;

import com.firesim.provider.ImageGenerationProvider;
import com.firesim.storage.ArtifactStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

@Service
public class HealthCheckService {

    private static final Logger log = LoggerFactory.getLogger(HealthCheckService.class);

    static final String PROBE_KEY = "health/probe.txt";

    private final ImageGenerationProvider provider;
    private final ArtifactStore artifactStore;

    public HealthCheckService(
            @Autowired(required = false) ImageGenerationProvider provider,
            @Autowired(required = false) ArtifactStore artifactStore) {
        this.provider = provider;
        this.artifactStore = artifactStore;
    }

    public List<HealthStatus> checkAll() {
        return List.of(checkProvider(), checkStorage());
    }

    private HealthStatus checkProvider() {
        if (provider == null) {
            return new HealthStatus("provider", HealthStatus.Status.DOWN,
                    "No image provider configured", Map.of());
        }
        var metadata = Map.of(
                "model", provider.modelId(),
                "maxConcurrent", String.valueOf(provider.maxConcurrent()));
        try {
            if (provider.isAvailable()) {
                return new HealthStatus("provider", HealthStatus.Status.UP,
                        "Image provider available (" + provider.modelId() + ")", metadata);
            }
            return new HealthStatus("provider", HealthStatus.Status.DOWN,
                    "Image provider " + provider.modelId() + " is not configured", metadata);
        } catch (Exception e) {
            log.warn("Provider health check failed: {}", e.getMessage());
            return new HealthStatus("provider", HealthStatus.Status.DOWN,
                    "Provider error: " + e.getMessage(), metadata);
        }
    }

    private HealthStatus checkStorage() {
        if (artifactStore == null) {
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "No artifact store configured", Map.of());
        }
        try {
            artifactStore.exists(PROBE_KEY);
            return new HealthStatus("storage", HealthStatus.Status.UP,
                    "Artifact store reachable (" + artifactStore.getClass().getSimpleName() + ")", Map.of());
        } catch (Exception e) {
            log.warn("Artifact store health check failed: {}", e.getMessage());
            return new HealthStatus("storage", HealthStatus.Status.DOWN,
                    "Artifact store error: " + e.getMessage(), Map.of());
        }
    }
}
