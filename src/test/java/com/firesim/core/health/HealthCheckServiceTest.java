package com.firesim.core.health;

import com.firesim.provider.ImageGenerationProvider;
import com.firesim.provider.PlaceholderImageProvider;
import com.firesim.storage.ArtifactStore;
import com.firesim.storage.ArtifactStoreException;
import com.firesim.storage.InMemoryArtifactStore;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class HealthCheckServiceTest {

    private static HealthStatus component(List<HealthStatus> results, String name) {
        return results.stream().filter(s -> name.equals(s.component())).findFirst().orElseThrow();
    }

    @Test
    @DisplayName("All components null -> all DOWN")
    void allComponentsNullAllDown() {
        var results = new HealthCheckService(null, null).checkAll();

        assertEquals(2, results.size());
        for (var status : results) {
            assertEquals(HealthStatus.Status.DOWN, status.status(), status.component() + " should be DOWN when null");
        }
    }

    @Test
    @DisplayName("Placeholder provider and in-memory store -> both UP")
    void healthyComponents() {
        var service = new HealthCheckService(new PlaceholderImageProvider(),
                new InMemoryArtifactStore("http://localhost:8080", Clock.systemUTC()));
        var results = service.checkAll();

        var provider = component(results, "provider");
        assertEquals(HealthStatus.Status.UP, provider.status());
        assertEquals(PlaceholderImageProvider.MODEL_ID, provider.metadata().get("model"));
        assertEquals("3", provider.metadata().get("maxConcurrent"));
        assertEquals(HealthStatus.Status.UP, component(results, "storage").status());
    }

    @Test
    @DisplayName("Unconfigured provider -> provider DOWN")
    void unconfiguredProvider() {
        var provider = mock(ImageGenerationProvider.class);
        when(provider.modelId()).thenReturn("flux-1.1-pro");
        when(provider.isAvailable()).thenReturn(false);

        var status = component(new HealthCheckService(provider, null).checkAll(), "provider");

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertTrue(status.detail().contains("not configured"));
    }

    @Test
    @DisplayName("Unreachable store -> storage DOWN")
    void unreachableStore() {
        var store = mock(ArtifactStore.class);
        when(store.exists(anyString())).thenThrow(new ArtifactStoreException("connection refused"));

        var status = component(new HealthCheckService(null, store).checkAll(), "storage");

        assertEquals(HealthStatus.Status.DOWN, status.status());
        assertEquals("Artifact store error: connection refused", status.detail());
    }
}
