package com.firesim.storage;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Process-local artifact store for development and tests. Contents are lost on restart.
 */
public class InMemoryArtifactStore implements ArtifactStore {

    private final ConcurrentHashMap<String, byte[]> blobs = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, String> contentTypes = new ConcurrentHashMap<>();
    private final String publicBaseUrl;
    private final Clock clock;

    public InMemoryArtifactStore(String publicBaseUrl, Clock clock) {
        this.publicBaseUrl = publicBaseUrl;
        this.clock = clock;
    }

    @Override
    public String upload(String key, byte[] data, String contentType, Map<String, String> metadata) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Artifact key is required");
        }
        blobs.put(key, data.clone());
        if (contentType != null) {
            contentTypes.put(key, contentType);
        }
        return key;
    }

    @Override
    public String mintAccessUrl(String locator, Duration ttl) {
        return ArtifactStore.accessUrl(publicBaseUrl, locator, clock.instant().plus(ttl));
    }

    @Override
    public Optional<byte[]> load(String key) {
        var data = blobs.get(key);
        return data == null ? Optional.empty() : Optional.of(data.clone());
    }

    @Override
    public boolean exists(String key) {
        return blobs.containsKey(key);
    }

    public Optional<String> contentType(String key) {
        return Optional.ofNullable(contentTypes.get(key));
    }

    public int size() {
        return blobs.size();
    }
}
