package com.firesim.storage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Filesystem-backed artifact store. Keys map to relative paths under the root directory.
 */
public class LocalArtifactStore implements ArtifactStore {

    private static final Logger log = LoggerFactory.getLogger(LocalArtifactStore.class);

    private final Path root;
    private final String publicBaseUrl;
    private final Clock clock;

    public LocalArtifactStore(Path root, String publicBaseUrl, Clock clock) {
        this.root = root.toAbsolutePath().normalize();
        this.publicBaseUrl = publicBaseUrl;
        this.clock = clock;
    }

    @Override
    public String upload(String key, byte[] data, String contentType, Map<String, String> metadata) {
        var target = resolve(key);
        try {
            Files.createDirectories(target.getParent());
            // write to a sibling temp file first so readers never see a torn file
            var tmp = Files.createTempFile(target.getParent(), ".upload-", ".tmp");
            Files.write(tmp, data);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to write artifact " + key, e);
        }
        log.debug("Stored {} ({} bytes, {})", key, data.length, contentType);
        return key;
    }

    @Override
    public String mintAccessUrl(String locator, Duration ttl) {
        return ArtifactStore.accessUrl(publicBaseUrl, locator, clock.instant().plus(ttl));
    }

    @Override
    public Optional<byte[]> load(String key) {
        var target = resolve(key);
        if (!Files.isRegularFile(target)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(target));
        } catch (IOException e) {
            throw new ArtifactStoreException("Failed to read artifact " + key, e);
        }
    }

    @Override
    public boolean exists(String key) {
        return Files.isRegularFile(resolve(key));
    }

    public Path getRoot() {
        return root;
    }

    private Path resolve(String key) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Artifact key is required");
        }
        var resolved = root.resolve(key).normalize();
        if (!resolved.startsWith(root) || resolved.equals(root)) {
            throw new IllegalArgumentException("Artifact key escapes the store root: " + key);
        }
        return resolved;
    }
}
