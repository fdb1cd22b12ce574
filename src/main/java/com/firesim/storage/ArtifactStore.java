package com.firesim.storage;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * Durable key/value blob storage with read-URL issuance.
 * Writes are keyed overwrites, so repeating an upload is safe.
 */
public interface ArtifactStore {

    /**
     * Stores {@code data} under {@code key}, replacing any previous value.
     *
     * @return a locator that can be passed to {@link #mintAccessUrl}
     * @throws ArtifactStoreException if the write fails
     */
    String upload(String key, byte[] data, String contentType, Map<String, String> metadata);

    /** Issues a read URL for the locator that is valid for {@code ttl}. */
    String mintAccessUrl(String locator, Duration ttl);

    /**
     * @return the stored bytes, or empty when nothing is stored under {@code key}
     * @throws ArtifactStoreException if the read fails for any other reason
     */
    Optional<byte[]> load(String key);

    boolean exists(String key);

    /** {@code {base}/api/v1/artifacts/{key}?expires={epochSeconds}} */
    static String accessUrl(String publicBaseUrl, String key, Instant expires) {
        var base = publicBaseUrl.endsWith("/")
                ? publicBaseUrl.substring(0, publicBaseUrl.length() - 1)
                : publicBaseUrl;
        var encodedKey = new StringBuilder();
        for (var segment : key.split("/")) {
            if (!encodedKey.isEmpty()) {
                encodedKey.append('/');
            }
            encodedKey.append(URLEncoder.encode(segment, StandardCharsets.UTF_8));
        }
        return base + "/api/v1/artifacts/" + encodedKey + "?expires=" + expires.getEpochSecond();
    }
}
