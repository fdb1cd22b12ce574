package com.firesim.provider;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/**
 * One external image-generation backend behind a uniform capability contract.
 * <p>
 * Implementations must not retry internally; retry and backoff belong to the caller.
 */
public interface ImageGenerationProvider {

    /** Payloads smaller than this are error pages or placeholders, never images. */
    int MIN_IMAGE_BYTES = 100;

    Pattern SIZE_PATTERN = Pattern.compile("(\\d{1,5})[xX](\\d{1,5})");

    String modelId();

    /** How many in-flight calls this backend can sustain; always at least 1. */
    int maxConcurrent();

    boolean isAvailable();

    /**
     * Generates one image synchronously.
     *
     * @throws ProviderException on any transport failure, non-success response or unusable payload
     */
    ImageGenResult generate(String prompt, ImageGenOptions options);

    default boolean supportsReferenceImage() {
        return false;
    }

    default boolean supportsStreaming() {
        return false;
    }

    static void requireUsableImage(String modelId, byte[] data) {
        if (data == null || data.length < MIN_IMAGE_BYTES) {
            throw new ProviderException(modelId + " returned a suspiciously small image ("
                    + (data == null ? 0 : data.length) + " bytes)");
        }
    }

    static String promptHash(String prompt) {
        try {
            var digest = MessageDigest.getInstance("SHA-256").digest(prompt.getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest, 0, 8);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }

    /** Parses {@code WIDTHxHEIGHT}; falls back to 1024x1024 for anything malformed. */
    static int[] parseSize(String size) {
        if (size != null) {
            var matcher = SIZE_PATTERN.matcher(size.trim());
            if (matcher.matches()) {
                return new int[]{Integer.parseInt(matcher.group(1)), Integer.parseInt(matcher.group(2))};
            }
        }
        return new int[]{1024, 1024};
    }
}
