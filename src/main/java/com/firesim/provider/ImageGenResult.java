package com.firesim.provider;

/**
 * Raw output of one provider call.
 *
 * @param imageData         encoded image bytes
 * @param format            image format, e.g. {@code png}
 * @param metadata          provider-side facts about the call
 * @param thinkingText      accumulated diagnostic text from streaming backends; nullable
 * @param modelTextResponse free text the model returned alongside the image; nullable
 */
public record ImageGenResult(
    byte[] imageData,
    String format,
    Metadata metadata,
    String thinkingText,
    String modelTextResponse
) {

    public record Metadata(
        String model,
        String promptHash,
        long generationTimeMs,
        int width,
        int height,
        Integer seed
    ) {}

    public ImageGenResult(byte[] imageData, String format, Metadata metadata) {
        this(imageData, format, metadata, null, null);
    }
}
