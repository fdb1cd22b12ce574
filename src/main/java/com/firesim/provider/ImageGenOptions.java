package com.firesim.provider;

import java.util.function.Consumer;

/**
 * Per-call generation options. Every field is nullable; {@link #mergedOver} fills gaps from defaults.
 *
 * @param size                 {@code WIDTHxHEIGHT}
 * @param quality              quality hint; only OpenAI-compatible backends accept it
 * @param style                style hint; only OpenAI-compatible backends accept it
 * @param seed                 fixed seed
 * @param referenceImage       raw bytes of an image the output should be conditioned on
 * @param referenceStrength    0..1 adherence to the reference image, sent as {@code image_strength}
 * @param mapScreenshot        base64 or data-URL terrain screenshot; preferred over {@code referenceImage}
 * @param vegetationPromptText spatial vegetation description appended to the prompt
 * @param onThinkingUpdate     receives incremental diagnostic text from streaming backends
 */
public record ImageGenOptions(
    String size,
    String quality,
    String style,
    Integer seed,
    byte[] referenceImage,
    Double referenceStrength,
    String mapScreenshot,
    String vegetationPromptText,
    Consumer<String> onThinkingUpdate
) {

    public static ImageGenOptions empty() {
        return new ImageGenOptions(null, null, null, null, null, null, null, null, null);
    }

    public static ImageGenOptions defaults(String size, String quality, String style) {
        return new ImageGenOptions(size, quality, style, null, null, null, null, null, null);
    }

    /** Explicit values here win; nulls take the value from {@code defaults}. */
    public ImageGenOptions mergedOver(ImageGenOptions defaults) {
        return new ImageGenOptions(
                size != null ? size : defaults.size,
                quality != null ? quality : defaults.quality,
                style != null ? style : defaults.style,
                seed != null ? seed : defaults.seed,
                referenceImage != null ? referenceImage : defaults.referenceImage,
                referenceStrength != null ? referenceStrength : defaults.referenceStrength,
                mapScreenshot != null ? mapScreenshot : defaults.mapScreenshot,
                vegetationPromptText != null ? vegetationPromptText : defaults.vegetationPromptText,
                onThinkingUpdate != null ? onThinkingUpdate : defaults.onThinkingUpdate);
    }

    public ImageGenOptions withSeed(Integer value) {
        return new ImageGenOptions(size, quality, style, value, referenceImage, referenceStrength,
                mapScreenshot, vegetationPromptText, onThinkingUpdate);
    }

    public ImageGenOptions withReference(byte[] image, Double strength) {
        return new ImageGenOptions(size, quality, style, seed, image, strength,
                mapScreenshot, vegetationPromptText, onThinkingUpdate);
    }

    public ImageGenOptions withMapScreenshot(String screenshot) {
        return new ImageGenOptions(size, quality, style, seed, referenceImage, referenceStrength,
                screenshot, vegetationPromptText, onThinkingUpdate);
    }

    public ImageGenOptions withVegetationPromptText(String text) {
        return new ImageGenOptions(size, quality, style, seed, referenceImage, referenceStrength,
                mapScreenshot, text, onThinkingUpdate);
    }

    public ImageGenOptions withThinkingCallback(Consumer<String> callback) {
        return new ImageGenOptions(size, quality, style, seed, referenceImage, referenceStrength,
                mapScreenshot, vegetationPromptText, callback);
    }

    public boolean hasConditioningImage() {
        return (mapScreenshot != null && !mapScreenshot.isBlank())
                || (referenceImage != null && referenceImage.length > 0);
    }
}
