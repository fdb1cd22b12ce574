package com.firesim.provider;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Random;

/**
 * Local stand-in backend that renders a deterministic PNG from the prompt hash and seed.
 * Same prompt and seed always give the same bytes. Used for development and tests.
 */
public class PlaceholderImageProvider implements ImageGenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(PlaceholderImageProvider.class);

    public static final String MODEL_ID = "placeholder-renderer-1.0";

    private final int maxConcurrent;

    public PlaceholderImageProvider() {
        this(3);
    }

    public PlaceholderImageProvider(int maxConcurrent) {
        this.maxConcurrent = Math.max(1, maxConcurrent);
    }

    @Override
    public String modelId() {
        return MODEL_ID;
    }

    @Override
    public int maxConcurrent() {
        return maxConcurrent;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public boolean supportsReferenceImage() {
        return true;
    }

    @Override
    public boolean supportsStreaming() {
        return true;
    }

    @Override
    public ImageGenResult generate(String prompt, ImageGenOptions options) {
        long start = System.currentTimeMillis();
        var opts = options != null ? options : ImageGenOptions.empty();
        int[] size = ImageGenerationProvider.parseSize(opts.size());
        var hash = ImageGenerationProvider.promptHash(prompt);

        var thinking = "Rendering " + size[0] + "x" + size[1] + " placeholder for prompt " + hash
                + (opts.hasConditioningImage() ? " conditioned on reference image" : "");
        if (opts.onThinkingUpdate() != null) {
            opts.onThinkingUpdate().accept(thinking);
        }

        byte[] png = render(size[0], size[1], hash, opts.seed());
        ImageGenerationProvider.requireUsableImage(MODEL_ID, png);
        log.debug("Rendered placeholder {} ({} bytes)", hash, png.length);

        var metadata = new ImageGenResult.Metadata(MODEL_ID, hash,
                System.currentTimeMillis() - start, size[0], size[1], opts.seed());
        return new ImageGenResult(png, "png", metadata, thinking, null);
    }

    private static byte[] render(int width, int height, String hash, Integer seed) {
        long mix = Long.parseUnsignedLong(hash, 16) ^ (seed != null ? seed.longValue() : 0L);
        var random = new Random(mix);
        // warm sky over dark ground, with per-pixel grain so every image is distinct
        int skyBase = 0xC0_60_20 ^ (random.nextInt() & 0x1F_1F_1F);
        int groundBase = 0x30_28_18 ^ (random.nextInt() & 0x0F_0F_0F);
        int horizon = height / 3 + random.nextInt(Math.max(1, height / 3));

        var image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        for (int y = 0; y < height; y++) {
            int base = y < horizon ? skyBase : groundBase;
            for (int x = 0; x < width; x++) {
                image.setRGB(x, y, base ^ (random.nextInt() & 0x07_07_07));
            }
        }

        var out = new ByteArrayOutputStream();
        try {
            ImageIO.write(image, "png", out);
        } catch (IOException e) {
            throw new ProviderException("Failed to encode placeholder image", e);
        }
        return out.toByteArray();
    }
}
