package com.firesim.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.firesim.config.FiresimProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Base64;
import java.util.regex.Pattern;

/**
 * JSON-over-HTTP image backend.
 *
 * <p>Two wire formats are supported:
 * <ul>
 *   <li>{@code openai}: OpenAI-compatible images endpoint, {@code api-key} header,
 *       response {@code data[0].b64_json}</li>
 *   <li>{@code serverless}: hosted text-to-image endpoint, bearer token, response
 *       {@code image.url} (data URL), {@code images[0].bytes} or {@code sample}</li>
 * </ul>
 * A map screenshot or reference image switches the call to image-conditioned mode.
 */
public class HttpImageProvider implements ImageGenerationProvider {

    private static final Logger log = LoggerFactory.getLogger(HttpImageProvider.class);

    static final String TERRAIN_PREAMBLE =
            "Using the provided satellite/terrain map as a strict spatial reference, generate a photorealistic "
            + "photograph of this exact location. Preserve every topographic feature (the shape of hills, ridges, "
            + "valleys, gullies, roads, clearings, tree canopy outlines and water bodies) exactly as it appears "
            + "in the reference image. Match the same camera angle, field of view and spatial composition. "
            + "Replace the map rendering style with photorealistic textures and natural lighting. "
            + "Then overlay the following fire scenario onto this faithful landscape rendering: ";

    private static final Pattern DATA_URL_PREFIX = Pattern.compile("^data:image/\\w+;base64,");
    private static final int EXCERPT_LENGTH = 500;

    private final FiresimProperties.Provider config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    public HttpImageProvider(FiresimProperties.Provider config, ObjectMapper objectMapper) {
        this(config, HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(10)).build(), objectMapper);
    }

    HttpImageProvider(FiresimProperties.Provider config, HttpClient httpClient, ObjectMapper objectMapper) {
        this.config = config;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
    }

    @Override
    public String modelId() {
        return config.getModelId();
    }

    @Override
    public int maxConcurrent() {
        return Math.max(1, config.getMaxConcurrent());
    }

    @Override
    public boolean isAvailable() {
        return notBlank(config.getBaseUrl()) && notBlank(config.getApiKey());
    }

    @Override
    public boolean supportsReferenceImage() {
        return true;
    }

    @Override
    public ImageGenResult generate(String prompt, ImageGenOptions options) {
        if (!isAvailable()) {
            throw new ProviderException("Image backend " + modelId() + " is not configured (base-url and api-key required)");
        }
        long start = System.currentTimeMillis();
        var opts = options != null ? options : ImageGenOptions.empty();
        int[] size = ImageGenerationProvider.parseSize(opts.size());

        String effectivePrompt = prompt;
        if (notBlank(opts.vegetationPromptText())) {
            effectivePrompt += "\n\nSpatial vegetation data: " + opts.vegetationPromptText();
        }
        String conditioningImage = conditioningImageBase64(opts);
        if (conditioningImage != null) {
            effectivePrompt = TERRAIN_PREAMBLE + effectivePrompt;
        }

        boolean serverless = "serverless".equalsIgnoreCase(config.getApiFormat());
        ObjectNode body = serverless
                ? serverlessBody(effectivePrompt, size, opts, conditioningImage)
                : openAiBody(effectivePrompt, size, opts, conditioningImage);

        var requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(config.getBaseUrl()))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body.toString()));
        if (serverless) {
            requestBuilder.header("Authorization", "Bearer " + config.getApiKey());
        } else {
            requestBuilder.header("api-key", config.getApiKey());
        }

        HttpResponse<String> response;
        try {
            response = httpClient.send(requestBuilder.build(), HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new ProviderException("Image backend request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Interrupted waiting for image backend", e);
        }

        if (response.statusCode() < 200 || response.statusCode() >= 300) {
            var text = response.body() != null ? response.body() : "";
            var excerpt = text.length() > EXCERPT_LENGTH ? text.substring(0, EXCERPT_LENGTH) : text;
            throw new ProviderException("Image model API error " + response.statusCode() + ": " + excerpt,
                    response.statusCode(), excerpt, null);
        }

        byte[] imageData = decodeImage(response.body());
        ImageGenerationProvider.requireUsableImage(modelId(), imageData);

        long elapsed = System.currentTimeMillis() - start;
        log.info("{} generated {}x{} image ({} bytes) in {}ms{}", modelId(), size[0], size[1],
                imageData.length, elapsed, conditioningImage != null ? " [image-conditioned]" : "");

        var metadata = new ImageGenResult.Metadata(modelId(), ImageGenerationProvider.promptHash(prompt),
                elapsed, size[0], size[1], opts.seed());
        return new ImageGenResult(imageData, "png", metadata);
    }

    private ObjectNode serverlessBody(String prompt, int[] size, ImageGenOptions opts, String image) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("prompt", prompt);
        body.put("width", size[0]);
        body.put("height", size[1]);
        body.put("steps", 25);
        body.put("guidance", 3.5);
        body.put("safety_tolerance", 5);
        if (opts.seed() != null) {
            body.put("seed", opts.seed());
        }
        putImage(body, opts, image);
        return body;
    }

    private ObjectNode openAiBody(String prompt, int[] size, ImageGenOptions opts, String image) {
        ObjectNode body = objectMapper.createObjectNode();
        body.put("prompt", prompt);
        body.put("size", size[0] + "x" + size[1]);
        body.put("n", 1);
        body.put("response_format", "b64_json");
        if (notBlank(opts.quality())) {
            body.put("quality", opts.quality());
        }
        if (notBlank(opts.style())) {
            body.put("style", opts.style());
        }
        putImage(body, opts, image);
        return body;
    }

    /** Strength only applies to the anchor reference; a map screenshot is followed as-is. */
    private static void putImage(ObjectNode body, ImageGenOptions opts, String image) {
        if (image == null) {
            return;
        }
        body.put("image", image);
        if (!notBlank(opts.mapScreenshot()) && opts.referenceStrength() != null) {
            body.put("image_strength", opts.referenceStrength());
        }
    }

    /** Map screenshot wins over the anchor reference. */
    static String conditioningImageBase64(ImageGenOptions opts) {
        if (notBlank(opts.mapScreenshot())) {
            var stripped = DATA_URL_PREFIX.matcher(opts.mapScreenshot()).replaceFirst("");
            return stripped.isEmpty() ? null : stripped;
        }
        if (opts.referenceImage() != null && opts.referenceImage().length > 0) {
            return Base64.getEncoder().encodeToString(opts.referenceImage());
        }
        return null;
    }

    byte[] decodeImage(String responseBody) {
        JsonNode payload;
        try {
            payload = objectMapper.readTree(responseBody);
        } catch (IOException e) {
            throw new ProviderException("Image backend returned non-JSON response", e);
        }
        String base64 = extractBase64(payload);
        if (base64 == null) {
            throw new ProviderException("No image data in response from " + modelId());
        }
        try {
            return Base64.getMimeDecoder().decode(base64);
        } catch (IllegalArgumentException e) {
            throw new ProviderException("Image data from " + modelId() + " is not valid base64", e);
        }
    }

    private static String extractBase64(JsonNode payload) {
        var b64 = payload.path("data").path(0).path("b64_json");
        if (b64.isTextual() && !b64.asText().isEmpty()) {
            return b64.asText();
        }
        var url = payload.path("image").path("url");
        if (url.isTextual() && !url.asText().isEmpty()) {
            return stripDataUrl(url.asText());
        }
        var bytes = payload.path("images").path(0).path("bytes");
        if (bytes.isTextual() && !bytes.asText().isEmpty()) {
            return bytes.asText();
        }
        var sample = payload.path("sample");
        if (sample.isTextual() && !sample.asText().isEmpty()) {
            return stripDataUrl(sample.asText());
        }
        return null;
    }

    private static String stripDataUrl(String value) {
        int idx = value.indexOf("base64,");
        return idx >= 0 ? value.substring(idx + "base64,".length()) : value;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
