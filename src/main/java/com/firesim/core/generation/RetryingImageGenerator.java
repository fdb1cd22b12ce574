package com.firesim.core.generation;

import com.firesim.config.FiresimProperties;
import com.firesim.core.metrics.GenerationMetrics;
import com.firesim.provider.ImageGenOptions;
import com.firesim.provider.ImageGenResult;
import com.firesim.provider.ImageGenerationProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Adds per-attempt timeout, bounded retry with exponential backoff and default-option
 * merging on top of one {@link ImageGenerationProvider}.
 *
 * <p>Backoff before attempt {@code n+1} is {@code 4^(n-1)} seconds: 1s, 4s, 16s.
 * A timed-out attempt is abandoned (cancelled with interrupt); the backend may still
 * finish the request on its side.
 */
@Service
public class RetryingImageGenerator {

    private static final Logger log = LoggerFactory.getLogger(RetryingImageGenerator.class);

    private final ImageGenerationProvider provider;
    private final ImageGenOptions defaults;
    private final int maxRetries;
    private final long timeoutMs;
    private final ExecutorService executor;
    private final Sleeper sleeper;
    private final GenerationMetrics metrics;

    @Autowired
    public RetryingImageGenerator(ImageGenerationProvider provider, FiresimProperties properties,
                                  ExecutorService executor,
                                  @Autowired(required = false) GenerationMetrics metrics) {
        this(provider, properties.getGenerator(), executor, Sleeper.THREAD, metrics);
    }

    public RetryingImageGenerator(ImageGenerationProvider provider, FiresimProperties.Generator config,
                                  ExecutorService executor, Sleeper sleeper, GenerationMetrics metrics) {
        this.provider = provider;
        this.defaults = ImageGenOptions.defaults(config.getDefaultSize(), config.getDefaultQuality(),
                config.getDefaultStyle());
        this.maxRetries = Math.max(1, config.getMaxRetries());
        this.timeoutMs = config.getTimeoutMs();
        this.executor = executor;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public ImageGenerationProvider provider() {
        return provider;
    }

    /**
     * Generates one image, retrying on any failure.
     *
     * @throws ImageGenerationException when all attempts fail
     */
    public ImageGenResult generateImage(String prompt, ImageGenOptions options) {
        var merged = (options != null ? options : ImageGenOptions.empty()).mergedOver(defaults);
        Exception lastError = null;

        for (int attempt = 1; attempt <= maxRetries; attempt++) {
            try {
                log.debug("Generating with {} (attempt {}/{})", provider.modelId(), attempt, maxRetries);
                return attemptWithTimeout(prompt, merged);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new ImageGenerationException("Interrupted while generating image", attempt, e);
            } catch (Exception e) {
                lastError = e;
                log.warn("Attempt {}/{} against {} failed: {}", attempt, maxRetries,
                        provider.modelId(), e.getMessage());
                if (attempt < maxRetries) {
                    if (metrics != null) {
                        metrics.recordRetry(provider.modelId());
                    }
                    long delay = backoffMillis(attempt);
                    try {
                        sleeper.sleep(delay);
                    } catch (InterruptedException ie) {
                        Thread.currentThread().interrupt();
                        throw new ImageGenerationException("Interrupted during retry backoff", attempt, e);
                    }
                }
            }
        }

        throw new ImageGenerationException("Failed to generate image after " + maxRetries
                + " attempts: " + lastError.getMessage(), maxRetries, lastError);
    }

    /** Delay after the given failed attempt: 1000, 4000, 16000 ms. */
    static long backoffMillis(int failedAttempt) {
        return (long) Math.pow(4, failedAttempt - 1) * 1000L;
    }

    private ImageGenResult attemptWithTimeout(String prompt, ImageGenOptions options) throws Exception {
        var mdc = MDC.getCopyOfContextMap();
        var future = executor.submit(() -> {
            if (mdc != null) {
                MDC.setContextMap(mdc);
            }
            try {
                return provider.generate(prompt, options);
            } finally {
                MDC.clear();
            }
        });
        try {
            return future.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TimeoutException("Operation timed out after " + timeoutMs + "ms");
        } catch (ExecutionException e) {
            var cause = e.getCause();
            if (cause instanceof Exception ex) {
                throw ex;
            }
            throw e;
        } catch (InterruptedException e) {
            future.cancel(true);
            throw e;
        }
    }
}
