package com.firesim.core.generation;

/**
 * Every attempt against the provider failed. The cause is the last attempt's error.
 */
public class ImageGenerationException extends RuntimeException {

    private final int attempts;

    public ImageGenerationException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int getAttempts() {
        return attempts;
    }
}
