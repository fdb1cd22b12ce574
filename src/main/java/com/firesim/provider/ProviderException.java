package com.firesim.provider;

/**
 * A generation backend call failed. Carries the HTTP status and a response excerpt when known.
 */
public class ProviderException extends RuntimeException {

    private final Integer statusCode;
    private final String responseExcerpt;

    public ProviderException(String message) {
        this(message, null, null, null);
    }

    public ProviderException(String message, Throwable cause) {
        this(message, null, null, cause);
    }

    public ProviderException(String message, Integer statusCode, String responseExcerpt, Throwable cause) {
        super(message, cause);
        this.statusCode = statusCode;
        this.responseExcerpt = responseExcerpt;
    }

    public Integer getStatusCode() {
        return statusCode;
    }

    public String getResponseExcerpt() {
        return responseExcerpt;
    }
}
