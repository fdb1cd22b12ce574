package com.firesim.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "firesim")
public class FiresimProperties {

    private Generator generator = new Generator();
    private Provider provider = new Provider();
    private Storage storage = new Storage();
    private Progress progress = new Progress();
    private Run run = new Run();

    public Generator getGenerator() { return generator; }
    public void setGenerator(Generator generator) { this.generator = generator; }
    public Provider getProvider() { return provider; }
    public void setProvider(Provider provider) { this.provider = provider; }
    public Storage getStorage() { return storage; }
    public void setStorage(Storage storage) { this.storage = storage; }
    public Progress getProgress() { return progress; }
    public void setProgress(Progress progress) { this.progress = progress; }
    public Run getRun() { return run; }
    public void setRun(Run run) { this.run = run; }

    /** Defaults merged under every caller-supplied generation option, plus retry policy. */
    public static class Generator {
        private String defaultSize = "1024x1024";
        private String defaultQuality = "high";
        private String defaultStyle = "natural";
        private int maxRetries = 3;
        private long timeoutMs = 60_000;

        public String getDefaultSize() { return defaultSize; }
        public void setDefaultSize(String defaultSize) { this.defaultSize = defaultSize; }
        public String getDefaultQuality() { return defaultQuality; }
        public void setDefaultQuality(String defaultQuality) { this.defaultQuality = defaultQuality; }
        public String getDefaultStyle() { return defaultStyle; }
        public void setDefaultStyle(String defaultStyle) { this.defaultStyle = defaultStyle; }
        public int getMaxRetries() { return maxRetries; }
        public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }
    }

    public static class Provider {
        /** {@code placeholder} or {@code http}. */
        private String type = "placeholder";
        private String modelId = "flux-1.1-pro";
        private int maxConcurrent = 2;
        private String baseUrl;
        private String apiKey;
        /** {@code openai} or {@code serverless}. */
        private String apiFormat = "serverless";

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getModelId() { return modelId; }
        public void setModelId(String modelId) { this.modelId = modelId; }
        public int getMaxConcurrent() { return maxConcurrent; }
        public void setMaxConcurrent(int maxConcurrent) { this.maxConcurrent = maxConcurrent; }
        public String getBaseUrl() { return baseUrl; }
        public void setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; }
        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }
        public String getApiFormat() { return apiFormat; }
        public void setApiFormat(String apiFormat) { this.apiFormat = apiFormat; }
    }

    public static class Storage {
        /** {@code local} or {@code memory}. */
        private String type = "local";
        private String rootDir = "./data/artifacts";
        private String publicBaseUrl = "http://localhost:8080";
        private int accessUrlTtlHours = 24;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }
        public String getRootDir() { return rootDir; }
        public void setRootDir(String rootDir) { this.rootDir = rootDir; }
        public String getPublicBaseUrl() { return publicBaseUrl; }
        public void setPublicBaseUrl(String publicBaseUrl) { this.publicBaseUrl = publicBaseUrl; }
        public int getAccessUrlTtlHours() { return accessUrlTtlHours; }
        public void setAccessUrlTtlHours(int accessUrlTtlHours) { this.accessUrlTtlHours = accessUrlTtlHours; }
    }

    public static class Progress {
        private long debounceMs = 1_000;

        public long getDebounceMs() { return debounceMs; }
        public void setDebounceMs(long debounceMs) { this.debounceMs = debounceMs; }
    }

    public static class Run {
        private int maxViewpoints = 10;
        private double referenceStrength = 0.5;

        public int getMaxViewpoints() { return maxViewpoints; }
        public void setMaxViewpoints(int maxViewpoints) { this.maxViewpoints = maxViewpoints; }
        public double getReferenceStrength() { return referenceStrength; }
        public void setReferenceStrength(double referenceStrength) { this.referenceStrength = referenceStrength; }
    }
}
