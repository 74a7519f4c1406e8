package com.kmg.ocrbatch.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.hibernate.validator.constraints.time.DurationMax;
import org.hibernate.validator.constraints.time.DurationMin;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Validated
@ConfigurationProperties(prefix = "ocr")
public class OcrBatchProperties {
    @Valid
    @NotNull
    private Backend backend = new Backend();
    @Valid
    @NotNull
    private Batch batch = new Batch();
    @Valid
    @NotNull
    private Resolver resolver = new Resolver();
    @Valid
    @NotNull
    private Output output = new Output();

    public Backend getBackend() {
        return backend;
    }

    public void setBackend(Backend backend) {
        this.backend = backend;
    }

    public Batch getBatch() {
        return batch;
    }

    public void setBatch(Batch batch) {
        this.batch = batch;
    }

    public Resolver getResolver() {
        return resolver;
    }

    public void setResolver(Resolver resolver) {
        this.resolver = resolver;
    }

    public Output getOutput() {
        return output;
    }

    public void setOutput(Output output) {
        this.output = output;
    }

    public RetrySettings retrySettings() {
        return new RetrySettings(batch.getMaxAttempts(), batch.getBaseDelay(), batch.getMaxDelay(), batch.getJitterFactor());
    }

    public ResolverSettings resolverSettings() {
        return new ResolverSettings(resolver.isRecursive(), resolver.isAllowEmpty(), resolver.getDuplicateNames());
    }

    public static class Backend {
        @NotBlank
        private String baseUrl = "https://api.mistral.ai";
        private String apiKey;
        @NotBlank
        private String model = "mistral-ocr-latest";
        private boolean includeImages = false;
        @NotNull
        @DurationMin(millis = 1)
        @DurationMax(days = 1)
        private Duration callTimeout = Duration.ofSeconds(60);
        @NotNull
        @DurationMin(millis = 1)
        @DurationMax(days = 1)
        private Duration connectTimeout = Duration.ofSeconds(10);

        public String getBaseUrl() {
            return baseUrl;
        }

        public void setBaseUrl(String baseUrl) {
            this.baseUrl = baseUrl;
        }

        public String getApiKey() {
            return apiKey;
        }

        public void setApiKey(String apiKey) {
            this.apiKey = apiKey;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public boolean isIncludeImages() {
            return includeImages;
        }

        public void setIncludeImages(boolean includeImages) {
            this.includeImages = includeImages;
        }

        public Duration getCallTimeout() {
            return callTimeout;
        }

        public void setCallTimeout(Duration callTimeout) {
            this.callTimeout = callTimeout;
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public void setConnectTimeout(Duration connectTimeout) {
            this.connectTimeout = connectTimeout;
        }
    }

    public static class Batch {
        @Min(1)
        @Max(32)
        private int concurrency = 4;
        @Min(1)
        @Max(10)
        private int maxAttempts = 3;
        @NotNull
        private Duration baseDelay = Duration.ofSeconds(1);
        @NotNull
        @DurationMax(days = 1)
        private Duration maxDelay = Duration.ofSeconds(30);
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double jitterFactor = 0.0;
        @NotNull
        @DurationMin(millis = 1)
        @DurationMax(days = 7)
        private Duration timeout = Duration.ofMinutes(10);
        @Min(1)
        private int maxUrls = 10;

        public int getConcurrency() {
            return concurrency;
        }

        public void setConcurrency(int concurrency) {
            this.concurrency = concurrency;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public Duration getBaseDelay() {
            return baseDelay;
        }

        public void setBaseDelay(Duration baseDelay) {
            this.baseDelay = baseDelay;
        }

        public Duration getMaxDelay() {
            return maxDelay;
        }

        public void setMaxDelay(Duration maxDelay) {
            this.maxDelay = maxDelay;
        }

        public double getJitterFactor() {
            return jitterFactor;
        }

        public void setJitterFactor(double jitterFactor) {
            this.jitterFactor = jitterFactor;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }

        public int getMaxUrls() {
            return maxUrls;
        }

        public void setMaxUrls(int maxUrls) {
            this.maxUrls = maxUrls;
        }
    }

    public static class Resolver {
        private boolean recursive = false;
        private boolean allowEmpty = false;
        @NotNull
        private DuplicateNamePolicy duplicateNames = DuplicateNamePolicy.KEEP_ALL;

        public boolean isRecursive() {
            return recursive;
        }

        public void setRecursive(boolean recursive) {
            this.recursive = recursive;
        }

        public boolean isAllowEmpty() {
            return allowEmpty;
        }

        public void setAllowEmpty(boolean allowEmpty) {
            this.allowEmpty = allowEmpty;
        }

        public DuplicateNamePolicy getDuplicateNames() {
            return duplicateNames;
        }

        public void setDuplicateNames(DuplicateNamePolicy duplicateNames) {
            this.duplicateNames = duplicateNames;
        }
    }

    public static class Output {
        @NotBlank
        private String dir = "./output";

        public String getDir() {
            return dir;
        }

        public void setDir(String dir) {
            this.dir = dir;
        }
    }
}
