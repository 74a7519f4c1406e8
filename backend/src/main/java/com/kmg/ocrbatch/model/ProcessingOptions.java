package com.kmg.ocrbatch.model;

public record ProcessingOptions(boolean includeImages, String model) {
    public static ProcessingOptions defaults() {
        return new ProcessingOptions(false, null);
    }

    public ProcessingOptions withIncludeImages(boolean value) {
        return new ProcessingOptions(value, model);
    }
}
