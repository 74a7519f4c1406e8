package com.kmg.ocrbatch.config;

public record ResolverSettings(boolean recursive, boolean allowEmpty, DuplicateNamePolicy duplicateNames) {
    public ResolverSettings {
        if (duplicateNames == null) {
            duplicateNames = DuplicateNamePolicy.KEEP_ALL;
        }
    }

    public static ResolverSettings defaults() {
        return new ResolverSettings(false, false, DuplicateNamePolicy.KEEP_ALL);
    }

    public ResolverSettings withAllowEmpty(boolean value) {
        return new ResolverSettings(recursive, value, duplicateNames);
    }
}
