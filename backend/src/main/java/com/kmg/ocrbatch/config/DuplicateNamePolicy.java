package com.kmg.ocrbatch.config;

/**
 * How directory resolution treats file names that differ only by case.
 */
public enum DuplicateNamePolicy {
    KEEP_ALL,
    KEEP_FIRST
}
