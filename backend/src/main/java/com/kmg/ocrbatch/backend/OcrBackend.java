package com.kmg.ocrbatch.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.ocrbatch.model.WorkItem;

import java.io.IOException;
import java.time.Duration;

/**
 * A remote OCR service. Implementations perform one call per invocation and report failures by throwing;
 * {@link BackendClientAdapter} turns those failures into error records.
 *
 * <p>Connection problems surface as {@link IOException}, HTTP error statuses as {@link OcrBackendException},
 * and unusable response bodies as {@link MalformedResponseException}.</p>
 */
public interface OcrBackend {

    JsonNode process(WorkItem item) throws IOException;

    class OcrBackendException extends RuntimeException {
        private final int statusCode;
        private final Duration retryAfter;

        public OcrBackendException(int statusCode, String message) {
            this(statusCode, message, null);
        }

        public OcrBackendException(int statusCode, String message, Duration retryAfter) {
            super(message);
            this.statusCode = statusCode;
            this.retryAfter = retryAfter;
        }

        public int statusCode() {
            return statusCode;
        }

        public Duration retryAfter() {
            return retryAfter;
        }
    }

    class MalformedResponseException extends RuntimeException {
        public MalformedResponseException(String message) {
            super(message);
        }

        public MalformedResponseException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    class DocumentUnreadableException extends RuntimeException {
        public DocumentUnreadableException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
