package com.kmg.ocrbatch.backend;

import com.fasterxml.jackson.databind.JsonNode;
import com.kmg.ocrbatch.model.AttemptOutcome;
import com.kmg.ocrbatch.model.DocumentType;
import com.kmg.ocrbatch.model.ErrorKind;
import com.kmg.ocrbatch.model.ErrorRecord;
import com.kmg.ocrbatch.model.FileRef;
import com.kmg.ocrbatch.model.WorkItem;
import com.kmg.ocrbatch.service.DocumentResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Calls the {@link OcrBackend} for one work item under a per-call timeout and classifies every failure.
 * {@link #invoke(WorkItem)} never throws.
 */
public class BackendClientAdapter implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(BackendClientAdapter.class);

    private final OcrBackend backend;
    private final Duration callTimeout;
    private final ExecutorService callExecutor;

    public BackendClientAdapter(OcrBackend backend, Duration callTimeout) {
        this.backend = Objects.requireNonNull(backend, "backend");
        this.callTimeout = Objects.requireNonNull(callTimeout, "callTimeout");
        if (callTimeout.isZero() || callTimeout.isNegative()) {
            throw new IllegalArgumentException("callTimeout must be positive (current: " + callTimeout + ")");
        }
        this.callExecutor = Executors.newCachedThreadPool(new CallThreadFactory());
    }

    public AttemptOutcome invoke(WorkItem item) {
        if (item.source() instanceof FileRef file && DocumentType.fromFileName(file.fileName()).isEmpty()) {
            return failure(ErrorKind.UNSUPPORTED_FILE_TYPE, "Unsupported file type: " + file.path(), false, null);
        }

        Future<JsonNode> future;
        try {
            future = callExecutor.submit(() -> backend.process(item));
        } catch (RejectedExecutionException e) {
            return failure(ErrorKind.TRANSIENT, "Backend call rejected: " + e.getMessage(), true, null);
        }

        try {
            JsonNode payload = future.get(callTimeout.toMillis(), TimeUnit.MILLISECONDS);
            if (payload == null || payload.isNull() || payload.isMissingNode() || payload.isEmpty()) {
                return failure(ErrorKind.MALFORMED_RESPONSE, "Empty response from backend", false, null);
            }
            return new AttemptOutcome.Success(payload);
        } catch (TimeoutException e) {
            future.cancel(true);
            return failure(ErrorKind.TIMEOUT, "No backend response within " + callTimeout.toMillis() + "ms", true, null);
        } catch (ExecutionException e) {
            return classify(e.getCause() == null ? e : e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            return failure(ErrorKind.CANCELLED, "Interrupted while waiting for backend", false, null);
        }
    }

    AttemptOutcome classify(Throwable error) {
        log.debug("Backend call failed: {}", error.toString());

        if (error instanceof OcrBackend.OcrBackendException backendError) {
            int status = backendError.statusCode();
            String message = backendError.getMessage();
            if (status == 429 || status == 503) {
                return new AttemptOutcome.Failure(new ErrorRecord(
                        ErrorKind.RATE_LIMITED, message, true, status, backendError.retryAfter()));
            }
            if (status >= 400 && status < 500) {
                return failure(ErrorKind.INVALID_REQUEST, message, false, status);
            }
            return failure(ErrorKind.BACKEND_FAULT, message, true, status);
        }
        if (error instanceof OcrBackend.MalformedResponseException) {
            return failure(ErrorKind.MALFORMED_RESPONSE, error.getMessage(), false, null);
        }
        if (error instanceof DocumentResolver.UnsupportedFileTypeException) {
            return failure(ErrorKind.UNSUPPORTED_FILE_TYPE, error.getMessage(), false, null);
        }
        if (error instanceof OcrBackend.DocumentUnreadableException) {
            return failure(ErrorKind.INVALID_INPUT, error.getMessage(), false, null);
        }
        if (hasIoCause(error)) {
            return failure(ErrorKind.TRANSIENT, "Connection failure: " + error.getMessage(), true, null);
        }
        return failure(ErrorKind.BACKEND_FAULT, "Unexpected backend error: " + error, true, null);
    }

    @Override
    public void close() {
        callExecutor.shutdownNow();
    }

    private static boolean hasIoCause(Throwable error) {
        Throwable current = error;
        while (current != null) {
            if (current instanceof IOException || current instanceof UncheckedIOException) {
                return true;
            }
            current = current.getCause();
        }
        return false;
    }

    private static AttemptOutcome failure(ErrorKind kind, String message, boolean retryable, Integer status) {
        return new AttemptOutcome.Failure(new ErrorRecord(kind, message, retryable, status, null));
    }

    private static class CallThreadFactory implements ThreadFactory {
        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "ocr-backend-call-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
