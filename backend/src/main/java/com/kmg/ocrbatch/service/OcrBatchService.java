package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.config.OcrBatchProperties;
import com.kmg.ocrbatch.dto.AttemptView;
import com.kmg.ocrbatch.dto.BatchView;
import com.kmg.ocrbatch.dto.ErrorView;
import com.kmg.ocrbatch.dto.ItemResultView;
import com.kmg.ocrbatch.model.Attempt;
import com.kmg.ocrbatch.model.AttemptOutcome;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ErrorRecord;
import com.kmg.ocrbatch.model.ItemResult;
import com.kmg.ocrbatch.model.ProcessingOptions;
import com.kmg.ocrbatch.model.UrlRef;
import com.kmg.ocrbatch.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

@Service
public class OcrBatchService {
    private static final Logger log = LoggerFactory.getLogger(OcrBatchService.class);

    private final DocumentResolver documentResolver;
    private final BatchScheduler batchScheduler;
    private final OcrBatchProperties properties;

    public OcrBatchService(DocumentResolver documentResolver, BatchScheduler batchScheduler,
                           OcrBatchProperties properties) {
        this.documentResolver = documentResolver;
        this.batchScheduler = batchScheduler;
        this.properties = properties;
    }

    public ProcessingOptions defaultOptions() {
        return new ProcessingOptions(properties.getBackend().isIncludeImages(), properties.getBackend().getModel());
    }

    public BatchResult processInput(String input, ProcessingOptions options, Integer concurrency, Duration timeout) {
        log.info("Processing input: {}", input);
        List<WorkItem> items = documentResolver.resolve(input, options);
        return batchScheduler.submitBatch(items, effectiveConcurrency(concurrency), effectiveTimeout(timeout));
    }

    public BatchResult processUrls(List<String> urls, ProcessingOptions options, Integer concurrency) {
        int maxUrls = properties.getBatch().getMaxUrls();
        if (urls == null || urls.isEmpty() || urls.size() > maxUrls) {
            throw new DocumentResolver.InvalidInputException("Between 1 and " + maxUrls + " URLs are required.");
        }
        for (String url : urls) {
            if (url == null || !DocumentResolver.isUrl(url.trim())) {
                throw new DocumentResolver.InvalidInputException("Not a URL: " + url);
            }
        }
        List<WorkItem> items = documentResolver.resolveAll(urls, options);
        return batchScheduler.submitBatch(items, effectiveConcurrency(concurrency), effectiveTimeout(null));
    }

    public ItemResult processSingle(String input, ProcessingOptions options) {
        List<WorkItem> items = documentResolver.resolve(input, options);
        if (items.size() != 1) {
            throw new DocumentResolver.InvalidInputException("Expected a single document but found " + items.size());
        }
        BatchResult result = batchScheduler.submitBatch(items, 1, effectiveTimeout(null));
        return result.items().get(0);
    }

    public ItemResult processFile(Path file, ProcessingOptions options) {
        return processSingle(file.toString(), options);
    }

    public BatchView toView(BatchResult result) {
        List<ItemResultView> items = result.items().stream()
                .map(this::toView)
                .toList();
        List<String> failedUrls = result.items().stream()
                .filter(item -> item instanceof ItemResult.Failed)
                .map(ItemResult::item)
                .filter(item -> item.source() instanceof UrlRef)
                .map(WorkItem::displayName)
                .toList();
        return new BatchView(items, result.succeededCount(), result.failedCount(), failedUrls);
    }

    public ItemResultView toView(ItemResult result) {
        List<AttemptView> attempts = result.attempts().stream()
                .map(this::toView)
                .toList();

        if (result instanceof ItemResult.Succeeded succeeded) {
            return new ItemResultView(
                    result.itemId(),
                    result.item().displayName(),
                    result.state(),
                    result.attemptsUsed(),
                    attempts,
                    succeeded.payload(),
                    null
            );
        }

        ErrorRecord error = ((ItemResult.Failed) result).finalError();
        return new ItemResultView(
                result.itemId(),
                result.item().displayName(),
                result.state(),
                result.attemptsUsed(),
                attempts,
                null,
                new ErrorView(error.kind(), error.message(), error.retryable(), error.backendStatus())
        );
    }

    private AttemptView toView(Attempt attempt) {
        if (attempt.outcome() instanceof AttemptOutcome.Failure failure) {
            return new AttemptView(
                    attempt.attemptNumber(),
                    attempt.startedAt().toString(),
                    false,
                    failure.error().kind(),
                    failure.error().message()
            );
        }
        return new AttemptView(attempt.attemptNumber(), attempt.startedAt().toString(), true, null, null);
    }

    private int effectiveConcurrency(Integer requested) {
        return requested == null ? properties.getBatch().getConcurrency() : requested;
    }

    private Duration effectiveTimeout(Duration requested) {
        return requested == null ? properties.getBatch().getTimeout() : requested;
    }
}
