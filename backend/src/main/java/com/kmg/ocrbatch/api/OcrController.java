package com.kmg.ocrbatch.api;

import com.kmg.ocrbatch.dto.BatchView;
import com.kmg.ocrbatch.dto.ItemResultView;
import com.kmg.ocrbatch.dto.OcrBatchRequest;
import com.kmg.ocrbatch.dto.OcrUrlRequest;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ItemResult;
import com.kmg.ocrbatch.model.ProcessingOptions;
import com.kmg.ocrbatch.service.DocumentResolver;
import com.kmg.ocrbatch.service.OcrBatchService;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RequestPart;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@RestController
@RequestMapping("/ocr")
public class OcrController {
    private static final Logger log = LoggerFactory.getLogger(OcrController.class);

    private final OcrBatchService ocrBatchService;

    public OcrController(OcrBatchService ocrBatchService) {
        this.ocrBatchService = ocrBatchService;
    }

    @PostMapping(value = "/process", consumes = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<ItemResultView> processUrl(@Valid @RequestBody OcrUrlRequest request) {
        if (!DocumentResolver.isUrl(request.url().trim())) {
            throw new DocumentResolver.InvalidInputException("URL is required for URL processing");
        }
        log.info("Processing URL: {}", request.url());
        ProcessingOptions options = ocrBatchService.defaultOptions().withIncludeImages(request.includeImages());
        ItemResult result = ocrBatchService.processSingle(request.url(), options);
        return respond(ocrBatchService.toView(result));
    }

    @PostMapping(value = "/process", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<ItemResultView> processFile(
            @RequestPart("file") MultipartFile file,
            @RequestParam(value = "includeImages", defaultValue = "false") boolean includeImages
    ) throws IOException {
        if (file.isEmpty()) {
            throw new DocumentResolver.InvalidInputException("File is required for file processing");
        }
        String originalName = file.getOriginalFilename() == null ? "upload" : Path.of(file.getOriginalFilename()).getFileName().toString();
        log.info("Processing uploaded file: {}", originalName);

        Path tempFile = Files.createTempFile("ocr-upload-", suffixOf(originalName));
        try {
            file.transferTo(tempFile);
            ProcessingOptions options = ocrBatchService.defaultOptions().withIncludeImages(includeImages);
            ItemResult result = ocrBatchService.processFile(tempFile, options);
            return respond(ocrBatchService.toView(result).withFile(originalName));
        } finally {
            Files.deleteIfExists(tempFile);
        }
    }

    @PostMapping("/batch")
    public BatchView processBatch(@Valid @RequestBody OcrBatchRequest request) {
        ProcessingOptions options = ocrBatchService.defaultOptions().withIncludeImages(request.includeImages());
        BatchResult result = ocrBatchService.processUrls(request.urls(), options, request.concurrency());
        return ocrBatchService.toView(result);
    }

    private ResponseEntity<ItemResultView> respond(ItemResultView view) {
        if (view.error() == null) {
            return ResponseEntity.ok(view);
        }
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(view);
    }

    private static String suffixOf(String fileName) {
        int idx = fileName.lastIndexOf('.');
        return idx < 0 ? "" : fileName.substring(idx);
    }
}
