package com.kmg.ocrbatch.backend;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.kmg.ocrbatch.model.DocumentSource;
import com.kmg.ocrbatch.model.DocumentType;
import com.kmg.ocrbatch.model.FileRef;
import com.kmg.ocrbatch.model.UrlRef;
import com.kmg.ocrbatch.model.WorkItem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientResponseException;

import java.io.IOException;
import java.nio.file.Files;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Base64;

/**
 * Mistral OCR API client. URLs are passed through as {@code document_url}; local files are sent inline as
 * base64 data URIs.
 */
public class MistralOcrBackend implements OcrBackend {
    private static final Logger log = LoggerFactory.getLogger(MistralOcrBackend.class);
    static final String OCR_PATH = "/v1/ocr";

    private final RestClient restClient;
    private final ObjectMapper objectMapper;
    private final String defaultModel;

    public MistralOcrBackend(RestClient restClient, ObjectMapper objectMapper, String defaultModel) {
        this.restClient = restClient;
        this.objectMapper = objectMapper;
        this.defaultModel = defaultModel;
    }

    @Override
    public JsonNode process(WorkItem item) throws IOException {
        ObjectNode body = buildRequest(item);
        log.debug("Sending {} to Mistral OCR", item.displayName());

        String response;
        try {
            response = restClient.post()
                    .uri(OCR_PATH)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(String.class);
        } catch (RestClientResponseException e) {
            throw new OcrBackendException(
                    e.getStatusCode().value(),
                    "Mistral API error: " + e.getStatusText() + " " + e.getResponseBodyAsString(),
                    retryAfter(e.getResponseHeaders())
            );
        } catch (ResourceAccessException e) {
            throw new IOException("Mistral API unreachable: " + e.getMessage(), e);
        }
        return parse(response);
    }

    ObjectNode buildRequest(WorkItem item) {
        String model = item.options().model();
        ObjectNode body = objectMapper.createObjectNode();
        body.put("model", model == null || model.isBlank() ? defaultModel : model);
        body.set("document", document(item.source()));
        body.put("include_image_base64", item.options().includeImages());
        return body;
    }

    private ObjectNode document(DocumentSource source) {
        ObjectNode document = objectMapper.createObjectNode();
        if (source instanceof UrlRef url) {
            document.put("type", "document_url");
            document.put("document_url", url.uri().toString());
            return document;
        }

        FileRef file = (FileRef) source;
        byte[] content;
        try {
            content = Files.readAllBytes(file.path());
        } catch (IOException e) {
            throw new DocumentUnreadableException("Error reading file: " + file.path(), e);
        }
        String dataUri = "data:" + file.mimeType() + ";base64," + Base64.getEncoder().encodeToString(content);
        if (file.documentType() == DocumentType.PDF) {
            document.put("type", "document_url");
            document.put("document_url", dataUri);
        } else {
            document.put("type", "image_url");
            document.put("image_url", dataUri);
        }
        document.put("document_name", file.fileName());
        return document;
    }

    JsonNode parse(String response) {
        if (response == null || response.isBlank()) {
            throw new MalformedResponseException("Empty response from Mistral API");
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(response);
        } catch (JsonProcessingException e) {
            throw new MalformedResponseException("Unparseable response from Mistral API: " + e.getOriginalMessage(), e);
        }
        if (!node.isObject() || !node.has("pages")) {
            throw new MalformedResponseException("Mistral API response has no pages");
        }
        return node;
    }

    static Duration retryAfter(HttpHeaders headers) {
        if (headers == null) {
            return null;
        }
        String value = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        if (trimmed.length() <= 9 && trimmed.chars().allMatch(Character::isDigit)) {
            return Duration.ofSeconds(Long.parseLong(trimmed));
        }
        try {
            ZonedDateTime at = ZonedDateTime.parse(trimmed, DateTimeFormatter.RFC_1123_DATE_TIME);
            Duration until = Duration.between(ZonedDateTime.now(at.getZone()), at);
            return until.isNegative() ? Duration.ZERO : until;
        } catch (DateTimeParseException e) {
            log.debug("Ignoring unparseable Retry-After header: {}", value);
            return null;
        }
    }
}
