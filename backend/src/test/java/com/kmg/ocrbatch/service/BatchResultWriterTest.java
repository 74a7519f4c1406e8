package com.kmg.ocrbatch.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.ocrbatch.dto.BatchView;
import com.kmg.ocrbatch.dto.ErrorView;
import com.kmg.ocrbatch.dto.ItemResultView;
import com.kmg.ocrbatch.model.ErrorKind;
import com.kmg.ocrbatch.model.ItemState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BatchResultWriterTest {

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final BatchResultWriter writer = new BatchResultWriter(objectMapper);

    @Test
    void write_CreatesParentDirectoriesAndPrettyPrints() throws IOException {
        // given
        ItemResultView ok = new ItemResultView("item-0001", "a.png", ItemState.SUCCEEDED, 1, List.of(),
                objectMapper.createObjectNode().put("model", "mistral-ocr-latest"), null);
        ItemResultView failed = new ItemResultView("item-0002", "https://example.com/b.pdf", ItemState.FAILED, 3,
                List.of(), null, new ErrorView(ErrorKind.BACKEND_FAULT, "HTTP 500", true, 500));
        BatchView view = new BatchView(List.of(ok, failed), 1, 1, List.of("https://example.com/b.pdf"));
        Path target = tempDir.resolve("nested/out/results.json");

        // when
        Path written = writer.write(view, target);

        // then
        assertThat(written).exists();
        String content = Files.readString(written);
        assertThat(content).contains(System.lineSeparator());
        JsonNode json = objectMapper.readTree(content);
        assertThat(json.path("succeededCount").asInt()).isEqualTo(1);
        assertThat(json.path("items").get(0).has("error")).isFalse();
        assertThat(json.path("items").get(1).path("error").path("kind").asText()).isEqualTo("BACKEND_FAULT");
        assertThat(json.path("failedUrls").get(0).asText()).isEqualTo("https://example.com/b.pdf");
    }

    @Test
    void write_DirectoryTarget_Throws() {
        BatchView view = new BatchView(List.of(), 0, 0, List.of());

        assertThatThrownBy(() -> writer.write(view, tempDir))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("directory");
    }
}
