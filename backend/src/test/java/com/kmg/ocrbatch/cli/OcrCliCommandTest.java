package com.kmg.ocrbatch.cli;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.ocrbatch.config.OcrBatchProperties;
import com.kmg.ocrbatch.dto.BatchView;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ProcessingOptions;
import com.kmg.ocrbatch.service.BatchResultWriter;
import com.kmg.ocrbatch.service.DocumentResolver;
import com.kmg.ocrbatch.service.OcrBatchService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class OcrCliCommandTest {

    @TempDir
    Path tempDir;

    private final OcrBatchService ocrBatchService = mock(OcrBatchService.class);
    private final LoggingSystem loggingSystem = mock(LoggingSystem.class);
    private final OcrBatchProperties properties = new OcrBatchProperties();
    private CommandLine commandLine;

    @BeforeEach
    void setUp() {
        properties.getOutput().setDir(tempDir.resolve("default-out").toString());
        OcrCliCommand command = new OcrCliCommand(ocrBatchService, new BatchResultWriter(new ObjectMapper()),
                properties, loggingSystem);
        commandLine = command.commandLine();
        when(ocrBatchService.defaultOptions()).thenReturn(ProcessingOptions.defaults());
    }

    @Test
    void call_AllItemsSucceeded_WritesArtifactAndExitsZero() {
        // given
        stubBatch(new BatchResult(List.of(), 2, 0));
        Path output = tempDir.resolve("out/results.json");

        // when
        int exitCode = commandLine.execute("-i", "/docs", "-o", output.toString(), "-c", "2", "--timeout", "PT1M");

        // then
        assertThat(exitCode).isEqualTo(OcrCliCommand.EXIT_OK);
        assertThat(output).exists();
        verify(ocrBatchService).processInput(eq("/docs"), any(), eq(2), eq(Duration.ofMinutes(1)));
    }

    @Test
    void call_FailedItemsWithoutFailOnError_StillExitsZero() {
        // given
        stubBatch(new BatchResult(List.of(), 1, 1));

        // when
        int exitCode = commandLine.execute("-i", "/docs");

        // then
        assertThat(exitCode).isEqualTo(OcrCliCommand.EXIT_OK);
        assertThat(tempDir.resolve("default-out/ocr_results.json")).exists();
    }

    @Test
    void call_FailedItemsWithFailOnError_ExitsTwo() {
        // given
        stubBatch(new BatchResult(List.of(), 1, 1));

        // when
        int exitCode = commandLine.execute("-i", "/docs", "-o", tempDir.resolve("r.json").toString(), "--fail-on-error");

        // then
        assertThat(exitCode).isEqualTo(OcrCliCommand.EXIT_ITEMS_FAILED);
    }

    @Test
    void call_ResolutionError_ExitsOne() {
        // given
        when(ocrBatchService.processInput(any(), any(), any(), any()))
                .thenThrow(new DocumentResolver.InvalidInputException("Invalid input path: /nope"));

        // when
        int exitCode = commandLine.execute("-i", "/nope");

        // then
        assertThat(exitCode).isEqualTo(OcrCliCommand.EXIT_ERROR);
    }

    @Test
    void call_Verbose_RaisesLogLevel() {
        // given
        stubBatch(new BatchResult(List.of(), 0, 0));

        // when
        commandLine.execute("-i", "/docs", "-v", "--include-images");

        // then
        verify(loggingSystem).setLogLevel("com.kmg.ocrbatch", LogLevel.DEBUG);
        verify(ocrBatchService).processInput(eq("/docs"), eq(ProcessingOptions.defaults().withIncludeImages(true)),
                any(), any());
    }

    @Test
    void execute_UsageErrors_ExitOneNotTwo() {
        // when
        int missingInput = commandLine.execute();
        int badTimeout = commandLine.execute("-i", "/docs", "--timeout", "soon");
        int unknownOption = commandLine.execute("-i", "/docs", "--frobnicate");

        // then
        assertThat(missingInput).isEqualTo(OcrCliCommand.EXIT_ERROR);
        assertThat(badTimeout).isEqualTo(OcrCliCommand.EXIT_ERROR);
        assertThat(unknownOption).isEqualTo(OcrCliCommand.EXIT_ERROR);
        assertThat(OcrCliCommand.EXIT_ERROR).isNotEqualTo(OcrCliCommand.EXIT_ITEMS_FAILED);
        verifyNoInteractions(ocrBatchService);
    }

    @Test
    void call_NonPositiveTimeout_ExitsOne() {
        // when
        int exitCode = commandLine.execute("-i", "/docs", "--timeout", "PT0S");

        // then
        assertThat(exitCode).isEqualTo(OcrCliCommand.EXIT_ERROR);
        verifyNoInteractions(ocrBatchService);
    }

    @Test
    void call_LogFileOption_IsAccepted() {
        // given
        stubBatch(new BatchResult(List.of(), 1, 0));

        // when
        int exitCode = commandLine.execute("-i", "/docs", "-l", tempDir.resolve("ocr.log").toString());

        // then
        assertThat(exitCode).isEqualTo(OcrCliCommand.EXIT_OK);
    }

    private void stubBatch(BatchResult result) {
        when(ocrBatchService.processInput(any(), any(), any(), any())).thenReturn(result);
        when(ocrBatchService.toView(result)).thenReturn(
                new BatchView(List.of(), result.succeededCount(), result.failedCount(), List.of()));
    }
}
