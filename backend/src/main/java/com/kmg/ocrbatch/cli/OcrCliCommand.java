package com.kmg.ocrbatch.cli;

import com.kmg.ocrbatch.config.OcrBatchProperties;
import com.kmg.ocrbatch.dto.BatchView;
import com.kmg.ocrbatch.model.BatchResult;
import com.kmg.ocrbatch.model.ProcessingOptions;
import com.kmg.ocrbatch.service.BatchResultWriter;
import com.kmg.ocrbatch.service.DocumentResolver;
import com.kmg.ocrbatch.service.OcrBatchService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.logging.LogLevel;
import org.springframework.boot.logging.LoggingSystem;
import org.springframework.stereotype.Component;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.Callable;

/**
 * Command-line mode: resolve one input (file, directory or URL), run the batch and write the JSON artifact.
 *
 * <p>Exit codes: {@code 0} artifact written, {@code 2} items failed with {@code --fail-on-error},
 * {@code 1} usage, input or output error.</p>
 */
@Component
@Command(
        name = "cli",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "Run OCR over a file, a directory of documents or a URL and save the responses as JSON"
)
public class OcrCliCommand implements Callable<Integer> {
    static final int EXIT_OK = 0;
    static final int EXIT_ERROR = 1;
    static final int EXIT_ITEMS_FAILED = 2;

    private static final Logger log = LoggerFactory.getLogger(OcrCliCommand.class);

    private final OcrBatchService ocrBatchService;
    private final BatchResultWriter resultWriter;
    private final OcrBatchProperties properties;
    private final LoggingSystem loggingSystem;

    @Option(names = {"-i", "--input"}, required = true,
            description = "Path to a PDF or image file, a directory of such files, or a document URL")
    private String input;

    @Option(names = {"-o", "--output"},
            description = "Path of the JSON file to write (default: <ocr.output.dir>/ocr_results.json)")
    private Path output;

    @Option(names = {"-c", "--concurrency"}, description = "Maximum concurrent backend calls (default: ocr.batch.concurrency)")
    private Integer concurrency;

    @Option(names = {"--include-images"}, description = "Include base64 images of the pages in the responses")
    private boolean includeImages;

    @Option(names = {"--timeout"}, description = "Overall batch timeout as ISO-8601 duration, e.g. PT5M (default: ocr.batch.timeout)")
    private Duration timeout;

    @Option(names = {"--fail-on-error"}, description = "Exit with code 2 when any item failed")
    private boolean failOnError;

    @Option(names = {"-v", "--verbose"}, description = "Enable debug logging")
    private boolean verbose;

    // Applied as logging.file.name before the context starts, see CliArguments.toSpringArgs
    @Option(names = {"-l", "--log-file"}, description = "Path of the log file (default: logging.file.name)")
    private Path logFile;

    public OcrCliCommand(OcrBatchService ocrBatchService, BatchResultWriter resultWriter,
                         OcrBatchProperties properties, LoggingSystem loggingSystem) {
        this.ocrBatchService = ocrBatchService;
        this.resultWriter = resultWriter;
        this.properties = properties;
        this.loggingSystem = loggingSystem;
    }

    /**
     * Command line for this command. Usage errors exit with {@link #EXIT_ERROR} so they are never mistaken for
     * failed items.
     */
    public CommandLine commandLine() {
        CommandLine commandLine = new CommandLine(this);
        commandLine.setParameterExceptionHandler((e, args) -> {
            CommandLine failed = e.getCommandLine();
            failed.getErr().println(e.getMessage());
            failed.usage(failed.getErr());
            return EXIT_ERROR;
        });
        return commandLine;
    }

    @Override
    public Integer call() {
        if (verbose) {
            loggingSystem.setLogLevel("com.kmg.ocrbatch", LogLevel.DEBUG);
        }
        if (logFile != null) {
            log.debug("Logging to {}", logFile);
        }
        if (concurrency != null && concurrency < 1) {
            log.error("--concurrency must be >= 1 (current: {})", concurrency);
            return EXIT_ERROR;
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            log.error("--timeout must be positive (current: {})", timeout);
            return EXIT_ERROR;
        }

        ProcessingOptions options = includeImages
                ? ocrBatchService.defaultOptions().withIncludeImages(true)
                : ocrBatchService.defaultOptions();

        BatchResult result;
        try {
            result = ocrBatchService.processInput(input, options, concurrency, timeout);
        } catch (DocumentResolver.ResolutionException e) {
            log.error("{}: {}", e.kind(), e.getMessage());
            return EXIT_ERROR;
        }

        BatchView view = ocrBatchService.toView(result);
        Path target = output != null ? output : Path.of(properties.getOutput().getDir(), "ocr_results.json");
        try {
            resultWriter.write(view, target);
        } catch (UncheckedIOException | IllegalArgumentException e) {
            log.error("Could not write results: {}", e.getMessage());
            return EXIT_ERROR;
        }

        log.info("Processed {} item(s): {} succeeded, {} failed",
                result.total(), result.succeededCount(), result.failedCount());
        if (result.hasFailures() && failOnError) {
            return EXIT_ITEMS_FAILED;
        }
        return EXIT_OK;
    }
}
