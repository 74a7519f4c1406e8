package com.kmg.ocrbatch.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.kmg.ocrbatch.dto.BatchView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Service
public class BatchResultWriter {
    private static final Logger log = LoggerFactory.getLogger(BatchResultWriter.class);

    private final ObjectMapper objectMapper;

    public BatchResultWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Path write(BatchView view, Path outputPath) {
        Path target = outputPath.toAbsolutePath().normalize();
        if (Files.isDirectory(target)) {
            throw new IllegalArgumentException("Output path is a directory: " + target);
        }
        try {
            if (target.getParent() != null) {
                Files.createDirectories(target.getParent());
            }
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), view);
        } catch (IOException e) {
            throw new UncheckedIOException("Error saving output to " + target + ": " + e.getMessage(), e);
        }
        log.info("OCR responses saved to {}", target);
        return target;
    }
}
