package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.config.DuplicateNamePolicy;
import com.kmg.ocrbatch.config.ResolverSettings;
import com.kmg.ocrbatch.model.DocumentSource;
import com.kmg.ocrbatch.model.DocumentType;
import com.kmg.ocrbatch.model.ErrorKind;
import com.kmg.ocrbatch.model.FileRef;
import com.kmg.ocrbatch.model.ProcessingOptions;
import com.kmg.ocrbatch.model.UrlRef;
import com.kmg.ocrbatch.model.WorkItem;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Turns input descriptors (file path, directory path or URL) into an ordered list of work items.
 * Item ids follow input order and are numbered across every descriptor of one call.
 */
public class DocumentResolver {
    private static final Logger log = LoggerFactory.getLogger(DocumentResolver.class);
    private static final List<String> URL_PREFIXES = List.of("http://", "https://");

    private final ResolverSettings settings;

    public DocumentResolver(ResolverSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings");
    }

    public List<WorkItem> resolve(String descriptor, ProcessingOptions options) {
        return resolveAll(List.of(descriptor == null ? "" : descriptor), options);
    }

    public List<WorkItem> resolveAll(List<String> descriptors, ProcessingOptions options) {
        if (descriptors == null || descriptors.isEmpty()) {
            throw new InvalidInputException("At least one input is required.");
        }
        ProcessingOptions effective = options == null ? ProcessingOptions.defaults() : options;

        List<DocumentSource> sources = new ArrayList<>();
        for (String descriptor : descriptors) {
            sources.addAll(resolveSources(descriptor));
        }

        if (sources.isEmpty() && !settings.allowEmpty()) {
            throw new InvalidInputException("No processable documents found in: " + String.join(", ", descriptors));
        }

        List<WorkItem> items = new ArrayList<>(sources.size());
        for (int i = 0; i < sources.size(); i++) {
            items.add(new WorkItem(WorkItem.idForPosition(i), sources.get(i), effective));
        }
        log.info("Resolved {} work item(s) from {} input(s)", items.size(), descriptors.size());
        return List.copyOf(items);
    }

    public static boolean isUrl(String descriptor) {
        String lower = descriptor.toLowerCase(Locale.ROOT);
        return URL_PREFIXES.stream().anyMatch(lower::startsWith);
    }

    private List<DocumentSource> resolveSources(String descriptor) {
        if (descriptor == null || descriptor.isBlank()) {
            throw new InvalidInputException("Input must not be blank.");
        }
        String trimmed = descriptor.trim();
        if (isUrl(trimmed)) {
            return List.of(new UrlRef(toUri(trimmed)));
        }

        Path path;
        try {
            path = Path.of(trimmed).toAbsolutePath().normalize();
        } catch (InvalidPathException e) {
            throw new InvalidInputException("Invalid input path: " + trimmed);
        }

        if (Files.isRegularFile(path)) {
            return List.of(toFileRef(path));
        }
        if (Files.isDirectory(path)) {
            return listDirectory(path);
        }
        throw new InvalidInputException("Invalid input path: " + trimmed + ". Must be a file, directory, or URL.");
    }

    private List<DocumentSource> listDirectory(Path root) {
        List<Path> files;
        try (Stream<Path> stream = settings.recursive() ? Files.walk(root) : Files.list(root)) {
            files = stream.filter(Files::isRegularFile)
                    .filter(this::isSupported)
                    .sorted(Comparator.comparing(p -> root.relativize(p).toString()))
                    .toList();
        } catch (IOException e) {
            throw new InvalidInputException("Failed to list directory " + root + ": " + e.getMessage());
        }

        Set<String> seen = new HashSet<>();
        List<DocumentSource> sources = new ArrayList<>(files.size());
        for (Path file : files) {
            String key = root.relativize(file).toString().toLowerCase(Locale.ROOT);
            if (!seen.add(key) && settings.duplicateNames() == DuplicateNamePolicy.KEEP_FIRST) {
                log.debug("Skipping case-insensitive duplicate {}", file);
                continue;
            }
            sources.add(toFileRef(file));
        }

        if (sources.isEmpty()) {
            log.warn("No supported files found in directory: {}", root);
        }
        return sources;
    }

    private FileRef toFileRef(Path file) {
        String name = file.getFileName().toString();
        DocumentType type = DocumentType.fromFileName(name)
                .orElseThrow(() -> new UnsupportedFileTypeException(file.toString()));

        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new InvalidInputException("Failed to read file " + file + ": " + e.getMessage());
        }
        Integer pages = type == DocumentType.PDF ? readPageCount(file) : null;
        return new FileRef(file, type, size, pages);
    }

    private Integer readPageCount(Path pdf) {
        try (PDDocument document = Loader.loadPDF(pdf.toFile())) {
            return document.getNumberOfPages();
        } catch (IOException e) {
            log.debug("Could not read page count of {}: {}", pdf, e.getMessage());
            return null;
        }
    }

    private boolean isSupported(Path path) {
        return DocumentType.isSupportedExtension(DocumentType.extensionOf(path.getFileName().toString()));
    }

    private URI toUri(String value) {
        URI uri;
        try {
            uri = URI.create(value);
        } catch (IllegalArgumentException e) {
            throw new InvalidInputException("Malformed URL: " + value);
        }
        if (uri.getHost() == null) {
            throw new InvalidInputException("URL has no host: " + value);
        }
        return uri;
    }

    public abstract static class ResolutionException extends IllegalArgumentException {
        protected ResolutionException(String message) {
            super(message);
        }

        public abstract ErrorKind kind();
    }

    public static class InvalidInputException extends ResolutionException {
        public InvalidInputException(String message) {
            super(message);
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.INVALID_INPUT;
        }
    }

    public static class UnsupportedFileTypeException extends ResolutionException {
        public UnsupportedFileTypeException(String filePath) {
            super("Unsupported file type (Path: " + filePath + ")");
        }

        @Override
        public ErrorKind kind() {
            return ErrorKind.UNSUPPORTED_FILE_TYPE;
        }
    }
}
