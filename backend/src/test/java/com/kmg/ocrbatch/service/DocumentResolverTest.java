package com.kmg.ocrbatch.service;

import com.kmg.ocrbatch.config.DuplicateNamePolicy;
import com.kmg.ocrbatch.config.ResolverSettings;
import com.kmg.ocrbatch.model.DocumentType;
import com.kmg.ocrbatch.model.FileRef;
import com.kmg.ocrbatch.model.ProcessingOptions;
import com.kmg.ocrbatch.model.UrlRef;
import com.kmg.ocrbatch.model.WorkItem;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentResolverTest {

    @TempDir
    Path tempDir;

    private final DocumentResolver resolver = new DocumentResolver(ResolverSettings.defaults());

    @Test
    void resolve_Directory_KeepsSupportedFilesSortedByName() throws IOException {
        // given
        Files.writeString(tempDir.resolve("b.pdf"), "not really a pdf");
        Files.write(tempDir.resolve("a.png"), new byte[]{1, 2, 3});
        Files.writeString(tempDir.resolve("c.txt"), "notes");

        // when
        List<WorkItem> items = resolver.resolve(tempDir.toString(), ProcessingOptions.defaults());

        // then
        assertThat(items).extracting(WorkItem::displayName).containsExactly("a.png", "b.pdf");
        assertThat(items).extracting(WorkItem::id).containsExactly("item-0001", "item-0002");
        FileRef png = (FileRef) items.get(0).source();
        assertThat(png.documentType()).isEqualTo(DocumentType.IMAGE);
        assertThat(png.sizeBytes()).isEqualTo(3);
        assertThat(png.pageCount()).isNull();
    }

    @Test
    void resolve_PdfFile_ReadsPageCount() throws IOException {
        // given
        Path pdf = tempDir.resolve("report.pdf");
        try (PDDocument document = new PDDocument()) {
            document.addPage(new PDPage());
            document.addPage(new PDPage());
            document.save(pdf.toFile());
        }

        // when
        List<WorkItem> items = resolver.resolve(pdf.toString(), ProcessingOptions.defaults());

        // then
        assertThat(items).hasSize(1);
        FileRef file = (FileRef) items.get(0).source();
        assertThat(file.documentType()).isEqualTo(DocumentType.PDF);
        assertThat(file.pageCount()).isEqualTo(2);
        assertThat(file.mimeType()).isEqualTo("application/pdf");
    }

    @Test
    void resolve_UnreadablePdf_LeavesPageCountUnknown() throws IOException {
        // given
        Path pdf = tempDir.resolve("broken.pdf");
        Files.writeString(pdf, "garbage");

        // when
        FileRef file = (FileRef) resolver.resolve(pdf.toString(), ProcessingOptions.defaults()).get(0).source();

        // then
        assertThat(file.pageCount()).isNull();
    }

    @Test
    void resolve_UppercaseExtension_IsSupported() throws IOException {
        // given
        Path image = tempDir.resolve("SCAN.JPG");
        Files.write(image, new byte[]{1});

        // when
        List<WorkItem> items = resolver.resolve(image.toString(), ProcessingOptions.defaults());

        // then
        assertThat(((FileRef) items.get(0).source()).mimeType()).isEqualTo("image/jpeg");
    }

    @Test
    void resolve_UnsupportedSingleFile_ThrowsUnsupportedFileType() throws IOException {
        // given
        Path text = tempDir.resolve("notes.txt");
        Files.writeString(text, "hello");

        // when & then
        assertThatThrownBy(() -> resolver.resolve(text.toString(), ProcessingOptions.defaults()))
                .isInstanceOf(DocumentResolver.UnsupportedFileTypeException.class)
                .hasMessageContaining("notes.txt");
    }

    @Test
    void resolve_MissingPath_ThrowsInvalidInput() {
        // given
        String missing = tempDir.resolve("nope").toString();

        // when & then
        assertThatThrownBy(() -> resolver.resolve(missing, ProcessingOptions.defaults()))
                .isInstanceOf(DocumentResolver.InvalidInputException.class)
                .hasMessageContaining("Must be a file, directory, or URL");
    }

    @Test
    void resolve_BlankDescriptor_ThrowsInvalidInput() {
        assertThatThrownBy(() -> resolver.resolve("   ", ProcessingOptions.defaults()))
                .isInstanceOf(DocumentResolver.InvalidInputException.class);
    }

    @Test
    void resolve_EmptyDirectory_ThrowsUnlessEmptyAllowed() throws IOException {
        // given
        Files.writeString(tempDir.resolve("readme.md"), "# nothing to see");
        DocumentResolver lenient = new DocumentResolver(ResolverSettings.defaults().withAllowEmpty(true));

        // when & then
        assertThatThrownBy(() -> resolver.resolve(tempDir.toString(), ProcessingOptions.defaults()))
                .isInstanceOf(DocumentResolver.InvalidInputException.class)
                .hasMessageContaining("No processable documents");
        assertThat(lenient.resolve(tempDir.toString(), ProcessingOptions.defaults())).isEmpty();
    }

    @Test
    void resolve_Url_ProducesSingleUrlItem() {
        // given
        ProcessingOptions options = ProcessingOptions.defaults().withIncludeImages(true);

        // when
        List<WorkItem> items = resolver.resolve("https://example.com/doc.pdf", options);

        // then
        assertThat(items).hasSize(1);
        assertThat(items.get(0).source()).isEqualTo(new UrlRef(java.net.URI.create("https://example.com/doc.pdf")));
        assertThat(items.get(0).options().includeImages()).isTrue();
    }

    @Test
    void resolve_UrlWithoutHost_ThrowsInvalidInput() {
        assertThatThrownBy(() -> resolver.resolve("https://", ProcessingOptions.defaults()))
                .isInstanceOf(DocumentResolver.InvalidInputException.class);
    }

    @Test
    void resolveAll_NumbersIdsAcrossDescriptors() {
        // when
        List<WorkItem> items = resolver.resolveAll(
                List.of("https://example.com/1.pdf", "https://example.com/2.pdf", "https://example.com/3.pdf"),
                ProcessingOptions.defaults());

        // then
        assertThat(items).extracting(WorkItem::id).containsExactly("item-0001", "item-0002", "item-0003");
        assertThat(items).extracting(WorkItem::displayName)
                .containsExactly("https://example.com/1.pdf", "https://example.com/2.pdf", "https://example.com/3.pdf");
    }

    @Test
    void resolve_Recursive_WalksSubdirectories() throws IOException {
        // given
        Files.createDirectories(tempDir.resolve("sub"));
        Files.write(tempDir.resolve("top.png"), new byte[]{1});
        Files.write(tempDir.resolve("sub").resolve("inner.png"), new byte[]{1});
        DocumentResolver recursive = new DocumentResolver(new ResolverSettings(true, false, DuplicateNamePolicy.KEEP_ALL));

        // when
        List<WorkItem> flat = resolver.resolve(tempDir.toString(), ProcessingOptions.defaults());
        List<WorkItem> deep = recursive.resolve(tempDir.toString(), ProcessingOptions.defaults());

        // then
        assertThat(flat).extracting(WorkItem::displayName).containsExactly("top.png");
        assertThat(deep).extracting(WorkItem::displayName).containsExactly("inner.png", "top.png");
    }

    @Test
    void resolve_KeepFirst_DropsCaseInsensitiveDuplicates() throws IOException {
        // given
        Files.write(tempDir.resolve("Scan.png"), new byte[]{1});
        Files.write(tempDir.resolve("other.png"), new byte[]{1});
        Path upper = tempDir.resolve("SCAN.png");
        boolean caseSensitiveFs = !Files.exists(upper);
        Files.write(upper, new byte[]{2});
        DocumentResolver keepFirst = new DocumentResolver(new ResolverSettings(false, false, DuplicateNamePolicy.KEEP_FIRST));

        // when
        List<WorkItem> all = resolver.resolve(tempDir.toString(), ProcessingOptions.defaults());
        List<WorkItem> deduplicated = keepFirst.resolve(tempDir.toString(), ProcessingOptions.defaults());

        // then
        assertThat(deduplicated).hasSize(2);
        assertThat(all).hasSize(caseSensitiveFs ? 3 : 2);
    }
}
