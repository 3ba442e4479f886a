package io.isoflow.core.ingest;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

class PlainTextDocumentExtractorTest {

    private final PlainTextDocumentExtractor extractor = new PlainTextDocumentExtractor();

    @TempDir Path dir;

    @ParameterizedTest
    @ValueSource(strings = {"steps.txt", "README.md", "notes.Markdown", "plain.TEXT"})
    void shouldSupportTextAndMarkdown(String name) {
        assertThat(extractor.supports(dir.resolve(name))).isTrue();
    }

    @ParameterizedTest
    @ValueSource(strings = {"manual.pdf", "process.docx", "Makefile"})
    void shouldRejectOtherFormats(String name) throws Exception {
        Path file = Files.writeString(dir.resolve(name), "1. Start");

        assertThat(extractor.supports(file)).isFalse();
        assertThatThrownBy(() -> extractor.extractPlainText(file))
                .isInstanceOf(UnsupportedFormatException.class)
                .hasMessageStartingWith("Unsupported document type");
    }

    @Test
    void shouldNormaliseLineEndingsAndDropBom() throws Exception {
        Path file = dir.resolve("steps.txt");
        Files.writeString(
                file, "\uFEFF1. Start\r\n2. Check stock\r3. End\n", StandardCharsets.UTF_8);

        assertThat(extractor.extractPlainText(file))
                .isEqualTo("1. Start\n2. Check stock\n3. End\n");
    }

    @Test
    void shouldFallBackToLatin1() throws Exception {
        Path file = dir.resolve("legacy.txt");
        Files.write(file, "1. Prüfe den Antrag".getBytes(StandardCharsets.ISO_8859_1));

        assertThat(extractor.extractPlainText(file)).isEqualTo("1. Prüfe den Antrag");
    }

    @Test
    void shouldReportMissingFile() {
        Path file = dir.resolve("missing.md");

        assertThatThrownBy(() -> extractor.extractPlainText(file))
                .isInstanceOf(ExtractionFailedException.class)
                .satisfies(e -> assertThat(((IngestionException) e).getFile()).isEqualTo(file));
    }
}
