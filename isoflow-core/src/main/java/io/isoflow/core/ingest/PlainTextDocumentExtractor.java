package io.isoflow.core.ingest;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import java.util.logging.Logger;

/// Reads `.txt` and Markdown files.
///
/// Text is decoded as UTF-8, falling back to ISO-8859-1 for legacy files. A leading byte
/// order mark is dropped and line endings are normalised to `\n`.
public final class PlainTextDocumentExtractor implements DocumentTextExtractor {

    private static final Logger logger =
            Logger.getLogger(PlainTextDocumentExtractor.class.getName());

    static final Set<String> EXTENSIONS = Set.of("txt", "text", "md", "markdown");

    @Override
    public boolean supports(Path file) {
        return EXTENSIONS.contains(extension(file));
    }

    @Override
    public String extractPlainText(Path file)
            throws UnsupportedFormatException, ExtractionFailedException {
        Objects.requireNonNull(file, "file must not be null");
        if (!supports(file)) {
            throw new UnsupportedFormatException(
                    file, "Unsupported document type: ." + extension(file));
        }

        String text;
        try {
            text = read(file);
        } catch (IOException e) {
            throw new ExtractionFailedException(file, "Cannot read " + file, e);
        }

        if (!text.isEmpty() && text.charAt(0) == '\uFEFF') {
            text = text.substring(1);
        }
        return text.replace("\r\n", "\n").replace('\r', '\n');
    }

    private static String read(Path file) throws IOException {
        try {
            return Files.readString(file, StandardCharsets.UTF_8);
        } catch (CharacterCodingException e) {
            logger.fine(file + " is not UTF-8, reading as ISO-8859-1");
            return Files.readString(file, StandardCharsets.ISO_8859_1);
        }
    }

    private static String extension(Path file) {
        Path name = file.getFileName();
        if (name == null) {
            return "";
        }
        String fileName = name.toString();
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }
}
