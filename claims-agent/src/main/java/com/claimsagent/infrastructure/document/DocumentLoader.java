package com.claimsagent.infrastructure.document;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads FNOL documents into plain text. Plain text files are read as UTF-8;
 * PDFs go through PDFBox one page at a time.
 */
@Slf4j
@Component
public class DocumentLoader {

    public boolean isSupported(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".txt") || name.endsWith(".pdf");
    }

    /**
     * @throws DocumentNotFoundException          if the file does not exist
     * @throws UnsupportedDocumentFormatException if the extension is neither .txt nor .pdf
     * @throws DocumentLoadException              on any read or parse failure
     */
    public String load(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new DocumentNotFoundException(path);
        }
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".txt")) {
            return readText(path);
        }
        if (name.endsWith(".pdf")) {
            return readPdf(path);
        }
        throw new UnsupportedDocumentFormatException(path);
    }

    private String readText(Path path) {
        try {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            log.info("[Loader] Read {} ({} chars)", path.getFileName(), text.length());
            return text;
        } catch (IOException e) {
            throw new DocumentLoadException("Failed to read " + path + ": " + e.getMessage(), e);
        }
    }

    private String readPdf(Path path) {
        try (PDDocument document = PDDocument.load(path.toFile())) {
            PDFTextStripper stripper = new PDFTextStripper();
            int pages = document.getNumberOfPages();
            StringBuilder text = new StringBuilder();
            for (int page = 1; page <= pages; page++) {
                stripper.setStartPage(page);
                stripper.setEndPage(page);
                text.append(stripper.getText(document)).append('\n');
            }
            log.info("[Loader] Extracted {} pages from {} ({} chars)", pages, path.getFileName(), text.length());
            return text.toString();
        } catch (IOException e) {
            throw new DocumentLoadException("Failed to extract text from PDF " + path + ": " + e.getMessage(), e);
        }
    }
}
