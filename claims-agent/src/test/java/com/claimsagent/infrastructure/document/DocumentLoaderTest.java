package com.claimsagent.infrastructure.document;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DocumentLoaderTest {

    private final DocumentLoader loader = new DocumentLoader();

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("Text files are read as UTF-8")
    void reads_text() throws IOException {
        Path file = tempDir.resolve("claim.txt");
        Files.writeString(file, "Claimant: José Peña", StandardCharsets.UTF_8);

        assertThat(loader.load(file)).isEqualTo("Claimant: José Peña");
    }

    @Test
    @DisplayName("PDF text is extracted from every page")
    void reads_pdf() throws IOException {
        Path file = tempDir.resolve("claim.pdf");
        try (PDDocument document = new PDDocument()) {
            addPage(document, "Policy Number: POL-2024-001234");
            addPage(document, "Claim Type: auto");
            document.save(file.toFile());
        }

        String text = loader.load(file);

        assertThat(text).contains("Policy Number: POL-2024-001234").contains("Claim Type: auto");
        assertThat(text.indexOf("Policy Number")).isLessThan(text.indexOf("Claim Type"));
    }

    @Test
    @DisplayName("Extension check ignores case")
    void upper_case_extension() throws IOException {
        Path file = tempDir.resolve("CLAIM.TXT");
        Files.writeString(file, "Location: Dock 4");

        assertThat(loader.isSupported(file)).isTrue();
        assertThat(loader.load(file)).isEqualTo("Location: Dock 4");
    }

    @Test
    @DisplayName("Missing file raises DocumentNotFoundException")
    void missing_file() {
        assertThatThrownBy(() -> loader.load(tempDir.resolve("nope.txt")))
                .isInstanceOf(DocumentNotFoundException.class)
                .isInstanceOf(DocumentLoadException.class)
                .hasMessageContaining("nope.txt");
    }

    @Test
    @DisplayName("Other extensions raise UnsupportedDocumentFormatException")
    void unsupported_format() throws IOException {
        Path file = tempDir.resolve("claim.docx");
        Files.writeString(file, "binary-ish");

        assertThatThrownBy(() -> loader.load(file))
                .isInstanceOf(UnsupportedDocumentFormatException.class)
                .hasMessageContaining("claim.docx");
    }

    @Test
    @DisplayName("A corrupt PDF raises DocumentLoadException")
    void corrupt_pdf() throws IOException {
        Path file = tempDir.resolve("broken.pdf");
        Files.writeString(file, "this is not a pdf");

        assertThatThrownBy(() -> loader.load(file))
                .isExactlyInstanceOf(DocumentLoadException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    private static void addPage(PDDocument document, String line) throws IOException {
        PDPage page = new PDPage();
        document.addPage(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
            content.beginText();
            content.setFont(PDType1Font.HELVETICA, 12);
            content.newLineAtOffset(72, 700);
            content.showText(line);
            content.endText();
        }
    }
}
