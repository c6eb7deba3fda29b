package com.claimsagent.interfaces.cli;

import com.claimsagent.application.claim.BatchItem;
import com.claimsagent.application.claim.ClaimProcessingAppService;
import com.claimsagent.domain.claim.model.ClaimProcessingResult;
import com.claimsagent.domain.claim.model.ExtractedFields;
import com.claimsagent.domain.claim.model.Route;
import com.claimsagent.infrastructure.config.ClaimsProperties;
import com.claimsagent.infrastructure.document.DocumentNotFoundException;
import com.claimsagent.infrastructure.output.ClaimResultWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.boot.DefaultApplicationArguments;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClaimsCliRunnerTest {

    @Mock
    private ClaimProcessingAppService processingService;

    @Mock
    private ClaimResultWriter resultWriter;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private ClaimsProperties properties;
    private ClaimsCliRunner runner;

    private final ClaimProcessingResult fastTrack = new ClaimProcessingResult(
            ExtractedFields.allAbsent(), List.of(), Route.FAST_TRACK, "low damage");

    @BeforeEach
    void setUp() {
        properties = new ClaimsProperties();
        runner = new ClaimsCliRunner(processingService, resultWriter, properties,
                new PrintStream(buffer, true, StandardCharsets.UTF_8));
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    @Test
    @DisplayName("Without --file or --process-all prints usage and exits with 1")
    void usage() {
        runner.run(new DefaultApplicationArguments());

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(output()).contains("Usage:").contains("--process-all").contains("sample_documents");
    }

    @Test
    @DisplayName("--file with --json-only prints JSON")
    void single_file_json() {
        when(processingService.processDocument(Path.of("claim.txt"))).thenReturn(fastTrack);
        when(resultWriter.toJson(fastTrack)).thenReturn("{\"recommendedRoute\":\"Fast-track\"}");

        runner.run(new DefaultApplicationArguments("--file=claim.txt", "--json-only"));

        assertThat(runner.getExitCode()).isZero();
        assertThat(output()).contains("{\"recommendedRoute\":\"Fast-track\"}");
        verify(resultWriter, never()).summarize(any());
    }

    @Test
    @DisplayName("--file with --output prints the summary and saves JSON")
    void single_file_with_output() {
        when(processingService.processDocument(Path.of("claim.txt"))).thenReturn(fastTrack);
        when(resultWriter.summarize(fastTrack)).thenReturn("Recommended Route: Fast-track\n");

        runner.run(new DefaultApplicationArguments("--file=claim.txt", "--output=out/claim.json"));

        assertThat(runner.getExitCode()).isZero();
        assertThat(output()).contains("Recommended Route: Fast-track").contains("Result saved to:");
        verify(resultWriter).write(fastTrack, Path.of("out/claim.json"));
    }

    @Test
    @DisplayName("A load failure prints an error and exits with 1")
    void single_file_not_found() {
        when(processingService.processDocument(Path.of("missing.txt")))
                .thenThrow(new DocumentNotFoundException(Path.of("missing.txt")));

        runner.run(new DefaultApplicationArguments("--file=missing.txt"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(output()).contains("Error: Document not found: missing.txt");
    }

    @Test
    @DisplayName("--process-all writes one result file per successful document and reports failures")
    void process_all(@TempDir Path outputDir) {
        properties.getCli().setOutputDir(outputDir.toString());
        Path good = Path.of("docs/a_auto.txt");
        Path bad = Path.of("docs/b_broken.pdf");
        when(processingService.processDirectory(Path.of("docs"))).thenReturn(List.of(
                BatchItem.success(good, fastTrack),
                BatchItem.failure(bad, "Failed to extract text from PDF")));
        when(resultWriter.summarize(fastTrack)).thenReturn("Recommended Route: Fast-track\n");

        runner.run(new DefaultApplicationArguments("--process-all=docs"));

        assertThat(runner.getExitCode()).isZero();
        verify(resultWriter).write(fastTrack, outputDir.resolve("a_auto_result.json"));
        assertThat(output())
                .contains("Found 2 documents")
                .contains("Error processing b_broken.pdf: Failed to extract text from PDF");
    }

    @Test
    @DisplayName("--process-all without a value uses the configured sample directory")
    void process_all_default_directory() {
        when(processingService.processDirectory(Path.of("sample_documents"))).thenReturn(List.of());

        runner.run(new DefaultApplicationArguments("--process-all"));

        assertThat(runner.getExitCode()).isEqualTo(1);
        assertThat(output()).contains("No FNOL documents found");
    }
}
