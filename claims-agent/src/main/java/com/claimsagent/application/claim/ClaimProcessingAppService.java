package com.claimsagent.application.claim;

import com.claimsagent.application.claim.exception.DocumentDirectoryNotFoundException;
import com.claimsagent.domain.claim.model.ClaimProcessingResult;
import com.claimsagent.domain.claim.model.ClaimRecord;
import com.claimsagent.domain.claim.model.RoutingResult;
import com.claimsagent.domain.claim.service.ClaimExtractor;
import com.claimsagent.domain.claim.service.ClaimRouter;
import com.claimsagent.infrastructure.document.DocumentLoadException;
import com.claimsagent.infrastructure.document.DocumentLoader;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

@Slf4j
@Service
@RequiredArgsConstructor
public class ClaimProcessingAppService {

    private final ClaimExtractor claimExtractor;
    private final ClaimRouter claimRouter;
    private final DocumentLoader documentLoader;

    public ClaimProcessingResult process(String text) {
        ClaimRecord record = claimExtractor.extract(text);
        RoutingResult routing = claimRouter.route(record);
        return ClaimProcessingResult.of(record, routing);
    }

    /**
     * @throws DocumentLoadException if the document cannot be read
     */
    public ClaimProcessingResult processDocument(Path document) {
        log.info("[Claims] Processing {}", document.getFileName());
        return process(documentLoader.load(document));
    }

    /**
     * Process every .txt and .pdf file directly inside {@code directory}, in file-name order.
     * A document that fails is reported on its item and the batch continues.
     *
     * @throws DocumentDirectoryNotFoundException if {@code directory} is not a directory
     */
    public List<BatchItem> processDirectory(Path directory) {
        if (!Files.isDirectory(directory)) {
            throw new DocumentDirectoryNotFoundException(directory);
        }

        List<Path> documents = listDocuments(directory);
        log.info("[Batch] Found {} documents in {}", documents.size(), directory);

        List<BatchItem> items = new ArrayList<>();
        for (Path document : documents) {
            try {
                items.add(BatchItem.success(document, processDocument(document)));
            } catch (DocumentLoadException e) {
                log.warn("[Batch] Skipping {}: {}", document.getFileName(), e.getMessage());
                items.add(BatchItem.failure(document, e.getMessage()));
            } catch (RuntimeException e) {
                log.error("[Batch] Unexpected failure on {}", document.getFileName(), e);
                items.add(BatchItem.failure(document, e.getClass().getSimpleName() + ": " + e.getMessage()));
            }
        }

        long failed = items.stream().filter(item -> !item.succeeded()).count();
        log.info("[Batch] Done: {} processed, {} failed", items.size() - failed, failed);
        return items;
    }

    private List<Path> listDocuments(Path directory) {
        try (Stream<Path> entries = Files.list(directory)) {
            return entries
                    .filter(Files::isRegularFile)
                    .filter(documentLoader::isSupported)
                    .sorted(Comparator.comparing(path -> path.getFileName().toString()))
                    .toList();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to list " + directory, e);
        }
    }
}
