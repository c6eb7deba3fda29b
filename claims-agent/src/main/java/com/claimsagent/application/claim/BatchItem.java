package com.claimsagent.application.claim;

import com.claimsagent.domain.claim.model.ClaimProcessingResult;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Outcome for one document of a batch: either a result or the error that stopped it.
 */
public record BatchItem(
        Path document,
        Optional<ClaimProcessingResult> result,
        Optional<String> error
) {
    public static BatchItem success(Path document, ClaimProcessingResult result) {
        return new BatchItem(document, Optional.of(result), Optional.empty());
    }

    public static BatchItem failure(Path document, String error) {
        return new BatchItem(document, Optional.empty(), Optional.of(error));
    }

    public boolean succeeded() {
        return result.isPresent();
    }
}
