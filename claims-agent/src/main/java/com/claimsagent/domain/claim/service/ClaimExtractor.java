package com.claimsagent.domain.claim.service;

import com.claimsagent.domain.claim.model.ClaimRecord;

/**
 * Domain service for turning FNOL document text into a structured claim record.
 */
public interface ClaimExtractor {

    /**
     * Extract every known field from the document text.
     * Fields that cannot be found or parsed are absent; this method never fails on document content.
     *
     * @param text plain text of one document, possibly empty or noisy
     * @return the extracted record with its derived missing-field list
     * @throws NullPointerException if {@code text} is null
     */
    ClaimRecord extract(String text);
}
