package com.claimsagent.domain.claim.model;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * @param thirdParties absent when the document has no third-party line at all,
 *                     an empty list when the line says "None" or "N/A"
 */
public record InvolvedParties(
        Optional<String> claimant,
        Optional<List<String>> thirdParties,
        ContactDetails contactDetails
) {
    public InvolvedParties {
        Objects.requireNonNull(claimant, "claimant");
        Objects.requireNonNull(contactDetails, "contactDetails");
        thirdParties = Objects.requireNonNull(thirdParties, "thirdParties").map(List::copyOf);
    }
}
