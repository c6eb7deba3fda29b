package com.claimsagent.domain.claim.model;

import java.math.BigDecimal;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

public record OtherMandatoryFields(
        Optional<ClaimType> claimType,
        Optional<List<String>> attachments,
        Optional<BigDecimal> initialEstimate
) {
    public OtherMandatoryFields {
        Objects.requireNonNull(claimType, "claimType");
        Objects.requireNonNull(initialEstimate, "initialEstimate");
        attachments = Objects.requireNonNull(attachments, "attachments").map(List::copyOf);
        initialEstimate.ifPresent(amount -> Amounts.requireNonNegative(amount, "initialEstimate"));
    }
}
