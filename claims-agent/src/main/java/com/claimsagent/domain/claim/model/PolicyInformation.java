package com.claimsagent.domain.claim.model;

import java.util.Objects;
import java.util.Optional;

public record PolicyInformation(
        Optional<String> policyNumber,
        Optional<String> policyholderName,
        EffectiveDates effectiveDates
) {
    public PolicyInformation {
        Objects.requireNonNull(policyNumber, "policyNumber");
        Objects.requireNonNull(policyholderName, "policyholderName");
        Objects.requireNonNull(effectiveDates, "effectiveDates");
    }
}
