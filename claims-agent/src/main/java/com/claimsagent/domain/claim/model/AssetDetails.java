package com.claimsagent.domain.claim.model;

import java.math.BigDecimal;
import java.util.Objects;
import java.util.Optional;

public record AssetDetails(
        Optional<String> assetType,
        Optional<String> assetId,
        Optional<BigDecimal> estimatedDamage
) {
    public AssetDetails {
        Objects.requireNonNull(assetType, "assetType");
        Objects.requireNonNull(assetId, "assetId");
        Objects.requireNonNull(estimatedDamage, "estimatedDamage");
        estimatedDamage.ifPresent(amount -> Amounts.requireNonNegative(amount, "estimatedDamage"));
    }
}
