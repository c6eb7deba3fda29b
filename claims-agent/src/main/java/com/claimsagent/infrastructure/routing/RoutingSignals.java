package com.claimsagent.infrastructure.routing;

import com.claimsagent.domain.claim.model.ClaimRecord;
import com.claimsagent.domain.claim.model.ClaimType;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;

/**
 * Facts derived once per claim and shared by every routing rule.
 *
 * @param damageAmount estimated damage, falling back to the initial estimate
 */
public record RoutingSignals(
        ClaimRecord record,
        List<FraudIndicator> fraudIndicators,
        Optional<ClaimType> claimType,
        Optional<BigDecimal> damageAmount,
        BigDecimal fastTrackThreshold
) {
    public RoutingSignals {
        fraudIndicators = List.copyOf(fraudIndicators);
    }

    public List<String> missingFields() {
        return record.missingFields();
    }

    public boolean isBelowFastTrackThreshold() {
        return damageAmount.map(amount -> amount.compareTo(fastTrackThreshold) < 0).orElse(false);
    }
}
