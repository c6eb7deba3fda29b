package com.claimsagent.domain.claim.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * Policy coverage period. Start and end are tracked independently.
 */
public record EffectiveDates(
        Optional<LocalDate> start,
        Optional<LocalDate> end
) {
    public EffectiveDates {
        Objects.requireNonNull(start, "start");
        Objects.requireNonNull(end, "end");
    }

    public static EffectiveDates absent() {
        return new EffectiveDates(Optional.empty(), Optional.empty());
    }
}
