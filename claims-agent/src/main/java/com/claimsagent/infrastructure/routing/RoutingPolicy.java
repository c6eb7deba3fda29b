package com.claimsagent.infrastructure.routing;

import com.claimsagent.domain.claim.model.ClaimField;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Tunable inputs of the routing rules.
 *
 * @param fastTrackThreshold damage strictly below this is fast-track eligible
 * @param fraudKeywords      lower-cased substrings that raise a fraud signal
 * @param fraudScanFields    free-text fields the keywords are searched in
 */
public record RoutingPolicy(
        BigDecimal fastTrackThreshold,
        List<String> fraudKeywords,
        List<ClaimField> fraudScanFields
) {
    public static final RoutingPolicy DEFAULT = new RoutingPolicy(
            new BigDecimal("25000"),
            List.of("fraud", "fraudulent", "inconsistent", "staged", "suspicious", "fabricated", "false"),
            List.of(ClaimField.INCIDENT_DESCRIPTION, ClaimField.INCIDENT_LOCATION)
    );

    public RoutingPolicy {
        Objects.requireNonNull(fastTrackThreshold, "fastTrackThreshold");
        if (fastTrackThreshold.signum() < 0) {
            throw new IllegalArgumentException("Fast-track threshold must not be negative: " + fastTrackThreshold);
        }
        fraudKeywords = Objects.requireNonNull(fraudKeywords, "fraudKeywords").stream()
                .map(String::strip)
                .filter(keyword -> !keyword.isEmpty())
                .map(keyword -> keyword.toLowerCase(Locale.ROOT))
                .distinct()
                .toList();
        fraudScanFields = List.copyOf(Objects.requireNonNull(fraudScanFields, "fraudScanFields"));
    }

    /**
     * @throws IllegalArgumentException if a scan path names no extractable field
     */
    public static RoutingPolicy of(BigDecimal fastTrackThreshold, List<String> fraudKeywords, List<String> scanPaths) {
        List<ClaimField> scanFields = scanPaths.stream()
                .map(path -> ClaimField.fromPath(path)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown claim field path: " + path)))
                .distinct()
                .toList();
        return new RoutingPolicy(fastTrackThreshold, fraudKeywords, scanFields);
    }
}
