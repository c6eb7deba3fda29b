package com.claimsagent.domain.claim.model;

import java.util.List;
import java.util.Objects;

/**
 * Routing decision for one claim.
 *
 * @param recommendedRoute the queue chosen by the first matching rule
 * @param reasoning        explanation citing the evidence the rule used
 * @param missingFields    copied from the claim record
 * @param appliedRule      id of the rule that matched, for logs and tests
 */
public record RoutingResult(
        Route recommendedRoute,
        String reasoning,
        List<String> missingFields,
        String appliedRule
) {
    public RoutingResult {
        Objects.requireNonNull(recommendedRoute, "recommendedRoute");
        Objects.requireNonNull(reasoning, "reasoning");
        missingFields = List.copyOf(missingFields);
    }
}
