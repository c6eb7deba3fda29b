package com.claimsagent.domain.claim.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Final output for one document. Key names and nesting are the JSON contract consumed downstream.
 */
@JsonPropertyOrder({"extractedFields", "missingFields", "recommendedRoute", "reasoning"})
public record ClaimProcessingResult(
        ExtractedFields extractedFields,
        List<String> missingFields,
        Route recommendedRoute,
        String reasoning
) {
    public ClaimProcessingResult {
        missingFields = List.copyOf(missingFields);
    }

    public static ClaimProcessingResult of(ClaimRecord record, RoutingResult routing) {
        return new ClaimProcessingResult(
                record.extractedFields(),
                routing.missingFields(),
                routing.recommendedRoute(),
                routing.reasoning()
        );
    }
}
