package com.claimsagent.domain.claim.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Claim category as stated on the notice.
 * A labelled value that matches no known category is {@link #UNKNOWN}, which still counts as present.
 */
public enum ClaimType {
    AUTO("auto", Set.of("auto", "automobile", "vehicle", "motor", "collision", "car")),
    INJURY("injury", Set.of("injury", "injuries", "bodily", "medical")),
    PROPERTY("property", Set.of("property", "home", "homeowner", "homeowners", "fire", "flood", "theft", "water")),
    UNKNOWN("unknown", Set.of());

    private final String code;
    private final Set<String> keywords;

    ClaimType(String code, Set<String> keywords) {
        this.code = code;
        this.keywords = keywords;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Classify free text such as "Auto", "Bodily Injury" or "Property - Fire".
     * Injury wins over the other categories so that "Auto Injury" goes to the injury queue.
     */
    public static ClaimType classify(String rawValue) {
        if (rawValue == null || rawValue.isBlank()) {
            return UNKNOWN;
        }
        Set<String> words = Arrays.stream(rawValue.toLowerCase(Locale.ROOT).split("[^a-z]+"))
                .collect(Collectors.toSet());
        for (ClaimType type : List.of(INJURY, AUTO, PROPERTY)) {
            if (type.keywords.stream().anyMatch(words::contains)) {
                return type;
            }
        }
        return UNKNOWN;
    }
}
