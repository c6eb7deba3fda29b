package com.claimsagent.infrastructure.routing;

/**
 * A fraud keyword and the field path it was found in.
 */
public record FraudIndicator(String keyword, String fieldPath) {

    @Override
    public String toString() {
        return "'" + keyword + "' in " + fieldPath;
    }
}
