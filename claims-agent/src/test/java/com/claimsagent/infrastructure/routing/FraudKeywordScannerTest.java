package com.claimsagent.infrastructure.routing;

import com.claimsagent.domain.claim.model.ClaimField;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class FraudKeywordScannerTest {

    private final FraudKeywordScanner scanner = new FraudKeywordScanner(RoutingPolicy.DEFAULT);

    @Test
    @DisplayName("Keywords are found case-insensitively in the description")
    void case_insensitive() {
        List<FraudIndicator> indicators = scanner.scan(ClaimRecords.complete()
                .description("This claim appears STAGED").build().extractedFields());

        assertThat(indicators).containsExactly(new FraudIndicator("staged", "incidentInformation.description"));
    }

    @Test
    @DisplayName("Keywords are substrings, so 'fraudulent' also reports 'fraud'")
    void substring_match() {
        List<FraudIndicator> indicators = scanner.scan(ClaimRecords.complete()
                .description("Possibly fraudulent repair invoice").build().extractedFields());

        assertThat(indicators).extracting(FraudIndicator::keyword).containsExactly("fraud", "fraudulent");
    }

    @Test
    @DisplayName("The location is scanned too")
    void location_scanned() {
        List<FraudIndicator> indicators = scanner.scan(ClaimRecords.complete()
                .location("Suspicious lot behind 5th Ave").build().extractedFields());

        assertThat(indicators).containsExactly(new FraudIndicator("suspicious", "incidentInformation.location"));
    }

    @Test
    @DisplayName("Names and identifiers are never scanned")
    void structured_fields_ignored() {
        List<FraudIndicator> indicators = scanner.scan(ClaimRecords.complete()
                .policyNumber("FALSE-2024-1")
                .claimant("Fabricated Falsetto")
                .build().extractedFields());

        assertThat(indicators).isEmpty();
    }

    @Test
    @DisplayName("Absent scan fields produce no indicators")
    void absent_fields() {
        assertThat(scanner.scan(ClaimRecords.complete().description(null).location(null).build().extractedFields()))
                .isEmpty();
    }

    @Test
    @DisplayName("Configured keywords are normalized to lower case")
    void custom_keywords() {
        RoutingPolicy policy = new RoutingPolicy(BigDecimal.ONE, List.of("  Arson "), List.of(ClaimField.INCIDENT_DESCRIPTION));
        FraudKeywordScanner custom = new FraudKeywordScanner(policy);

        assertThat(custom.scan(ClaimRecords.complete().description("suspected ARSON").build().extractedFields()))
                .containsExactly(new FraudIndicator("arson", "incidentInformation.description"));
    }
}
