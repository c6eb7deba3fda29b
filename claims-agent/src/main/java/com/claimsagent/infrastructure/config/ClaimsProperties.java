package com.claimsagent.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Externalized claim policy, bound from the {@code claims.*} tree of application.yml.
 * Defaults here match the shipped configuration so the core can be built without Spring.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "claims")
public class ClaimsProperties {

    @Valid
    private Extraction extraction = new Extraction();

    @Valid
    private Routing routing = new Routing();

    @Valid
    private Cli cli = new Cli();

    @Data
    public static class Extraction {

        /**
         * Dotted field paths whose absence sends a claim to manual review.
         */
        @NotEmpty
        private List<String> mandatoryFields = new ArrayList<>(List.of(
                "policyInformation.policyNumber",
                "policyInformation.policyholderName",
                "incidentInformation.date",
                "incidentInformation.location",
                "involvedParties.claimant",
                "assetDetails.assetType",
                "otherMandatoryFields.claimType",
                "otherMandatoryFields.initialEstimate"
        ));
    }

    @Data
    public static class Routing {

        /**
         * Damage strictly below this amount is eligible for fast-track.
         */
        @NotNull
        @PositiveOrZero
        private BigDecimal fastTrackThreshold = new BigDecimal("25000");

        @NotEmpty
        private List<@NotBlank String> fraudKeywords = new ArrayList<>(List.of(
                "fraud", "fraudulent", "inconsistent", "staged", "suspicious", "fabricated", "false"
        ));

        /**
         * Free-text field paths scanned for fraud keywords. Identifiers and names are never scanned.
         */
        @NotEmpty
        private List<String> fraudScanFields = new ArrayList<>(List.of(
                "incidentInformation.description",
                "incidentInformation.location"
        ));
    }

    @Data
    public static class Cli {

        private boolean enabled = true;

        @NotBlank
        private String sampleDir = "sample_documents";

        @NotBlank
        private String outputDir = "output";
    }
}
