package com.claimsagent.infrastructure.output;

import com.claimsagent.domain.claim.model.ClaimProcessingResult;
import com.claimsagent.domain.claim.model.ExtractedFields;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders processing results as the JSON output contract or as a readable console summary.
 * Absent values are written as {@code null}, dates as ISO-8601 strings.
 */
@Slf4j
@Component
public class ClaimResultWriter {

    private static final String RULE = "=".repeat(60);
    private static final String NOT_AVAILABLE = "N/A";

    private final ObjectWriter jsonWriter;

    public ClaimResultWriter(ObjectMapper objectMapper) {
        ObjectMapper mapper = objectMapper.copy()
                .registerModule(new Jdk8Module())
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.jsonWriter = mapper.writerWithDefaultPrettyPrinter();
    }

    public String toJson(ClaimProcessingResult result) {
        try {
            return jsonWriter.writeValueAsString(result);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize claim result", e);
        }
    }

    /**
     * Write the JSON to {@code target}, creating parent directories as needed.
     */
    public void write(ClaimProcessingResult result, Path target) {
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Files.writeString(target, toJson(result), StandardCharsets.UTF_8);
            log.info("[Output] Result saved to {}", target);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write result to " + target, e);
        }
    }

    public String summarize(ClaimProcessingResult result) {
        ExtractedFields fields = result.extractedFields();
        StringBuilder out = new StringBuilder();
        out.append(RULE).append('\n')
                .append("PROCESSING RESULT").append('\n')
                .append(RULE).append('\n')
                .append('\n')
                .append("Recommended Route: ").append(result.recommendedRoute().label()).append('\n')
                .append('\n')
                .append("Reasoning:").append('\n')
                .append(result.reasoning()).append('\n')
                .append('\n');

        if (result.missingFields().isEmpty()) {
            out.append("All mandatory fields present").append('\n');
        } else {
            out.append("Missing Fields: ").append(String.join(", ", result.missingFields())).append('\n');
        }

        out.append('\n')
                .append("Extracted Fields Summary:").append('\n')
                .append("  Policy: ").append(text(fields.policyInformation().policyNumber())).append('\n')
                .append("  Policyholder: ").append(text(fields.policyInformation().policyholderName())).append('\n')
                .append("  Incident Date: ").append(text(fields.incidentInformation().date())).append('\n')
                .append("  Location: ").append(text(fields.incidentInformation().location())).append('\n')
                .append("  Claimant: ").append(text(fields.involvedParties().claimant())).append('\n')
                .append("  Asset Type: ").append(text(fields.assetDetails().assetType())).append('\n')
                .append("  Estimated Damage: ").append(money(fields.assetDetails().estimatedDamage())).append('\n')
                .append("  Initial Estimate: ").append(money(fields.otherMandatoryFields().initialEstimate())).append('\n')
                .append("  Claim Type: ").append(fields.otherMandatoryFields().claimType()
                        .map(type -> type.code()).orElse(NOT_AVAILABLE)).append('\n')
                .append(RULE).append('\n');
        return out.toString();
    }

    private static String text(Optional<?> value) {
        return value.map(String::valueOf).orElse(NOT_AVAILABLE);
    }

    private static String money(Optional<BigDecimal> value) {
        return value.map(amount -> String.format(Locale.US, "$%,.2f", amount)).orElse(NOT_AVAILABLE);
    }
}
