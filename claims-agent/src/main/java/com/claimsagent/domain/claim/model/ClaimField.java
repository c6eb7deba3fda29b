package com.claimsagent.domain.claim.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Every extractable leaf of {@link ExtractedFields}, identified by its dotted JSON path.
 * The paths are a compatibility contract: they appear in {@code missingFields} and in configuration.
 */
public enum ClaimField {
    POLICY_NUMBER("policyInformation.policyNumber"),
    POLICYHOLDER_NAME("policyInformation.policyholderName"),
    EFFECTIVE_START("policyInformation.effectiveDates.start"),
    EFFECTIVE_END("policyInformation.effectiveDates.end"),
    INCIDENT_DATE("incidentInformation.date"),
    INCIDENT_TIME("incidentInformation.time"),
    INCIDENT_LOCATION("incidentInformation.location"),
    INCIDENT_DESCRIPTION("incidentInformation.description"),
    CLAIMANT("involvedParties.claimant"),
    THIRD_PARTIES("involvedParties.thirdParties"),
    CONTACT_PHONE("involvedParties.contactDetails.phone"),
    CONTACT_EMAIL("involvedParties.contactDetails.email"),
    ASSET_TYPE("assetDetails.assetType"),
    ASSET_ID("assetDetails.assetId"),
    ESTIMATED_DAMAGE("assetDetails.estimatedDamage"),
    CLAIM_TYPE("otherMandatoryFields.claimType"),
    ATTACHMENTS("otherMandatoryFields.attachments"),
    INITIAL_ESTIMATE("otherMandatoryFields.initialEstimate");

    private final String path;

    ClaimField(String path) {
        this.path = path;
    }

    public String path() {
        return path;
    }

    public static Optional<ClaimField> fromPath(String path) {
        return Arrays.stream(values())
                .filter(field -> field.path.equals(path))
                .findFirst();
    }

    /**
     * Read this field's value from an extracted record.
     */
    public Optional<?> valueIn(ExtractedFields fields) {
        return switch (this) {
            case POLICY_NUMBER -> fields.policyInformation().policyNumber();
            case POLICYHOLDER_NAME -> fields.policyInformation().policyholderName();
            case EFFECTIVE_START -> fields.policyInformation().effectiveDates().start();
            case EFFECTIVE_END -> fields.policyInformation().effectiveDates().end();
            case INCIDENT_DATE -> fields.incidentInformation().date();
            case INCIDENT_TIME -> fields.incidentInformation().time();
            case INCIDENT_LOCATION -> fields.incidentInformation().location();
            case INCIDENT_DESCRIPTION -> fields.incidentInformation().description();
            case CLAIMANT -> fields.involvedParties().claimant();
            case THIRD_PARTIES -> fields.involvedParties().thirdParties();
            case CONTACT_PHONE -> fields.involvedParties().contactDetails().phone();
            case CONTACT_EMAIL -> fields.involvedParties().contactDetails().email();
            case ASSET_TYPE -> fields.assetDetails().assetType();
            case ASSET_ID -> fields.assetDetails().assetId();
            case ESTIMATED_DAMAGE -> fields.assetDetails().estimatedDamage();
            case CLAIM_TYPE -> fields.otherMandatoryFields().claimType();
            case ATTACHMENTS -> fields.otherMandatoryFields().attachments();
            case INITIAL_ESTIMATE -> fields.otherMandatoryFields().initialEstimate();
        };
    }

    @Override
    public String toString() {
        return path;
    }
}
