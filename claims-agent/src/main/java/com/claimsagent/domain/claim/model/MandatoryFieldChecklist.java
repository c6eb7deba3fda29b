package com.claimsagent.domain.claim.model;

import java.util.List;
import java.util.Objects;

/**
 * Fields whose absence sends a claim to manual review.
 *
 * @param fields checked in this order; {@code missingFields} follows the same order
 */
public record MandatoryFieldChecklist(List<ClaimField> fields) {

    public static final MandatoryFieldChecklist DEFAULT = new MandatoryFieldChecklist(List.of(
            ClaimField.POLICY_NUMBER,
            ClaimField.POLICYHOLDER_NAME,
            ClaimField.INCIDENT_DATE,
            ClaimField.INCIDENT_LOCATION,
            ClaimField.CLAIMANT,
            ClaimField.ASSET_TYPE,
            ClaimField.CLAIM_TYPE,
            ClaimField.INITIAL_ESTIMATE
    ));

    public MandatoryFieldChecklist {
        fields = List.copyOf(Objects.requireNonNull(fields, "fields"));
    }

    /**
     * Build a checklist from dotted paths such as {@code policyInformation.policyNumber}.
     *
     * @throws IllegalArgumentException if a path names no extractable field
     */
    public static MandatoryFieldChecklist fromPaths(List<String> paths) {
        return new MandatoryFieldChecklist(paths.stream()
                .map(path -> ClaimField.fromPath(path)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown claim field path: " + path)))
                .distinct()
                .toList());
    }

    public List<String> missingIn(ExtractedFields extracted) {
        return fields.stream()
                .filter(field -> field.valueIn(extracted).isEmpty())
                .map(ClaimField::path)
                .toList();
    }
}
