package com.claimsagent.domain.claim.model;

import java.util.Objects;
import java.util.Optional;

/**
 * Everything the extractor found in one FNOL document, grouped the way the output JSON nests it.
 */
public record ExtractedFields(
        PolicyInformation policyInformation,
        IncidentInformation incidentInformation,
        InvolvedParties involvedParties,
        AssetDetails assetDetails,
        OtherMandatoryFields otherMandatoryFields
) {
    public ExtractedFields {
        Objects.requireNonNull(policyInformation, "policyInformation");
        Objects.requireNonNull(incidentInformation, "incidentInformation");
        Objects.requireNonNull(involvedParties, "involvedParties");
        Objects.requireNonNull(assetDetails, "assetDetails");
        Objects.requireNonNull(otherMandatoryFields, "otherMandatoryFields");
    }

    /**
     * A record with every leaf absent, as produced for an empty document.
     */
    public static ExtractedFields allAbsent() {
        return new ExtractedFields(
                new PolicyInformation(Optional.empty(), Optional.empty(), EffectiveDates.absent()),
                new IncidentInformation(Optional.empty(), Optional.empty(), Optional.empty(), Optional.empty()),
                new InvolvedParties(Optional.empty(), Optional.empty(),
                        new ContactDetails(Optional.empty(), Optional.empty())),
                new AssetDetails(Optional.empty(), Optional.empty(), Optional.empty()),
                new OtherMandatoryFields(Optional.empty(), Optional.empty(), Optional.empty())
        );
    }
}
