package com.claimsagent.domain.claim.model;

import java.util.List;
import java.util.Objects;

/**
 * Immutable result of extracting one document.
 * {@code missingFields} is always derived from the extracted values and a checklist, never supplied.
 */
public final class ClaimRecord {

    private final ExtractedFields extractedFields;
    private final List<String> missingFields;

    private ClaimRecord(ExtractedFields extractedFields, List<String> missingFields) {
        this.extractedFields = extractedFields;
        this.missingFields = missingFields;
    }

    public static ClaimRecord of(ExtractedFields extractedFields, MandatoryFieldChecklist checklist) {
        Objects.requireNonNull(extractedFields, "extractedFields");
        Objects.requireNonNull(checklist, "checklist");
        return new ClaimRecord(extractedFields, checklist.missingIn(extractedFields));
    }

    public ExtractedFields extractedFields() {
        return extractedFields;
    }

    public List<String> missingFields() {
        return missingFields;
    }

    public boolean hasMissingFields() {
        return !missingFields.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ClaimRecord other)) return false;
        return extractedFields.equals(other.extractedFields) && missingFields.equals(other.missingFields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(extractedFields, missingFields);
    }

    @Override
    public String toString() {
        return "ClaimRecord[extractedFields=" + extractedFields + ", missingFields=" + missingFields + "]";
    }
}
