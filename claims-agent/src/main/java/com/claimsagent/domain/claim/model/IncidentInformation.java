package com.claimsagent.domain.claim.model;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * What happened, when and where.
 *
 * @param date        incident date, normalized from ISO, US or long-form text
 * @param time        24-hour "HH:mm"
 * @param location    free text as written on the notice
 * @param description free text with whitespace collapsed to single spaces
 */
public record IncidentInformation(
        Optional<LocalDate> date,
        Optional<String> time,
        Optional<String> location,
        Optional<String> description
) {
    public IncidentInformation {
        Objects.requireNonNull(date, "date");
        Objects.requireNonNull(time, "time");
        Objects.requireNonNull(location, "location");
        Objects.requireNonNull(description, "description");
    }
}
