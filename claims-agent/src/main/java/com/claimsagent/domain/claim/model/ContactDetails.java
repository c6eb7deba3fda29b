package com.claimsagent.domain.claim.model;

import java.util.Objects;
import java.util.Optional;

public record ContactDetails(
        Optional<String> phone,
        Optional<String> email
) {
    public ContactDetails {
        Objects.requireNonNull(phone, "phone");
        Objects.requireNonNull(email, "email");
    }
}
