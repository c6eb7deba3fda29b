package com.claimsagent.domain.claim.model;

import java.math.BigDecimal;

final class Amounts {

    private Amounts() {
    }

    static void requireNonNegative(BigDecimal amount, String name) {
        if (amount.signum() < 0) {
            throw new IllegalArgumentException(name + " must not be negative: " + amount);
        }
    }
}
