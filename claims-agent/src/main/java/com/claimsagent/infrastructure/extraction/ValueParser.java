package com.claimsagent.infrastructure.extraction;

import java.util.Optional;

/**
 * Turns the raw text captured for a field into a typed value.
 * Text that cannot be interpreted yields {@link Optional#empty()} rather than an exception.
 */
@FunctionalInterface
public interface ValueParser<T> {

    Optional<T> parse(String raw);
}
