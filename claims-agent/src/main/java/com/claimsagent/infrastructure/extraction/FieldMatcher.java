package com.claimsagent.infrastructure.extraction;

import com.claimsagent.domain.claim.model.ClaimField;

import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * One way of locating a field in document text: a labelled pattern, the capture group holding the value,
 * and the parser that turns the captured text into a typed value.
 *
 * @param field   the field this matcher populates
 * @param pattern pattern applied to the whole normalized document
 * @param group   capture group holding the raw value
 * @param parser  converts the raw value; empty means "not usable"
 */
public record FieldMatcher(
        ClaimField field,
        Pattern pattern,
        int group,
        ValueParser<?> parser
) {
    public FieldMatcher {
        Objects.requireNonNull(field, "field");
        Objects.requireNonNull(pattern, "pattern");
        Objects.requireNonNull(parser, "parser");
    }

    /**
     * Scan occurrences in document order and return the first one whose value parses.
     */
    public Optional<?> match(String text) {
        Matcher matcher = pattern.matcher(text);
        while (matcher.find()) {
            String raw = matcher.group(group);
            if (raw == null) {
                continue;
            }
            Optional<?> value = parser.parse(raw);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }
}
