package com.claimsagent.infrastructure.extraction;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses a currency amount written at the start of the captured text.
 * Currency markers ($, USD, US$) and thousands separators are stripped.
 * Negative amounts, malformed grouping ("1,50,00") and non-numeric text ("TBD") are absent, never zero.
 */
public class MonetaryAmountParser implements ValueParser<BigDecimal> {

    private static final Pattern AMOUNT = Pattern.compile(
            "[ \\t]*(?:(?:approx(?:imately|\\.)?|about|est\\.?)[ \\t]+)?" +
            "(-)?[ \\t]*(?:US\\$|USD|\\$)?[ \\t]*(-)?[ \\t]*" +
            // Ends on a digit so that a comma after the amount stays punctuation; digits after a comma must be a full group
            "(\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?)(?!,?\\d)",
            Pattern.CASE_INSENSITIVE
    );

    @Override
    public Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = AMOUNT.matcher(raw);
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        if (m.group(1) != null || m.group(2) != null) {
            return Optional.empty();
        }

        return Optional.of(new BigDecimal(m.group(3).replace(",", "")));
    }
}
