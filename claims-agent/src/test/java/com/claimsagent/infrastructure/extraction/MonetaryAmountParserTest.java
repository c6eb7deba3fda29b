package com.claimsagent.infrastructure.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class MonetaryAmountParserTest {

    private final MonetaryAmountParser parser = new MonetaryAmountParser();

    @Test
    @DisplayName("Currency markers and thousands separators are stripped")
    void currency_markers() {
        assertThat(parser.parse("$15,000")).contains(new BigDecimal("15000"));
        assertThat(parser.parse("USD 8,500.00")).contains(new BigDecimal("8500.00"));
        assertThat(parser.parse("US$ 1,234,567.89")).contains(new BigDecimal("1234567.89"));
        assertThat(parser.parse("2500")).contains(new BigDecimal("2500"));
    }

    @Test
    @DisplayName("Approximation prefixes and trailing text are tolerated")
    void prefixes_and_trailing_text() {
        assertThat(parser.parse("approx. $3,200 (body shop quote)")).contains(new BigDecimal("3200"));
        assertThat(parser.parse("about $900")).contains(new BigDecimal("900"));
    }

    @Test
    @DisplayName("A comma after the amount is punctuation, not part of the number")
    void trailing_comma() {
        assertThat(parser.parse("$12,500, including towing")).contains(new BigDecimal("12500"));
        assertThat(parser.parse("$9,000, pending review")).contains(new BigDecimal("9000"));
        assertThat(parser.parse("750, per the body shop")).contains(new BigDecimal("750"));
    }

    @Test
    @DisplayName("Negative amounts are absent")
    void negative() {
        assertThat(parser.parse("-$500")).isEmpty();
        assertThat(parser.parse("$-500")).isEmpty();
        assertThat(parser.parse("-500")).isEmpty();
    }

    @Test
    @DisplayName("Malformed grouping and non-numeric text are absent, never zero")
    void malformed() {
        assertThat(parser.parse("1,50,00")).isEmpty();
        assertThat(parser.parse("1,5000")).isEmpty();
        assertThat(parser.parse("TBD")).isEmpty();
        assertThat(parser.parse("")).isEmpty();
        assertThat(parser.parse(null)).isEmpty();
    }
}
