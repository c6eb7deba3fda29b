package com.claimsagent.infrastructure.extraction;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class TimeValueParserTest {

    private final TimeValueParser parser = new TimeValueParser();

    @Test
    @DisplayName("24-hour times are zero-padded")
    void twenty_four_hour() {
        assertThat(parser.parse("9:05")).contains("09:05");
        assertThat(parser.parse("17:45")).contains("17:45");
    }

    @Test
    @DisplayName("AM/PM is converted to 24-hour time")
    void meridiem() {
        assertThat(parser.parse("2:30 PM")).contains("14:30");
        assertThat(parser.parse("12:05 am")).contains("00:05");
        assertThat(parser.parse("12:00 p.m.")).contains("12:00");
    }

    @Test
    @DisplayName("Out-of-range values are absent")
    void out_of_range() {
        assertThat(parser.parse("25:00")).isEmpty();
        assertThat(parser.parse("10:75")).isEmpty();
        assertThat(parser.parse("13:00 PM")).isEmpty();
        assertThat(parser.parse("around noon")).isEmpty();
    }
}
