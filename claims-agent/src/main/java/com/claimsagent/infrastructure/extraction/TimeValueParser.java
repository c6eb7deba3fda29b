package com.claimsagent.infrastructure.extraction;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Finds the first clock time in the captured text and normalizes it to 24-hour "HH:mm".
 * "2:30 PM" becomes "14:30", "12:05 am" becomes "00:05". Out-of-range hours or minutes are absent.
 */
public class TimeValueParser implements ValueParser<String> {

    private static final Pattern TIME = Pattern.compile(
            "(?<!\\d)(\\d{1,2}):(\\d{2})(?!\\d)(?:[ \\t]*([AaPp])\\.?[ \\t]?[Mm]\\.?(?![A-Za-z]))?");

    @Override
    public Optional<String> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = TIME.matcher(raw);
        if (!m.find()) {
            return Optional.empty();
        }

        int hour = Integer.parseInt(m.group(1));
        int minute = Integer.parseInt(m.group(2));
        String meridiem = m.group(3);

        if (minute > 59) {
            return Optional.empty();
        }
        if (meridiem != null) {
            if (hour < 1 || hour > 12) {
                return Optional.empty();
            }
            boolean pm = meridiem.equalsIgnoreCase("p");
            hour = hour % 12 + (pm ? 12 : 0);
        } else if (hour > 23) {
            return Optional.empty();
        }
        return Optional.of(String.format("%02d:%02d", hour, minute));
    }
}
