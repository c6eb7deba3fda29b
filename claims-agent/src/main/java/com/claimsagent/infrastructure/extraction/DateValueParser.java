package com.claimsagent.infrastructure.extraction;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.Month;
import java.time.format.TextStyle;
import java.util.Comparator;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Finds the first date in the captured text and normalizes it to a {@link LocalDate}.
 * Accepts ISO ("2024-11-15"), US ("11/15/2024", "1/5/2024") and long form ("November 15, 2024", "Nov 15 2024").
 * Impossible calendar dates such as "2024-02-30" are absent.
 */
public class DateValueParser implements ValueParser<LocalDate> {

    /**
     * Regex fragment matching any accepted date token, for use inside field patterns.
     */
    public static final String DATE_TOKEN =
            "\\d{4}-\\d{1,2}-\\d{1,2}|\\d{1,2}/\\d{1,2}/\\d{4}|[A-Za-z]{3,9}\\.?[ \\t]+\\d{1,2},?[ \\t]+\\d{4}";

    private static final Pattern ISO_DATE = Pattern.compile("(?<!\\d)(\\d{4})-(\\d{1,2})-(\\d{1,2})(?!\\d)");
    private static final Pattern US_DATE = Pattern.compile("(?<!\\d)(\\d{1,2})/(\\d{1,2})/(\\d{4})(?!\\d)");
    private static final Pattern LONG_DATE = Pattern.compile(
            "(?<![A-Za-z])([A-Za-z]{3,9})\\.?[ \\t]+(\\d{1,2}),?[ \\t]+(\\d{4})(?!\\d)");

    private enum Format { ISO, US, LONG }

    private record Candidate(Format format, Matcher matcher) {}

    @Override
    public Optional<LocalDate> parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }

        // Earliest token wins, whichever format it is written in
        Optional<Candidate> first = Stream.of(
                        new Candidate(Format.ISO, ISO_DATE.matcher(raw)),
                        new Candidate(Format.US, US_DATE.matcher(raw)),
                        new Candidate(Format.LONG, LONG_DATE.matcher(raw)))
                .filter(candidate -> candidate.matcher().find())
                .min(Comparator.comparingInt(candidate -> candidate.matcher().start()));

        return first.flatMap(DateValueParser::toDate);
    }

    private static Optional<LocalDate> toDate(Candidate candidate) {
        Matcher m = candidate.matcher();
        try {
            return switch (candidate.format()) {
                case ISO -> Optional.of(LocalDate.of(
                        Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2)), Integer.parseInt(m.group(3))));
                case US -> Optional.of(LocalDate.of(
                        Integer.parseInt(m.group(3)), Integer.parseInt(m.group(1)), Integer.parseInt(m.group(2))));
                case LONG -> monthNamed(m.group(1)).map(month -> LocalDate.of(
                        Integer.parseInt(m.group(3)), month, Integer.parseInt(m.group(2))));
            };
        } catch (DateTimeException e) {
            return Optional.empty();
        }
    }

    private static Optional<Month> monthNamed(String name) {
        String lower = name.toLowerCase(Locale.ROOT);
        for (Month month : Month.values()) {
            String full = month.getDisplayName(TextStyle.FULL, Locale.US).toLowerCase(Locale.ROOT);
            if (lower.equals(full) || lower.equals(full.substring(0, 3)) || ("sept".equals(lower) && month == Month.SEPTEMBER)) {
                return Optional.of(month);
            }
        }
        return Optional.empty();
    }
}
