package com.claimsagent.infrastructure.extraction;

import com.claimsagent.domain.claim.model.ClaimType;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Stateless parsers shared by the field matchers.
 */
public final class ValueParsers {

    // Values people write when a field is intentionally left blank
    private static final Set<String> PLACEHOLDERS = Set.of(
            "n/a", "na", "none", "nil", "unknown", "tbd", "tba", "pending",
            "not provided", "not applicable", "not available", "-", "--"
    );

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    // Leading bullets ("-", "*", "\u2022") are dropped along with label leftovers
    private static final Pattern EDGE_PUNCTUATION = Pattern.compile("^[\\s,;:|\\-*\u2022]+|[\\s,;:|]+$");
    private static final Pattern LIST_SEPARATORS = Pattern.compile("[,;\\n]");
    private static final Pattern LIST_SEPARATORS_WITH_AND = Pattern.compile("[,;\\n]|[ \\t]+and[ \\t]+|[ \\t]+&[ \\t]+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z0-9][A-Za-z0-9\\-/]*");
    private static final Pattern LETTER = Pattern.compile("\\p{L}");
    private static final Pattern DIGIT = Pattern.compile("\\d");
    private static final Pattern EMAIL = Pattern.compile("[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}");

    public static final ValueParser<String> TEXT = ValueParsers::text;
    public static final ValueParser<String> PERSON_NAME = ValueParsers::personName;
    public static final ValueParser<String> IDENTIFIER_VALUE = ValueParsers::identifier;
    public static final ValueParser<String> PHONE = ValueParsers::phone;
    public static final ValueParser<String> EMAIL_ADDRESS = ValueParsers::email;
    public static final ValueParser<List<String>> LIST = raw -> list(raw, LIST_SEPARATORS);
    public static final ValueParser<List<String>> NAME_LIST = raw -> list(raw, LIST_SEPARATORS_WITH_AND);
    public static final ValueParser<ClaimType> CLAIM_TYPE = raw -> text(raw).map(ClaimType::classify);

    private ValueParsers() {
    }

    /**
     * Collapse whitespace, trim separators left over from the label, reject blanks and placeholders.
     */
    static Optional<String> text(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String cleaned = EDGE_PUNCTUATION.matcher(WHITESPACE.matcher(raw).replaceAll(" ")).replaceAll("");
        if (cleaned.isEmpty() || isPlaceholder(cleaned)) {
            return Optional.empty();
        }
        return Optional.of(cleaned);
    }

    static Optional<String> personName(String raw) {
        return text(raw).filter(name -> LETTER.matcher(name).find());
    }

    /**
     * First identifier token; must contain a digit so that words like "pending" are not taken for a number.
     */
    static Optional<String> identifier(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = IDENTIFIER.matcher(raw.strip());
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        String token = m.group().replaceAll("[\\-/]+$", "");
        return DIGIT.matcher(token).find() ? Optional.of(token) : Optional.empty();
    }

    static Optional<String> phone(String raw) {
        return text(raw).filter(phone -> {
            long digits = phone.chars().filter(Character::isDigit).count();
            return digits >= 7 && digits <= 15;
        });
    }

    static Optional<String> email(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        Matcher m = EMAIL.matcher(raw);
        return m.find() ? Optional.of(m.group()) : Optional.empty();
    }

    /**
     * Split a located list, either one line or one item per line. The header was found, so the
     * result is always present; "None" or a blank value gives an empty list.
     */
    static Optional<List<String>> list(String raw, Pattern separators) {
        if (raw == null) {
            return Optional.of(List.of());
        }
        List<String> items = Arrays.stream(separators.split(raw))
                .map(ValueParsers::text)
                .flatMap(Optional::stream)
                .toList();
        return Optional.of(items);
    }

    static boolean isPlaceholder(String value) {
        return PLACEHOLDERS.contains(value.toLowerCase(Locale.ROOT).replaceAll("[.\\s]+$", ""));
    }
}
