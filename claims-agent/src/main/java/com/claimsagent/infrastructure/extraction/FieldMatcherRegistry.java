package com.claimsagent.infrastructure.extraction;

import com.claimsagent.domain.claim.model.ClaimField;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import static com.claimsagent.domain.claim.model.ClaimField.*;

/**
 * Field matchers keyed by field, in the order they are tried.
 * Labels are case-insensitive and accept the common variants seen on FNOL forms
 * ("Policy Number", "Policy No.", "Policy #"). Free-text fields must start a line
 * so that words inside a narrative are not mistaken for labels.
 */
@Component
public class FieldMatcherRegistry {

    // Optional ":", "#" or "-" between label and value
    private static final String SEPARATOR = "[ \\t]*[:#\\-]?[ \\t]*";

    // Names and categories need ":" or "-" so that "Claimant Phone: ..." or prose is not read as a value
    private static final String STRICT_SEPARATOR = "[ \\t]*[:\\-][ \\t]*";

    private static final String END = "(?![A-Za-z])";

    // A "Label:" at the start of a line ends a multi-line block
    private static final String NEXT_LABEL = "(?![A-Za-z][A-Za-z /#&().\\-]{0,40}:)";

    // PDF text often puts the value on the line below an otherwise empty label line
    private static final String VALUE_ON_NEXT_LINE = "(?:\\n" + NEXT_LABEL + ")?";

    // Two-column forms put a second "Label:" on the same line; values stop in front of it
    private static final String INLINE_LABEL = "[ \\t]+(?:Policy|Policyholder|Insured|Effective|Coverage|Incident|Accident"
            + "|Loss|Date|Time|Location|Description|Claimant|Third|Contact|Phone|Telephone|Mobile|E-?mail|Asset"
            + "|Property|Vehicle|VIN|Serial|Registration|Estimated|Damage|Claim|Attachments?|Supporting|Initial)"
            + END + "(?:[ \\t]+[A-Za-z.#]+){0,3}[ \\t]*:";
    private static final String WORD_STEP = "(?!" + INLINE_LABEL + ")[ \\t]+";

    private static final String REST_OF_LINE = "(?:(?!" + INLINE_LABEL + ")[^\\n])*";
    private static final String NAME = "[A-Za-z][A-Za-z.'\\-]*(?:" + WORD_STEP + "[A-Za-z][A-Za-z.'\\-]*)*";
    private static final String KIND = "[A-Za-z][A-Za-z/&\\-]*(?:" + WORD_STEP + "[A-Za-z/&\\-]+)*";
    private static final String IDENTIFIER = "[A-Za-z0-9][A-Za-z0-9\\-/]*";
    private static final String PHONE_NUMBER = "\\+?[\\d(][\\d \\t().\\-]{5,}\\d";
    private static final String EMAIL = "[A-Za-z0-9._%+\\-]+@[A-Za-z0-9.\\-]+\\.[A-Za-z]{2,}";

    // Items on the header line, or else the non-blank lines below it up to the next label
    private static final String LIST_BLOCK = "\\S" + REST_OF_LINE + "|(?:\\n" + NEXT_LABEL + "[^\\n]*\\S[^\\n]*)*";

    private static final String DATE = "(?:" + DateValueParser.DATE_TOKEN + ")";

    private final Map<ClaimField, List<FieldMatcher>> matchers = new EnumMap<>(ClaimField.class);

    public FieldMatcherRegistry() {
        DateValueParser dates = new DateValueParser();
        TimeValueParser times = new TimeValueParser();
        MonetaryAmountParser amounts = new MonetaryAmountParser();

        // Policy information
        register(POLICY_NUMBER, labeled(
                "Policy[ \\t]*(?:Number" + END + "|No\\.?" + END + "|ID" + END + "|#)",
                IDENTIFIER), ValueParsers.IDENTIFIER_VALUE);
        register(POLICYHOLDER_NAME, strictlyLabeled(
                "(?:Policy[ \\t]*holder|Insured)(?:[ \\t]+Name)?", NAME), ValueParsers.PERSON_NAME);

        Pattern effectiveRange = Pattern.compile(
                "(?<![A-Za-z])(?:Policy[ \\t]+)?(?:Effective|Coverage)[ \\t]+(?:Dates?|Period)" + END + SEPARATOR + VALUE_ON_NEXT_LINE
                        + "(" + DATE + ")[ \\t]*(?:to|through|thru|until|-|\u2013)[ \\t]*(" + DATE + ")",
                Pattern.CASE_INSENSITIVE);
        register(new FieldMatcher(EFFECTIVE_START, effectiveRange, 1, dates));
        register(EFFECTIVE_START, labeled(
                "(?:Policy[ \\t]+)?(?:Start|Inception)[ \\t]+Date" + END + "|Effective[ \\t]+(?:From|Date)" + END,
                REST_OF_LINE), dates);
        register(new FieldMatcher(EFFECTIVE_END, effectiveRange, 2, dates));
        register(EFFECTIVE_END, labeled(
                "(?:Policy[ \\t]+)?(?:End|Expiration|Expiry)[ \\t]+Date" + END + "|Effective[ \\t]+(?:To|Until)" + END,
                REST_OF_LINE), dates);

        // Incident information
        register(INCIDENT_DATE, labeled(
                "(?:Incident|Accident|Loss)[ \\t]+Date" + END + "|Date[ \\t]+of[ \\t]+(?:Incident|Accident|Loss)" + END,
                REST_OF_LINE), dates);
        register(INCIDENT_TIME, labeled(
                "(?:Incident|Accident|Loss)[ \\t]+Time" + END + "|Time[ \\t]+of[ \\t]+(?:Incident|Accident|Loss)" + END,
                REST_OF_LINE), times);
        register(INCIDENT_TIME, labeled(
                "(?:Incident|Accident|Loss)[ \\t]+Date[ \\t]+(?:and|&)[ \\t]+Time" + END,
                REST_OF_LINE), times);
        register(INCIDENT_LOCATION, lineLabeled(
                "(?:Incident|Accident|Loss)[ \\t]+(?:Location|Address)" + END
                        + "|Location(?:[ \\t]+of[ \\t]+(?:Incident|Accident|Loss))?" + END,
                REST_OF_LINE), ValueParsers.TEXT);
        register(INCIDENT_DESCRIPTION, Pattern.compile(
                "^(?:(?:Incident|Accident|Loss)[ \\t]+Description|Description(?:[ \\t]+of[ \\t]+(?:Incident|Accident|Loss))?"
                        + "|Details[ \\t]+of[ \\t]+(?:Incident|Accident|Loss)|Narrative)" + END
                        + SEPARATOR + VALUE_ON_NEXT_LINE
                        + "(\\S[^\\n]*(?:\\n" + NEXT_LABEL + "[^\\n]*\\S[^\\n]*)*)",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE), ValueParsers.TEXT);

        // Involved parties
        register(CLAIMANT, strictlyLabeled(
                "Claimant(?:[ \\t]+Name)?|Name[ \\t]+of[ \\t]+Claimant", NAME), ValueParsers.PERSON_NAME);
        register(THIRD_PARTIES, listLabeled(
                "(?:Third|Other)[ \\t]+Part(?:y|ies)(?:[ \\t]+(?:Names?|Involved))?" + END,
                LIST_BLOCK), ValueParsers.NAME_LIST);
        register(CONTACT_PHONE, labeled(
                "(?:(?:Contact|Claimant|Policyholder)[ \\t]+)?(?:Phone|Telephone|Tel|Mobile|Cell)(?:[ \\t]+(?:Number|No\\.?))?" + END
                        + "|Contact[ \\t]+Number" + END,
                PHONE_NUMBER), ValueParsers.PHONE);
        register(CONTACT_EMAIL, labeled(
                "(?:(?:Contact|Claimant|Policyholder)[ \\t]+)?E-?mail(?:[ \\t]+Address)?" + END,
                EMAIL), ValueParsers.EMAIL_ADDRESS);

        // Asset details
        register(ASSET_TYPE, strictlyLabeled(
                "(?:Asset|Property|Vehicle)[ \\t]+Type" + END + "|Type[ \\t]+of[ \\t]+(?:Asset|Property)" + END,
                KIND), ValueParsers.TEXT);
        register(ASSET_ID, labeled(
                "Asset[ \\t]+ID" + END + "|VIN" + END + "|Serial[ \\t]+(?:Number|No\\.?)" + END
                        + "|(?:Registration|License[ \\t]+Plate|Plate)[ \\t]+(?:Number|No\\.?)" + END,
                IDENTIFIER), ValueParsers.IDENTIFIER_VALUE);
        register(ESTIMATED_DAMAGE, labeled(
                "Estimated[ \\t]+(?:Damages?|Repair[ \\t]+Costs?|Loss)(?:[ \\t]+Amount)?" + END
                        + "|Damage[ \\t]+Amount" + END,
                REST_OF_LINE), amounts);

        // Other mandatory fields
        register(CLAIM_TYPE, strictlyLabeled(
                "Claim[ \\t]+(?:Type|Category)" + END + "|Type[ \\t]+of[ \\t]+Claim" + END,
                REST_OF_LINE), ValueParsers.CLAIM_TYPE);
        register(ATTACHMENTS, listLabeled(
                "Attachments?" + END + "|Supporting[ \\t]+Documents?" + END + "|Documents[ \\t]+(?:Attached|Provided)" + END,
                LIST_BLOCK), ValueParsers.LIST);
        register(INITIAL_ESTIMATE, labeled(
                "Initial[ \\t]+(?:Damage[ \\t]+)?(?:Estimate|Reserve)(?:[ \\t]+Amount)?" + END,
                REST_OF_LINE), amounts);
    }

    /**
     * @return every field's matchers in the order they are tried; fields without a matcher are not listed
     */
    public Map<ClaimField, List<FieldMatcher>> matchers() {
        return Collections.unmodifiableMap(matchers);
    }

    public List<FieldMatcher> matchersFor(ClaimField field) {
        return matchers.getOrDefault(field, List.of());
    }

    private void register(ClaimField field, Pattern pattern, ValueParser<?> parser) {
        register(new FieldMatcher(field, pattern, 1, parser));
    }

    private void register(FieldMatcher matcher) {
        matchers.computeIfAbsent(matcher.field(), f -> new ArrayList<>()).add(matcher);
    }

    private static Pattern labeled(String label, String value) {
        return Pattern.compile("(?<![A-Za-z])(?:" + label + ")" + SEPARATOR + VALUE_ON_NEXT_LINE + "(" + value + ")",
                Pattern.CASE_INSENSITIVE);
    }

    private static Pattern strictlyLabeled(String label, String value) {
        return Pattern.compile("(?<![A-Za-z])(?:" + label + ")" + STRICT_SEPARATOR + VALUE_ON_NEXT_LINE + "(" + value + ")",
                Pattern.CASE_INSENSITIVE);
    }

    private static Pattern lineLabeled(String label, String value) {
        return Pattern.compile("^(?:" + label + ")" + SEPARATOR + VALUE_ON_NEXT_LINE + "(" + value + ")",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    }

    private static Pattern listLabeled(String label, String block) {
        return Pattern.compile("^(?:" + label + ")" + SEPARATOR + "(" + block + ")",
                Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);
    }
}
