package com.claimsagent.infrastructure.extraction;

import com.claimsagent.domain.claim.model.AssetDetails;
import com.claimsagent.domain.claim.model.ClaimField;
import com.claimsagent.domain.claim.model.ClaimRecord;
import com.claimsagent.domain.claim.model.ContactDetails;
import com.claimsagent.domain.claim.model.EffectiveDates;
import com.claimsagent.domain.claim.model.ExtractedFields;
import com.claimsagent.domain.claim.model.IncidentInformation;
import com.claimsagent.domain.claim.model.InvolvedParties;
import com.claimsagent.domain.claim.model.MandatoryFieldChecklist;
import com.claimsagent.domain.claim.model.OtherMandatoryFields;
import com.claimsagent.domain.claim.model.PolicyInformation;
import com.claimsagent.domain.claim.service.ClaimExtractor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static com.claimsagent.domain.claim.model.ClaimField.*;

/**
 * Pattern-based FNOL extractor. The text is normalized once, then every field is
 * resolved independently by trying its registered matchers in order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FnolFieldExtractor implements ClaimExtractor {

    private final TextNormalizer textNormalizer;
    private final FieldMatcherRegistry matcherRegistry;
    private final MandatoryFieldChecklist checklist;

    @Override
    public ClaimRecord extract(String text) {
        Objects.requireNonNull(text, "text");

        String normalized = textNormalizer.normalize(text);
        if (normalized.isEmpty()) {
            log.info("[Extractor] Empty document, all fields absent");
            return ClaimRecord.of(ExtractedFields.allAbsent(), checklist);
        }

        Map<ClaimField, Optional<?>> values = new EnumMap<>(ClaimField.class);
        for (ClaimField field : ClaimField.values()) {
            values.put(field, resolve(field, normalized));
        }

        ClaimRecord record = ClaimRecord.of(assemble(values), checklist);
        if (log.isDebugEnabled()) {
            values.forEach((field, value) -> log.debug("[Extractor] {} = {}", field, value.orElse(null)));
        }
        log.info("[Extractor] {} chars, {} of {} fields found, missing mandatory: {}",
                normalized.length(),
                values.values().stream().filter(Optional::isPresent).count(),
                values.size(),
                record.missingFields());
        return record;
    }

    private Optional<?> resolve(ClaimField field, String text) {
        for (FieldMatcher matcher : matcherRegistry.matchersFor(field)) {
            Optional<?> value = matcher.match(text);
            if (value.isPresent()) {
                return value;
            }
        }
        return Optional.empty();
    }

    private static ExtractedFields assemble(Map<ClaimField, Optional<?>> v) {
        return new ExtractedFields(
                new PolicyInformation(
                        get(v, POLICY_NUMBER),
                        get(v, POLICYHOLDER_NAME),
                        new EffectiveDates(get(v, EFFECTIVE_START), get(v, EFFECTIVE_END))),
                new IncidentInformation(
                        get(v, INCIDENT_DATE),
                        get(v, INCIDENT_TIME),
                        get(v, INCIDENT_LOCATION),
                        get(v, INCIDENT_DESCRIPTION)),
                new InvolvedParties(
                        get(v, CLAIMANT),
                        get(v, THIRD_PARTIES),
                        new ContactDetails(get(v, CONTACT_PHONE), get(v, CONTACT_EMAIL))),
                new AssetDetails(
                        get(v, ASSET_TYPE),
                        get(v, ASSET_ID),
                        get(v, ESTIMATED_DAMAGE)),
                new OtherMandatoryFields(
                        get(v, CLAIM_TYPE),
                        get(v, ATTACHMENTS),
                        get(v, INITIAL_ESTIMATE))
        );
    }

    // Matcher parsers are registered per field, so the value type follows from the field
    @SuppressWarnings("unchecked")
    private static <T> Optional<T> get(Map<ClaimField, Optional<?>> values, ClaimField field) {
        return (Optional<T>) values.getOrDefault(field, Optional.empty());
    }
}
