package com.claimsagent.infrastructure.routing;

import com.claimsagent.domain.claim.model.ClaimField;
import com.claimsagent.domain.claim.model.ExtractedFields;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Case-insensitive substring search for fraud keywords in the policy's scan fields only.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FraudKeywordScanner {

    private final RoutingPolicy policy;

    /**
     * @return one indicator per (field, keyword) hit, in scan-field then keyword order
     */
    public List<FraudIndicator> scan(ExtractedFields fields) {
        List<FraudIndicator> indicators = new ArrayList<>();
        for (ClaimField field : policy.fraudScanFields()) {
            Optional<String> text = textOf(field.valueIn(fields));
            if (text.isEmpty()) {
                continue;
            }
            String haystack = text.get().toLowerCase(Locale.ROOT);
            for (String keyword : policy.fraudKeywords()) {
                if (haystack.contains(keyword)) {
                    indicators.add(new FraudIndicator(keyword, field.path()));
                }
            }
        }
        if (!indicators.isEmpty()) {
            log.debug("[Routing] Fraud keywords found: {}", indicators);
        }
        return indicators;
    }

    private static Optional<String> textOf(Optional<?> value) {
        return value.map(v -> {
            if (v instanceof Collection<?> items) {
                return items.stream().map(String::valueOf).collect(Collectors.joining(" "));
            }
            return String.valueOf(v);
        });
    }
}
