package com.claimsagent.infrastructure.routing;

import com.claimsagent.domain.claim.model.ClaimRecord;
import com.claimsagent.domain.claim.model.ClaimType;
import com.claimsagent.domain.claim.model.ExtractedFields;
import com.claimsagent.domain.claim.model.Route;
import com.claimsagent.domain.claim.model.RoutingResult;
import com.claimsagent.domain.claim.service.ClaimRouter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Evaluates the routing rules in priority order; the first matching rule decides the route.
 * <p>
 * Order: missing mandatory fields, fraud keywords, injury claim type, damage below the
 * fast-track threshold, then standard processing as the catch-all.
 */
@Slf4j
@Component
public class RuleBasedClaimRouter implements ClaimRouter {

    public static final String MISSING_FIELDS = "missing-fields";
    public static final String FRAUD_INDICATORS = "fraud-indicators";
    public static final String INJURY_CLAIM = "injury-claim";
    public static final String FAST_TRACK = "fast-track";
    public static final String STANDARD = "standard";

    private final RoutingPolicy policy;
    private final FraudKeywordScanner fraudScanner;
    private final List<RoutingRule> rules;

    public RuleBasedClaimRouter(RoutingPolicy policy, FraudKeywordScanner fraudScanner) {
        this.policy = policy;
        this.fraudScanner = fraudScanner;
        this.rules = List.of(
                new RoutingRule(MISSING_FIELDS, Route.MANUAL_REVIEW,
                        s -> s.record().hasMissingFields(),
                        s -> "Missing mandatory fields: " + String.join(", ", s.missingFields())
                                + ". Claim requires manual review to complete information."),
                new RoutingRule(FRAUD_INDICATORS, Route.INVESTIGATION_FLAG,
                        s -> !s.fraudIndicators().isEmpty(),
                        s -> "Potential fraud indicators detected: " + s.fraudIndicators().stream()
                                .map(FraudIndicator::toString)
                                .collect(Collectors.joining(", "))
                                + ". Claim flagged for investigation."),
                new RoutingRule(INJURY_CLAIM, Route.SPECIALIST_QUEUE,
                        s -> s.claimType().filter(type -> type == ClaimType.INJURY).isPresent(),
                        s -> "Claim type identified as '" + ClaimType.INJURY.code()
                                + "'. Routing to specialist queue for medical review and assessment."),
                new RoutingRule(FAST_TRACK, Route.FAST_TRACK,
                        RoutingSignals::isBelowFastTrackThreshold,
                        s -> "Estimated damage (" + formatAmount(s.damageAmount().orElseThrow())
                                + ") is below the " + formatAmount(s.fastTrackThreshold())
                                + " fast-track threshold. All mandatory fields present and no fraud indicators detected."),
                new RoutingRule(STANDARD, Route.STANDARD_PROCESSING,
                        s -> true,
                        s -> s.damageAmount()
                                .map(amount -> "Estimated damage (" + formatAmount(amount)
                                        + ") is not below the " + formatAmount(s.fastTrackThreshold())
                                        + " fast-track threshold. Routing to standard processing for full assessment.")
                                .orElse("All mandatory fields present. No special conditions detected. "
                                        + "Routing to standard processing."))
        );
    }

    @Override
    public RoutingResult route(ClaimRecord record) {
        Objects.requireNonNull(record, "record");
        RoutingSignals signals = signalsFor(record);

        for (RoutingRule rule : rules) {
            if (rule.matches(signals)) {
                log.info("[Routing] Rule {} matched -> {}", rule.id(), rule.route().label());
                return new RoutingResult(rule.route(), rule.explain(signals), record.missingFields(), rule.id());
            }
            log.debug("[Routing] Rule {} skipped", rule.id());
        }
        // The standard rule always matches
        throw new IllegalStateException("No routing rule matched");
    }

    /**
     * @return the rules in evaluation order
     */
    public List<RoutingRule> rules() {
        return rules;
    }

    private RoutingSignals signalsFor(ClaimRecord record) {
        ExtractedFields fields = record.extractedFields();
        return new RoutingSignals(
                record,
                fraudScanner.scan(fields),
                fields.otherMandatoryFields().claimType(),
                damageAmount(fields),
                policy.fastTrackThreshold()
        );
    }

    static Optional<BigDecimal> damageAmount(ExtractedFields fields) {
        return fields.assetDetails().estimatedDamage()
                .or(() -> fields.otherMandatoryFields().initialEstimate());
    }

    static String formatAmount(BigDecimal amount) {
        return String.format(Locale.US, "$%,.2f", amount);
    }
}
