package com.claimsagent.infrastructure.routing;

import com.claimsagent.domain.claim.model.Route;

import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One entry of the ordered rule list: when {@code condition} holds, the claim goes to {@code route}.
 */
public record RoutingRule(
        String id,
        Route route,
        Predicate<RoutingSignals> condition,
        Function<RoutingSignals, String> reasoning
) {
    public RoutingRule {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(route, "route");
        Objects.requireNonNull(condition, "condition");
        Objects.requireNonNull(reasoning, "reasoning");
    }

    public boolean matches(RoutingSignals signals) {
        return condition.test(signals);
    }

    public String explain(RoutingSignals signals) {
        return reasoning.apply(signals);
    }
}
