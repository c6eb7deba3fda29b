package com.claimsagent.domain.claim.service;

import com.claimsagent.domain.claim.model.ClaimRecord;
import com.claimsagent.domain.claim.model.RoutingResult;

/**
 * Domain service that assigns exactly one workflow route to an extracted claim.
 */
public interface ClaimRouter {

    /**
     * @param record an extracted claim, read only
     * @return the route with reasoning; total for every record
     * @throws NullPointerException if {@code record} is null
     */
    RoutingResult route(ClaimRecord record);
}
