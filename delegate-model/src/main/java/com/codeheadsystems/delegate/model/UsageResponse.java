package com.codeheadsystems.delegate.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Usage statistics for a session key as of the time of the request.
 *
 * @param usedToday               consumption in the current UTC day (decimal string)
 * @param remainingDaily          budget left for the current day (decimal string)
 * @param remainingPerTx          per-operation cap (decimal string)
 * @param timeUntilExpirySeconds  seconds until expiry, zero once expired
 */
public record UsageResponse(
    @JsonProperty("usedToday") String usedToday,
    @JsonProperty("remainingDaily") String remainingDaily,
    @JsonProperty("remainingPerTx") String remainingPerTx,
    @JsonProperty("timeUntilExpirySeconds") long timeUntilExpirySeconds) {
}
