package com.flamingo.ai.recall.service.ledger;

import java.time.Instant;
import java.util.Map;

/**
 * A running action, returned by {@link ActionLedgerService#start} and passed back to finish it.
 *
 * @param eventId ledger row id, or null when the start could not be recorded
 */
public record ActionHandle(
    Long eventId, String kind, Map<String, Object> params, Instant startedAt, long startNanos) {}
