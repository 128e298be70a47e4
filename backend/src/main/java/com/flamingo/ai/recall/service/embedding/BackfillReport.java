package com.flamingo.ai.recall.service.embedding;

/**
 * Outcome of one backfill run.
 *
 * @param model embedding model used
 * @param candidates messages that had no embedding when the run started, capped by the limit
 * @param embedded vectors stored
 * @param failed messages skipped after an embedding failure
 * @param remaining messages still without an embedding after the run
 * @param aborted whether the run stopped early because a whole batch failed
 */
public record BackfillReport(
    String model, int candidates, int embedded, int failed, long remaining, boolean aborted) {}
