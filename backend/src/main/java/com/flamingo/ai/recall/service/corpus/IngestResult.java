package com.flamingo.ai.recall.service.corpus;

import java.util.List;

/**
 * Outcome of one ingestion.
 *
 * @param conversationId the conversation
 * @param accepted ids of newly stored messages
 * @param skipped ids of identical redeliveries
 */
public record IngestResult(String conversationId, List<String> accepted, List<String> skipped) {}
