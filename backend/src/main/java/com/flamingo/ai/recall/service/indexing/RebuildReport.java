package com.flamingo.ai.recall.service.indexing;

import com.flamingo.ai.recall.index.IndexStatus;
import java.util.List;

/**
 * Outcome of a full index rebuild.
 *
 * @param messages messages in the snapshot
 * @param embedded messages that went in with a usable vector
 * @param staleEmbeddings stored vectors skipped because the text or dimension changed
 * @param seconds elapsed time
 * @param failedIndexes names of indexes that failed to build and kept their old generation
 * @param indexes status of every index after the rebuild
 */
public record RebuildReport(
    int messages,
    int embedded,
    int staleEmbeddings,
    double seconds,
    List<String> failedIndexes,
    List<IndexStatus> indexes) {}
