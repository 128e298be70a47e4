package com.flamingo.ai.recall.search;

import com.flamingo.ai.recall.domain.enums.MessageRole;
import com.flamingo.ai.recall.index.CandidateFilter;
import java.time.Instant;

/**
 * Validated, normalized search request.
 *
 * @param terms trimmed free text, empty when absent
 * @param project exact project filter, or null
 * @param role role filter, or null
 * @param since inclusive lower time bound, or null
 * @param until inclusive upper time bound, or null
 * @param topK result cap, already clamped
 * @param group whether results are bucketed by conversation
 * @param convos maximum conversations when grouping
 * @param perConvo maximum hits per conversation when grouping
 */
public record QueryDescriptor(
    String terms,
    String project,
    MessageRole role,
    Instant since,
    Instant until,
    int topK,
    boolean group,
    int convos,
    int perConvo) {

  public boolean hasTerms() {
    return !terms.isEmpty();
  }

  public CandidateFilter filter() {
    return new CandidateFilter(project, role, since, until);
  }
}
