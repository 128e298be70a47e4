package com.flamingo.ai.recall.search;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.springframework.stereotype.Component;

/**
 * Buckets a ranked candidate list by conversation.
 *
 * <p>Walking the list in rank order, a conversation's first candidate is its best, so
 * conversations come out in order of first appearance and ties keep ranked order. Within a
 * conversation candidates stay in fused order, not chronological order. Stateless.
 */
@Component
public class ConversationGrouper {

  /**
   * Groups {@code ranked}.
   *
   * @param ranked candidates sorted by {@link ScoredCandidate#RANKING}
   * @param convos maximum number of conversations
   * @param perConvo maximum candidates per conversation
   * @return at most {@code convos} groups, each with at most {@code perConvo} candidates
   */
  public List<CandidateGroup> group(List<ScoredCandidate> ranked, int convos, int perConvo) {
    if (convos <= 0 || perConvo <= 0) {
      return List.of();
    }
    Map<String, List<ScoredCandidate>> buckets = new LinkedHashMap<>();
    for (ScoredCandidate candidate : ranked) {
      List<ScoredCandidate> bucket = buckets.get(candidate.conversationId());
      if (bucket == null) {
        if (buckets.size() >= convos) {
          continue;
        }
        bucket = new ArrayList<>();
        buckets.put(candidate.conversationId(), bucket);
      }
      if (bucket.size() < perConvo) {
        bucket.add(candidate);
      }
    }

    List<CandidateGroup> groups = new ArrayList<>(buckets.size());
    buckets.forEach(
        (conversationId, candidates) ->
            groups.add(
                new CandidateGroup(
                    conversationId, candidates.get(0).fusedScore(), List.copyOf(candidates))));
    return groups;
  }
}
