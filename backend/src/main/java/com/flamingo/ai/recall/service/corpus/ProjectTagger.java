package com.flamingo.ai.recall.service.corpus;

import com.flamingo.ai.recall.config.RecallConfig;
import java.util.Locale;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Assigns a project to untagged messages from the configured rules.
 *
 * <p>The first rule with a pattern occurring in the text wins. Matching is a case-insensitive
 * substring test.
 */
@Component
@RequiredArgsConstructor
public class ProjectTagger {

  private final RecallConfig recallConfig;

  public Optional<String> tag(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    String haystack = text.toLowerCase(Locale.ROOT);
    for (RecallConfig.ProjectRule rule : recallConfig.getProjects().getRules()) {
      if (rule.getTag() == null || rule.getTag().isBlank()) {
        continue;
      }
      for (String pattern : rule.getPatterns()) {
        if (pattern != null
            && !pattern.isBlank()
            && haystack.contains(pattern.toLowerCase(Locale.ROOT))) {
          return Optional.of(rule.getTag().trim());
        }
      }
    }
    return Optional.empty();
  }
}
