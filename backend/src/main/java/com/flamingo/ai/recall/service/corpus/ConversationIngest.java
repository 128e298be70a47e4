package com.flamingo.ai.recall.service.corpus;

import java.time.Instant;
import java.util.List;

/**
 * A conversation delivered by a connector.
 *
 * @param id conversation id
 * @param title optional title
 * @param source optional origin, e.g. {@code chatgpt}
 * @param createdAt optional; defaults to the earliest message timestamp
 * @param messages messages to append
 */
public record ConversationIngest(
    String id, String title, String source, Instant createdAt, List<MessageIngest> messages) {

  /**
   * One delivered message.
   *
   * @param role provider role; anything but user, assistant or system is stored as other
   * @param project optional project label
   */
  public record MessageIngest(
      String id, String role, String project, Instant timestamp, String text) {}
}
