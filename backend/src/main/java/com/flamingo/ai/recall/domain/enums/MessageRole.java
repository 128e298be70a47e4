package com.flamingo.ai.recall.domain.enums;

import java.util.Locale;
import java.util.Optional;

/** Defines the role of a message author in an archived conversation. */
public enum MessageRole {
  /** Message written by the archive owner. */
  USER,

  /** Message produced by an assistant. */
  ASSISTANT,

  /** System prompt or instructions. */
  SYSTEM,

  /** Anything else a provider emits, such as tool or function output. */
  OTHER;

  /** Lower-case name used on the wire. */
  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a role filter. Matching is case-insensitive and exact on the four known roles.
   *
   * @return the role, or empty if the value names none of them
   */
  public static Optional<MessageRole> parse(String value) {
    if (value == null) {
      return Optional.empty();
    }
    String normalized = value.trim().toUpperCase(Locale.ROOT);
    for (MessageRole role : values()) {
      if (role.name().equals(normalized)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }

  /** Maps a provider role to a stored role; unknown or missing roles become {@link #OTHER}. */
  public static MessageRole fromProvider(String value) {
    return parse(value).orElse(OTHER);
  }
}
