package com.flamingo.ai.recall.exception;

/**
 * Exception thrown when an ingested message reuses a stored id with different text.
 *
 * <p>Redelivery of identical text is not an error and never raises this.
 */
public class DuplicateMessageException extends RuntimeException {

  private final String messageId;

  public DuplicateMessageException(String messageId) {
    super("Message " + messageId + " already exists with different content");
    this.messageId = messageId;
  }

  public String getMessageId() {
    return messageId;
  }
}
