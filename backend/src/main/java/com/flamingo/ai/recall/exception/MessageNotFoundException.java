package com.flamingo.ai.recall.exception;

/** Exception thrown when a message is not found. */
public class MessageNotFoundException extends RuntimeException {

  private final String messageId;

  public MessageNotFoundException(String messageId) {
    super("Message not found with ID: " + messageId);
    this.messageId = messageId;
  }

  public String getMessageId() {
    return messageId;
  }
}
