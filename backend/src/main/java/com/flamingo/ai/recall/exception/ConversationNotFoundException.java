package com.flamingo.ai.recall.exception;

/** Exception thrown when a conversation is not found. */
public class ConversationNotFoundException extends RuntimeException {

  private final String conversationId;

  public ConversationNotFoundException(String conversationId) {
    super("Conversation not found with ID: " + conversationId);
    this.conversationId = conversationId;
  }

  public String getConversationId() {
    return conversationId;
  }
}
