package com.flamingo.ai.recall.exception;

/** Exception thrown when an embedding backfill is requested while another one runs. */
public class BackfillInProgressException extends RuntimeException {

  public BackfillInProgressException() {
    super("An embedding backfill is already running");
  }
}
