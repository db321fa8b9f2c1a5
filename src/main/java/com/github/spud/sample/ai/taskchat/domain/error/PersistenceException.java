package com.github.spud.sample.ai.taskchat.domain.error;

/**
 * The conversation audit trail could not be written. Nothing of the turn was kept.
 */
public class PersistenceException extends TaskChatException {

  public PersistenceException(ErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }
}
