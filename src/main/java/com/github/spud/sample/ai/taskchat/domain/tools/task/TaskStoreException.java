package com.github.spud.sample.ai.taskchat.domain.tools.task;

import lombok.Getter;

/**
 * Failure reported by the external task store. {@code transientFailure} is true for failures that
 * another attempt may not reproduce (store unavailable, connection reset, 5xx).
 */
@Getter
public class TaskStoreException extends RuntimeException {

  private final boolean transientFailure;

  public TaskStoreException(String message, boolean transientFailure) {
    super(message);
    this.transientFailure = transientFailure;
  }

  public TaskStoreException(String message, boolean transientFailure, Throwable cause) {
    super(message, cause);
    this.transientFailure = transientFailure;
  }
}
