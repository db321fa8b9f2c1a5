package com.github.spud.sample.ai.taskchat.domain.tools.task;

/**
 * The task store did not answer in time. Always transient.
 */
public class TaskStoreTimeoutException extends TaskStoreException {

  public TaskStoreTimeoutException(String message, Throwable cause) {
    super(message, true, cause);
  }
}
