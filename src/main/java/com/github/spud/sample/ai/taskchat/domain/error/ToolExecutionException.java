package com.github.spud.sample.ai.taskchat.domain.error;

import lombok.Getter;

/**
 * A single tool-call attempt failed. {@code transientFailure} tells the dispatcher whether another
 * attempt may succeed.
 */
@Getter
public class ToolExecutionException extends TaskChatException {

  private final boolean transientFailure;

  public ToolExecutionException(ErrorCode code, String message, boolean transientFailure) {
    super(code, message);
    this.transientFailure = transientFailure;
  }

  public ToolExecutionException(ErrorCode code, String message, boolean transientFailure,
    Throwable cause) {
    super(code, message, cause);
    this.transientFailure = transientFailure;
  }
}
