package com.github.spud.sample.ai.taskchat.domain.error;

import java.util.Collections;
import java.util.Map;
import lombok.Getter;

/**
 * Base type of every failure the engine raises on purpose. The {@link ErrorCode} decides the
 * HTTP mapping and what may be disclosed; the message is for logs only.
 */
@Getter
public class TaskChatException extends RuntimeException {

  private final ErrorCode code;
  private final Map<String, Object> details;

  public TaskChatException(ErrorCode code, String message) {
    this(code, message, Collections.emptyMap(), null);
  }

  public TaskChatException(ErrorCode code, String message, Throwable cause) {
    this(code, message, Collections.emptyMap(), cause);
  }

  public TaskChatException(ErrorCode code, String message, Map<String, Object> details,
    Throwable cause) {
    super(message, cause);
    this.code = code;
    this.details = details != null ? Map.copyOf(details) : Collections.emptyMap();
  }
}
