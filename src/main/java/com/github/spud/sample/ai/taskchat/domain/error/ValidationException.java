package com.github.spud.sample.ai.taskchat.domain.error;

import java.util.Map;
import lombok.Getter;

/**
 * Input rejected before any work was done. Field errors are safe to disclose.
 */
@Getter
public class ValidationException extends TaskChatException {

  private final Map<String, String> fieldErrors;

  public ValidationException(ErrorCode code, String message) {
    this(code, message, Map.of());
  }

  public ValidationException(ErrorCode code, String message, Map<String, String> fieldErrors) {
    super(code, message, Map.of("fieldErrors", Map.copyOf(fieldErrors)), null);
    this.fieldErrors = Map.copyOf(fieldErrors);
  }
}
