package com.github.spud.sample.ai.taskchat.domain.error;

import java.time.Duration;
import lombok.Getter;

@Getter
public class RateLimitException extends TaskChatException {

  private final Duration retryAfter;

  public RateLimitException(String message, Duration retryAfter) {
    super(ErrorCode.TOO_MANY_REQUESTS, message);
    this.retryAfter = retryAfter;
  }
}
