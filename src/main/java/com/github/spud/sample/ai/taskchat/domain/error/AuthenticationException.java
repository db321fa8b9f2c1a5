package com.github.spud.sample.ai.taskchat.domain.error;

/**
 * Bearer credential missing, malformed, expired or badly signed. Never retried.
 */
public class AuthenticationException extends TaskChatException {

  public AuthenticationException(ErrorCode code, String message) {
    super(code, message);
  }

  public AuthenticationException(ErrorCode code, String message, Throwable cause) {
    super(code, message, cause);
  }
}
