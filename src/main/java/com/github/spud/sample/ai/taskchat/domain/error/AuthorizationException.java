package com.github.spud.sample.ai.taskchat.domain.error;

/**
 * Authenticated caller tried to reach data it does not own. Never retried, always audited.
 */
public class AuthorizationException extends TaskChatException {

  public AuthorizationException(ErrorCode code, String message) {
    super(code, message);
  }
}
