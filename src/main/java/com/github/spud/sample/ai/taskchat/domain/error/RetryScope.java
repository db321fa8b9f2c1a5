package com.github.spud.sample.ai.taskchat.domain.error;

/**
 * Where, if anywhere, a failure of a given code may be retried inside the engine.
 */
public enum RetryScope {

  /**
   * Never retried by the engine. Callers may resubmit.
   */
  NEVER,

  /**
   * Retried by the tool dispatcher with exponential backoff.
   */
  TOOL_CALL,

  /**
   * Retried a bounded number of times by the persistence writer only.
   */
  WRITE_LAYER
}
