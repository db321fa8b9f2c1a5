package com.github.spud.sample.ai.taskchat.domain.tools;

/**
 * Outcome of one tool-call attempt
 */
public enum InvocationStatus {
  SUCCESS,
  ERROR,
  TIMEOUT,
  SKIPPED
}
