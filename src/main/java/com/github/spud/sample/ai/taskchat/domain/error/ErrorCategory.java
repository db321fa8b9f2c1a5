package com.github.spud.sample.ai.taskchat.domain.error;

/**
 * Top-level grouping of {@link ErrorCode}s.
 */
public enum ErrorCategory {
  AUTHENTICATION,
  AUTHORIZATION,
  VALIDATION,
  RESOURCE,
  TOOL_EXECUTION,
  PERSISTENCE,
  RATE_LIMITING,
  INTERNAL
}
