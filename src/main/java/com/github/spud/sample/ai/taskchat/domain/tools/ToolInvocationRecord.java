package com.github.spud.sample.ai.taskchat.domain.tools;

import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import java.time.Instant;
import java.util.Map;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Immutable audit entry for one attempt of one tool call. A retry appends a new record.
 * {@code attemptNumber} is 0 for a call that was skipped without any attempt.
 */
@Getter
@Builder
@ToString
public class ToolInvocationRecord {

  private final int callIndex;

  private final String toolName;

  /**
   * Parameters after output references were resolved
   */
  private final Map<String, Object> parameters;

  private final int attemptNumber;

  private final InvocationStatus status;

  private final String resultOrError;

  private final ErrorCode errorCode;

  private final String idempotencyKey;

  private final Instant startedAt;

  private final Instant completedAt;
}
