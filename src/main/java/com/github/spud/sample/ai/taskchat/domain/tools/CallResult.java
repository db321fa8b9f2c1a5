package com.github.spud.sample.ai.taskchat.domain.tools;

import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Final outcome of one call in the chain, after all of its attempts.
 */
@Getter
@Builder
@ToString
public class CallResult {

  private final int callIndex;

  private final String toolName;

  private final String slotName;

  /**
   * SUCCESS, ERROR (retries exhausted or not retryable) or SKIPPED
   */
  private final InvocationStatus status;

  /**
   * Raw tool output on success, internal error description otherwise
   */
  private final String resultOrError;

  private final ErrorCode errorCode;

  private final int attempts;

  private final ChainPolicy chainPolicy;

  public boolean isSuccess() {
    return status == InvocationStatus.SUCCESS;
  }

  public boolean isFailed() {
    return status == InvocationStatus.ERROR || status == InvocationStatus.TIMEOUT;
  }
}
