package com.github.spud.sample.ai.taskchat.domain.isolation;

import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * One rejected access attempt
 */
@Data
@Builder
public class SecurityAuditEvent {

  private ErrorCode code;

  /**
   * Authenticated caller
   */
  private String userId;

  /**
   * User the caller tried to reach, when known
   */
  private String targetUserId;

  private String conversationId;

  /**
   * Tool name or endpoint involved
   */
  private String resource;

  private String detail;

  private String traceId;

  private Instant occurredAt;
}
