package com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity;

import com.github.spud.sample.ai.taskchat.domain.tools.InvocationStatus;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.Map;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

/**
 * Audit row for one attempt of one tool call. Inserted once, never updated.
 */
@Getter
@Setter
@Entity
@Table(name = "tool_invocation_records", indexes = {
  @Index(name = "idx_tool_invocations_message", columnList = "message_id"),
  @Index(name = "idx_tool_invocations_user_conversation", columnList = "user_id, conversation_id")
})
public class ToolInvocation {

  @Id
  @GeneratedValue(strategy = GenerationType.AUTO)
  @Column(name = "id", nullable = false)
  private UUID id;

  @NotNull
  @Column(name = "conversation_id", nullable = false, updatable = false)
  private UUID conversationId;

  /**
   * Assistant message of the turn that produced this attempt
   */
  @NotNull
  @Column(name = "message_id", nullable = false, updatable = false)
  private UUID messageId;

  @Size(max = 64)
  @NotNull
  @Column(name = "user_id", nullable = false, length = 64, updatable = false)
  private String userId;

  @NotNull
  @Column(name = "call_index", nullable = false, updatable = false)
  private Integer callIndex;

  @Size(max = 100)
  @NotNull
  @Column(name = "tool_name", nullable = false, length = 100, updatable = false)
  private String toolName;

  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "parameters", columnDefinition = "jsonb", updatable = false)
  private Map<String, Object> parameters;

  @NotNull
  @Column(name = "attempt_number", nullable = false, updatable = false)
  private Integer attemptNumber;

  @NotNull
  @Column(name = "status", nullable = false, length = 16, updatable = false)
  @Enumerated(EnumType.STRING)
  private InvocationStatus status;

  @Column(name = "result_or_error", length = Integer.MAX_VALUE, updatable = false)
  private String resultOrError;

  @Size(max = 40)
  @Column(name = "error_code", length = 40, updatable = false)
  private String errorCode;

  @Size(max = 64)
  @Column(name = "idempotency_key", length = 64, updatable = false)
  private String idempotencyKey;

  @NotNull
  @Column(name = "started_at", nullable = false, updatable = false)
  private OffsetDateTime startedAt;

  @NotNull
  @Column(name = "completed_at", nullable = false, updatable = false)
  private OffsetDateTime completedAt;

  public ToolInvocation() {
  }
}
