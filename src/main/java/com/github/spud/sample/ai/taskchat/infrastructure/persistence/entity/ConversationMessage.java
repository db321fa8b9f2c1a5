package com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity;

import com.github.spud.sample.ai.taskchat.domain.message.MessageRole;
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
import java.util.List;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;
import org.hibernate.annotations.Generated;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

@Getter
@Setter
@Entity
@Table(name = "messages", indexes = {
  @Index(name = "idx_messages_user_id", columnList = "user_id"),
  @Index(name = "idx_messages_conversation_created",
    columnList = "conversation_id, created_at, seq")
})
public class ConversationMessage {

  @Id
  @GeneratedValue(strategy = GenerationType.AUTO)
  @Column(name = "id", nullable = false)
  private UUID id;

  @NotNull
  @Column(name = "conversation_id", nullable = false, updatable = false)
  private UUID conversationId;

  /**
   * Copy of the owning conversation's user, filtered on by every read
   */
  @Size(max = 64)
  @NotNull
  @Column(name = "user_id", nullable = false, length = 64, updatable = false)
  private String userId;

  @NotNull
  @Column(name = "role", nullable = false, length = 16)
  @Enumerated(EnumType.STRING)
  private MessageRole role;

  @NotNull
  @Column(name = "content", nullable = false, length = Integer.MAX_VALUE)
  private String content;

  /**
   * Ids of the tool invocation records produced by this turn, in execution order
   */
  @JdbcTypeCode(SqlTypes.JSON)
  @Column(name = "tool_calls", columnDefinition = "jsonb")
  private List<String> toolCalls;

  @Generated
  @ColumnDefault("nextval('messages_seq')")
  @Column(name = "seq", nullable = false, insertable = false, updatable = false)
  private Long seq;

  @NotNull
  @Column(name = "created_at", nullable = false, updatable = false)
  private OffsetDateTime createdAt;

  public ConversationMessage() {
  }
}
