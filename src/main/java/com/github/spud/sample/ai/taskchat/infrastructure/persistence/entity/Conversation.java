package com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import java.time.OffsetDateTime;
import java.util.UUID;
import lombok.Getter;
import lombok.Setter;
import org.hibernate.annotations.ColumnDefault;

/**
 * Conversation row. Holds no reference to its messages; they are reached by indexed query on
 * {@code conversation_id}.
 */
@Getter
@Setter
@Entity
@Table(name = "conversations", indexes = {
  @Index(name = "idx_conversations_user_id", columnList = "user_id"),
  @Index(name = "idx_conversations_user_updated", columnList = "user_id, updated_at")
})
public class Conversation {

  @Id
  @Column(name = "id", nullable = false)
  private UUID id;

  @Size(max = 64)
  @NotNull
  @Column(name = "user_id", nullable = false, length = 64, updatable = false)
  private String userId;

  @NotNull
  @ColumnDefault("now()")
  @Column(name = "created_at", nullable = false, updatable = false)
  private OffsetDateTime createdAt;

  @NotNull
  @ColumnDefault("now()")
  @Column(name = "updated_at", nullable = false)
  private OffsetDateTime updatedAt;

  public Conversation() {
  }
}
