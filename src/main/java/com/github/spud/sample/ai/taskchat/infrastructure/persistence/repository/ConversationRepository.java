package com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository;

import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.Conversation;
import jakarta.persistence.LockModeType;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;

public interface ConversationRepository extends JpaRepository<Conversation, UUID> {

  Optional<Conversation> findByIdAndUserId(UUID id, String userId);

  /**
   * Row lock held until the surrounding transaction ends; serializes turn writes per conversation.
   */
  @Lock(LockModeType.PESSIMISTIC_WRITE)
  @Query("SELECT c FROM Conversation c WHERE c.id = :id AND c.userId = :userId")
  Optional<Conversation> lockOwned(UUID id, String userId);

  List<Conversation> findByUserIdOrderByUpdatedAtDesc(String userId, Limit limit);

  /**
   * Move {@code updated_at} forward only; an older timestamp leaves the row untouched.
   */
  @Modifying(flushAutomatically = true, clearAutomatically = true)
  @Query("UPDATE Conversation c SET c.updatedAt = :updatedAt "
    + "WHERE c.id = :id AND c.userId = :userId AND c.updatedAt < :updatedAt")
  int advanceUpdatedAt(UUID id, String userId, OffsetDateTime updatedAt);
}
