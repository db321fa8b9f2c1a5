package com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository;

import com.github.spud.sample.ai.taskchat.domain.message.MessageRole;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.domain.Limit;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * Every finder takes the owning user id.
 */
public interface ConversationMessageRepository extends JpaRepository<ConversationMessage, UUID> {

  /**
   * The newest {@code maxMessages} messages, returned oldest first.
   */
  default List<ConversationMessage> listRecentMessages(UUID conversationId, String userId,
    int maxMessages) {
    List<ConversationMessage> newestFirst =
      findByConversationIdAndUserIdOrderByCreatedAtDescSeqDesc(conversationId, userId,
        Limit.of(maxMessages));
    List<ConversationMessage> ordered = new ArrayList<>(newestFirst);
    Collections.reverse(ordered);
    return ordered;
  }

  List<ConversationMessage> findByConversationIdAndUserIdOrderByCreatedAtDescSeqDesc(
    UUID conversationId, String userId, Limit limit);

  List<ConversationMessage> findByConversationIdAndUserIdOrderByCreatedAtAscSeqAsc(
    UUID conversationId, String userId);

  Optional<ConversationMessage> findFirstByConversationIdAndUserIdOrderByCreatedAtAscSeqAsc(
    UUID conversationId, String userId);

  Optional<ConversationMessage> findFirstByConversationIdAndUserIdOrderByCreatedAtDescSeqDesc(
    UUID conversationId, String userId);

  long countByConversationIdAndUserId(UUID conversationId, String userId);

  long countByUserIdAndRoleAndCreatedAtAfter(String userId, MessageRole role,
    OffsetDateTime after);

  Optional<ConversationMessage> findFirstByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtAsc(
    String userId, MessageRole role, OffsetDateTime after);
}
