package com.github.spud.sample.ai.taskchat.domain.conversation;

import com.github.spud.sample.ai.taskchat.application.config.TurnProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.ConversationNotFoundException;
import com.github.spud.sample.ai.taskchat.domain.isolation.IsolationGuard;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessageMapper;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.Conversation;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 会话解析：决定本轮对话是新建、恢复、过期恢复，还是因归属不符被拒绝
 *
 * <ul>
 *   <li>未提供 conversation_id：新建</li>
 *   <li>提供但不存在（或格式非法）：按新建处理，不让本轮失败</li>
 *   <li>存在但属于其他用户：CONVERSATION_NOT_OWNED，审计记录</li>
 *   <li>存在且归属正确：空闲超过 staleAfter 为 STALE，否则 RESUMED</li>
 * </ul>
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ConversationResolver {

  private final ConversationRepository conversationRepository;
  private final IsolationGuard isolationGuard;
  private final TurnProperties turnProperties;
  private final Clock clock;

  public ResolvedConversation resolve(UserContext user, String requestedConversationId) {
    if (!StringUtils.hasText(requestedConversationId)) {
      return create(user);
    }

    Optional<UUID> parsed = parseId(requestedConversationId);
    if (parsed.isEmpty()) {
      log.warn("Malformed conversation id from userId={}, starting a new conversation",
        user.getUserId());
      return create(user);
    }
    UUID conversationId = parsed.get();

    Optional<Conversation> owned =
      conversationRepository.findByIdAndUserId(conversationId, user.getUserId());
    if (owned.isPresent()) {
      return resumed(owned.get());
    }

    Optional<Conversation> foreign = conversationRepository.findById(conversationId);
    if (foreign.isPresent()) {
      // throws CONVERSATION_NOT_OWNED
      isolationGuard.assertOwner(user, foreign.get().getUserId(), conversationId.toString());
    }

    log.warn("Conversation {} not found for userId={}, starting a new conversation",
      conversationId, user.getUserId());
    return create(user);
  }

  /**
   * Persist an empty conversation owned by the caller.
   */
  public ResolvedConversation create(UserContext user) {
    OffsetDateTime now = ChatMessageMapper.toOffset(clock.instant());
    Conversation conversation = new Conversation();
    conversation.setId(UUID.randomUUID());
    conversation.setUserId(user.getUserId());
    conversation.setCreatedAt(now);
    conversation.setUpdatedAt(now);
    conversationRepository.save(conversation);
    log.info("Created conversation {} for userId={}", conversation.getId(), user.getUserId());

    return ResolvedConversation.builder()
      .conversationId(conversation.getId())
      .userId(user.getUserId())
      .state(ResolutionState.NEW)
      .createdAt(now.toInstant())
      .updatedAt(now.toInstant())
      .build();
  }

  /**
   * Strict lookup for read endpoints: a missing conversation is a 404 here, not a new one.
   */
  public Conversation requireOwned(UserContext user, String conversationId) {
    UUID id = parseId(conversationId)
      .orElseThrow(() -> new ConversationNotFoundException("Conversation not found"));
    Optional<Conversation> owned = conversationRepository.findByIdAndUserId(id, user.getUserId());
    if (owned.isPresent()) {
      return owned.get();
    }
    Conversation foreign = conversationRepository.findById(id)
      .orElseThrow(() -> new ConversationNotFoundException("Conversation not found"));
    isolationGuard.assertOwner(user, foreign.getUserId(), id.toString());
    return foreign;
  }

  private ResolvedConversation resumed(Conversation conversation) {
    Instant updatedAt = conversation.getUpdatedAt().toInstant();
    Duration idle = Duration.between(updatedAt, clock.instant());
    ResolutionState state = idle.compareTo(turnProperties.getStaleAfter()) > 0
      ? ResolutionState.STALE
      : ResolutionState.RESUMED;
    if (state == ResolutionState.STALE) {
      log.warn("Resuming stale conversation {} (idle {} days)", conversation.getId(),
        idle.toDays());
    }
    return ResolvedConversation.builder()
      .conversationId(conversation.getId())
      .userId(conversation.getUserId())
      .state(state)
      .createdAt(conversation.getCreatedAt().toInstant())
      .updatedAt(updatedAt)
      .build();
  }

  private static Optional<UUID> parseId(String value) {
    try {
      return Optional.of(UUID.fromString(value.trim()));
    } catch (IllegalArgumentException e) {
      return Optional.empty();
    }
  }
}
