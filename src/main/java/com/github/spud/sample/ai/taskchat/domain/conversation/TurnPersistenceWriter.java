package com.github.spud.sample.ai.taskchat.domain.conversation;

import com.github.spud.sample.ai.taskchat.application.config.TurnProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier.Classification;
import com.github.spud.sample.ai.taskchat.domain.error.PersistenceException;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessageMapper;
import com.github.spud.sample.ai.taskchat.domain.message.MessageRole;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolInvocationRecord;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.Conversation;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ToolInvocation;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationMessageRepository;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationRepository;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ToolInvocationRepository;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 对话审计记录写入：用户消息、助手消息、全部工具调用记录以及会话 updated_at 在同一事务中提交
 *
 * <p>写入前对会话行加写锁。消息时间戳晚于会话内已有的最新消息且不早于会话创建时间，
 * 因此同一会话内 created_at 顺序与插入顺序一致。
 *
 * <p>任何一步失败整个事务回滚，不会留下只有用户消息的半截对话。连接类与瞬时事务失败在写入层有限重试，
 * 其余失败直接以 {@link PersistenceException} 抛出。工具对外部任务存储的副作用不在此事务内。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnPersistenceWriter {

  private final ConversationRepository conversationRepository;
  private final ConversationMessageRepository messageRepository;
  private final ToolInvocationRepository invocationRepository;
  private final TransactionTemplate transactionTemplate;
  private final ErrorClassifier errorClassifier;
  private final TurnProperties turnProperties;

  public PersistedTurn write(UserContext user, TurnRecord turn) {
    int maxAttempts = Math.max(1, turnProperties.getPersistence().getMaxAttempts());
    for (int attempt = 1; ; attempt++) {
      try {
        PersistedTurn persisted = transactionTemplate.execute(status -> writeOnce(user, turn));
        log.info("Persisted turn for conversation {}: {} tool invocation records",
          turn.getConversationId(), persisted.getToolInvocationIds().size());
        return persisted;
      } catch (RuntimeException e) {
        Classification classification = errorClassifier.classifyPersistenceFailure(e);
        if (!classification.isRetryable() || attempt >= maxAttempts) {
          log.error("Turn persistence failed for conversation {} after {} attempt(s) with {}",
            turn.getConversationId(), attempt, classification.getCode(), e);
          throw new PersistenceException(classification.getCode(),
            "Turn audit trail could not be written", e);
        }
        log.warn("Turn persistence attempt {} failed with {}, retrying", attempt,
          classification.getCode());
        pause(classification);
      }
    }
  }

  private PersistedTurn writeOnce(UserContext user, TurnRecord turn) {
    String userId = user.getUserId();
    UUID conversationId = turn.getConversationId();
    Conversation conversation = conversationRepository.lockOwned(conversationId, userId)
      .orElseThrow(() -> new IllegalStateException(
        "Conversation " + conversationId + " not owned by writer"));

    // under the lock no other turn of this conversation can commit in between
    Instant floor = notBefore(conversation);
    Instant userAt = latest(turn.getTurnStartedAt().truncatedTo(ChronoUnit.MICROS), floor);
    Instant assistantAt = latest(turn.getTurnCompletedAt().truncatedTo(ChronoUnit.MICROS),
      userAt.plus(1, ChronoUnit.MICROS));

    ConversationMessage userMessage = message(conversationId, userId, MessageRole.USER,
      turn.getUserContent(), userAt);
    messageRepository.save(userMessage);

    ConversationMessage assistantMessage = message(conversationId, userId, MessageRole.ASSISTANT,
      turn.getAssistantContent(), assistantAt);
    messageRepository.save(assistantMessage);

    List<ToolInvocation> invocations = new ArrayList<>();
    for (ToolInvocationRecord record : turn.getInvocations()) {
      invocations.add(invocation(conversationId, assistantMessage.getId(), userId, record));
    }
    invocationRepository.saveAll(invocations);

    List<UUID> invocationIds = invocations.stream().map(ToolInvocation::getId).toList();
    assistantMessage.setToolCalls(invocationIds.stream().map(UUID::toString).toList());

    // flushes the inserts above before the update
    conversationRepository.advanceUpdatedAt(conversationId, userId,
      ChatMessageMapper.toOffset(assistantAt));

    return PersistedTurn.builder()
      .userMessageId(userMessage.getId())
      .assistantMessageId(assistantMessage.getId())
      .toolInvocationIds(invocationIds)
      .userMessageAt(userAt)
      .assistantMessageAt(assistantAt)
      .build();
  }

  /**
   * Earliest timestamp a new message may carry: after the newest stored message and not before the
   * conversation itself.
   */
  private Instant notBefore(Conversation conversation) {
    Instant floor = ChatMessageMapper.toInstant(conversation.getCreatedAt());
    Optional<ConversationMessage> newest =
      messageRepository.findFirstByConversationIdAndUserIdOrderByCreatedAtDescSeqDesc(
        conversation.getId(), conversation.getUserId());
    if (newest.isPresent()) {
      Instant afterNewest = newest.get().getCreatedAt().toInstant().plus(1, ChronoUnit.MICROS);
      floor = floor != null ? latest(floor, afterNewest) : afterNewest;
    }
    return floor != null ? floor.truncatedTo(ChronoUnit.MICROS) : Instant.EPOCH;
  }

  private static Instant latest(Instant a, Instant b) {
    return a.isAfter(b) ? a : b;
  }

  private static ConversationMessage message(UUID conversationId, String userId, MessageRole role,
    String content, Instant createdAt) {
    ConversationMessage message = new ConversationMessage();
    message.setConversationId(conversationId);
    message.setUserId(userId);
    message.setRole(role);
    message.setContent(content != null ? content : "");
    message.setCreatedAt(ChatMessageMapper.toOffset(createdAt));
    return message;
  }

  private static ToolInvocation invocation(UUID conversationId, UUID messageId, String userId,
    ToolInvocationRecord record) {
    ToolInvocation invocation = new ToolInvocation();
    invocation.setConversationId(conversationId);
    invocation.setMessageId(messageId);
    invocation.setUserId(userId);
    invocation.setCallIndex(record.getCallIndex());
    invocation.setToolName(record.getToolName());
    invocation.setParameters(new LinkedHashMap<>(record.getParameters()));
    invocation.setAttemptNumber(record.getAttemptNumber());
    invocation.setStatus(record.getStatus());
    invocation.setResultOrError(record.getResultOrError());
    invocation.setErrorCode(record.getErrorCode() != null ? record.getErrorCode().name() : null);
    invocation.setIdempotencyKey(record.getIdempotencyKey());
    invocation.setStartedAt(ChatMessageMapper.toOffset(record.getStartedAt()));
    invocation.setCompletedAt(ChatMessageMapper.toOffset(record.getCompletedAt()));
    return invocation;
  }

  private void pause(Classification classification) {
    try {
      Thread.sleep(turnProperties.getPersistence().getBackoff().toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new PersistenceException(classification.getCode(),
        "Interrupted while retrying the turn audit trail write", e);
    }
  }
}
