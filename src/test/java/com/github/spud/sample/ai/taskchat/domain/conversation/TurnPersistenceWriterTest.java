package com.github.spud.sample.ai.taskchat.domain.conversation;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.taskchat.application.config.TurnProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.PersistenceException;
import com.github.spud.sample.ai.taskchat.domain.message.MessageRole;
import com.github.spud.sample.ai.taskchat.domain.tools.InvocationStatus;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolInvocationRecord;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.Conversation;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ToolInvocation;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationMessageRepository;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationRepository;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ToolInvocationRepository;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.invocation.InvocationOnMock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * 轮次写入：单事务、失败回滚、写入层有限重试
 */
@ExtendWith(MockitoExtension.class)
class TurnPersistenceWriterTest {

  private static final Instant STARTED = Instant.parse("2026-04-01T09:00:00.123456789Z");

  @Mock
  private ConversationRepository conversationRepository;

  @Mock
  private ConversationMessageRepository messageRepository;

  @Mock
  private ToolInvocationRepository invocationRepository;

  @Mock
  private PlatformTransactionManager transactionManager;

  private TurnPersistenceWriter writer;

  private final UserContext alice = UserContext.builder().userId("alice").build();
  private final UUID conversationId = UUID.randomUUID();
  private final List<ConversationMessage> savedMessages = new ArrayList<>();

  private Conversation conversation;

  @BeforeEach
  void setUp() {
    TurnProperties properties = new TurnProperties();
    properties.getPersistence().setMaxAttempts(3);
    properties.getPersistence().setBackoff(Duration.ofMillis(1));
    writer = new TurnPersistenceWriter(conversationRepository, messageRepository,
      invocationRepository, new TransactionTemplate(transactionManager), new ErrorClassifier(),
      properties);

    lenient().when(transactionManager.getTransaction(any()))
      .thenAnswer(inv -> new SimpleTransactionStatus());
    conversation = new Conversation();
    conversation.setId(conversationId);
    conversation.setUserId("alice");
    conversation.setCreatedAt(STARTED.minusSeconds(60).atOffset(ZoneOffset.UTC));
    lenient().when(conversationRepository.lockOwned(conversationId, "alice"))
      .thenReturn(Optional.of(conversation));
    lenient().when(messageRepository.findFirstByConversationIdAndUserIdOrderByCreatedAtDescSeqDesc(
        conversationId, "alice"))
      .thenAnswer(inv -> savedMessages.isEmpty()
        ? Optional.empty()
        : Optional.of(savedMessages.get(savedMessages.size() - 1)));
    lenient().when(messageRepository.save(any(ConversationMessage.class)))
      .thenAnswer(this::assignMessageId);
    lenient().when(invocationRepository.saveAll(anyList()))
      .thenAnswer(TurnPersistenceWriterTest::assignInvocationIds);
  }

  @Test
  void shouldWriteBothMessagesAndEveryAttemptInOneTransaction() {
    TurnRecord turn = turn(STARTED, STARTED.plusMillis(350), List.of(
      record(0, 1, InvocationStatus.TIMEOUT),
      record(0, 2, InvocationStatus.SUCCESS)));

    PersistedTurn persisted = writer.write(alice, turn);

    assertThat(savedMessages).extracting(ConversationMessage::getRole)
      .containsExactly(MessageRole.USER, MessageRole.ASSISTANT);
    ConversationMessage assistant = savedMessages.get(1);
    assertThat(assistant.getToolCalls()).hasSize(2)
      .containsExactlyElementsOf(persisted.getToolInvocationIds().stream()
        .map(UUID::toString).toList());

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<ToolInvocation>> invocations = ArgumentCaptor.forClass(List.class);
    verify(invocationRepository).saveAll(invocations.capture());
    assertThat(invocations.getValue())
      .allSatisfy(invocation -> {
        assertThat(invocation.getMessageId()).isEqualTo(assistant.getId());
        assertThat(invocation.getUserId()).isEqualTo("alice");
        assertThat(invocation.getConversationId()).isEqualTo(conversationId);
      })
      .extracting(ToolInvocation::getAttemptNumber).containsExactly(1, 2);

    verify(conversationRepository).advanceUpdatedAt(eq(conversationId), eq("alice"),
      any(OffsetDateTime.class));
    verify(transactionManager).commit(any());
    verify(transactionManager, never()).rollback(any());
  }

  @Test
  void assistantMessageIsStrictlyAfterUserMessage() {
    PersistedTurn persisted = writer.write(alice, turn(STARTED, STARTED, List.of()));

    assertThat(persisted.getAssistantMessageAt()).isAfter(persisted.getUserMessageAt());
    assertThat(savedMessages.get(1).getCreatedAt())
      .isAfter(savedMessages.get(0).getCreatedAt());
  }

  @Test
  void turnWrittenLaterIsNeverDatedBeforeStoredMessages() {
    writer.write(alice, turn(STARTED, STARTED.plusSeconds(10), List.of()));
    // started while the first turn was still running, written after it
    writer.write(alice, turn(STARTED.plusSeconds(5), STARTED.plusSeconds(6), List.of()));

    assertThat(savedMessages).extracting(ConversationMessage::getCreatedAt)
      .isSortedAccordingTo(Comparator.naturalOrder())
      .doesNotHaveDuplicates();
    assertThat(savedMessages.get(2).getCreatedAt())
      .isAfter(savedMessages.get(1).getCreatedAt());
    verify(conversationRepository, times(2)).lockOwned(conversationId, "alice");
  }

  @Test
  void turnTimesAreKeptWhenNothingNewerIsStored() {
    PersistedTurn persisted = writer.write(alice, turn(STARTED, STARTED.plusSeconds(2),
      List.of()));

    assertThat(persisted.getUserMessageAt()).isEqualTo(STARTED.truncatedTo(ChronoUnit.MICROS));
    assertThat(persisted.getAssistantMessageAt())
      .isEqualTo(STARTED.plusSeconds(2).truncatedTo(ChronoUnit.MICROS));
  }

  @Test
  void firstMessageIsNotDatedBeforeItsConversation() {
    Instant conversationCreated = STARTED.plusMillis(3).truncatedTo(ChronoUnit.MICROS);
    conversation.setCreatedAt(conversationCreated.atOffset(ZoneOffset.UTC));

    PersistedTurn persisted = writer.write(alice, turn(STARTED, STARTED.plusSeconds(1),
      List.of()));

    assertThat(persisted.getUserMessageAt()).isEqualTo(conversationCreated);
    assertThat(persisted.getAssistantMessageAt()).isAfter(conversationCreated);
  }

  @Test
  void transientConnectionFailureIsRetried() {
    when(messageRepository.save(any(ConversationMessage.class)))
      .thenThrow(new CannotCreateTransactionException("pool exhausted"))
      .thenAnswer(this::assignMessageId);

    PersistedTurn persisted = writer.write(alice, turn(STARTED, STARTED.plusSeconds(1),
      List.of()));

    assertThat(persisted.getUserMessageId()).isNotNull();
    verify(transactionManager, times(1)).rollback(any());
    verify(transactionManager, times(1)).commit(any());
  }

  @Test
  void permanentFailureRollsBackWithoutRetry() {
    when(invocationRepository.saveAll(anyList()))
      .thenThrow(new DataIntegrityViolationException("fk violation"));

    assertThatThrownBy(() -> writer.write(alice, turn(STARTED, STARTED.plusSeconds(1),
      List.of(record(0, 1, InvocationStatus.SUCCESS)))))
      .isInstanceOf(PersistenceException.class)
      .hasFieldOrPropertyWithValue("code", ErrorCode.TRANSACTION_FAILED);

    verify(transactionManager, times(1)).getTransaction(any());
    verify(transactionManager).rollback(any());
    verify(transactionManager, never()).commit(any());
  }

  @Test
  void retriesAreBounded() {
    when(messageRepository.save(any(ConversationMessage.class)))
      .thenThrow(new CannotCreateTransactionException("database down"));

    assertThatThrownBy(() -> writer.write(alice, turn(STARTED, STARTED.plusSeconds(1),
      List.of())))
      .isInstanceOf(PersistenceException.class)
      .hasFieldOrPropertyWithValue("code", ErrorCode.CONNECTION_FAILED);

    verify(transactionManager, times(3)).getTransaction(any());
    verify(transactionManager, times(3)).rollback(any());
  }

  @Test
  void refusesConversationOfAnotherUser() {
    UserContext bob = UserContext.builder().userId("bob").build();
    when(conversationRepository.lockOwned(conversationId, "bob"))
      .thenReturn(Optional.empty());

    assertThatThrownBy(() -> writer.write(bob, turn(STARTED, STARTED.plusSeconds(1), List.of())))
      .isInstanceOf(PersistenceException.class);

    verify(messageRepository, never()).save(any());
  }

  private TurnRecord turn(Instant startedAt, Instant completedAt,
    List<ToolInvocationRecord> invocations) {
    return TurnRecord.builder()
      .conversationId(conversationId)
      .userContent("Add buy milk")
      .assistantContent("The task was added.")
      .turnStartedAt(startedAt)
      .turnCompletedAt(completedAt)
      .invocations(invocations)
      .build();
  }

  private static ToolInvocationRecord record(int callIndex, int attempt, InvocationStatus status) {
    return ToolInvocationRecord.builder()
      .callIndex(callIndex)
      .toolName("add_task")
      .parameters(Map.of("title", "buy milk"))
      .attemptNumber(attempt)
      .status(status)
      .resultOrError(status == InvocationStatus.SUCCESS ? "{\"success\":true}" : "timed out")
      .errorCode(status == InvocationStatus.TIMEOUT ? ErrorCode.TOOL_TIMEOUT : null)
      .idempotencyKey("key-1")
      .startedAt(STARTED)
      .completedAt(STARTED.plusMillis(100))
      .build();
  }

  private ConversationMessage assignMessageId(InvocationOnMock invocation) {
    ConversationMessage message = invocation.getArgument(0);
    message.setId(UUID.randomUUID());
    savedMessages.add(message);
    return message;
  }

  private static List<ToolInvocation> assignInvocationIds(InvocationOnMock invocation) {
    List<ToolInvocation> invocations = invocation.getArgument(0);
    invocations.forEach(i -> i.setId(UUID.randomUUID()));
    return invocations;
  }
}
