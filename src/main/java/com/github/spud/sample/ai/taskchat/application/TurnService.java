package com.github.spud.sample.ai.taskchat.application;

import com.github.spud.sample.ai.taskchat.application.TurnResult.ToolCallSummary;
import com.github.spud.sample.ai.taskchat.application.config.TurnProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.RequestAuthenticator;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.context.AgentContext;
import com.github.spud.sample.ai.taskchat.domain.context.ContextAssembler;
import com.github.spud.sample.ai.taskchat.domain.conversation.ConversationResolver;
import com.github.spud.sample.ai.taskchat.domain.conversation.ResolvedConversation;
import com.github.spud.sample.ai.taskchat.domain.conversation.TurnPersistenceWriter;
import com.github.spud.sample.ai.taskchat.domain.conversation.TurnRecord;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.ValidationException;
import com.github.spud.sample.ai.taskchat.domain.isolation.IsolationGuard;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessage;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessageMapper;
import com.github.spud.sample.ai.taskchat.domain.tools.CallResult;
import com.github.spud.sample.ai.taskchat.domain.tools.ChainExecutionResult;
import com.github.spud.sample.ai.taskchat.domain.tools.InvocationStatus;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolCallRequest;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolDispatcher;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolRegistry;
import com.github.spud.sample.ai.taskchat.domain.tools.TurnDeadline;
import com.github.spud.sample.ai.taskchat.infrastructure.observability.TraceContext;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.Conversation;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationMessageRepository;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationRepository;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.data.domain.Limit;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * 对话轮次编排：认证 → 隔离校验 → 会话解析 → 上下文组装 → 规划 → 工具调度 → 持久化
 *
 * <p>服务本身无状态，所有跨请求状态都在数据库中；调用者身份以 {@link UserContext} 显式传递。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TurnService {

  static final int RECENT_CONVERSATIONS = 10;
  static final int PREVIEW_LENGTH = 50;

  private final RequestAuthenticator authenticator;
  private final IsolationGuard isolationGuard;
  private final TurnRateLimiter rateLimiter;
  private final ConversationResolver conversationResolver;
  private final ContextAssembler contextAssembler;
  private final TurnPlanner turnPlanner;
  private final ToolDispatcher toolDispatcher;
  private final ToolRegistry toolRegistry;
  private final ResponseComposer responseComposer;
  private final TurnPersistenceWriter persistenceWriter;
  private final ConversationRepository conversationRepository;
  private final ConversationMessageRepository messageRepository;
  private final ChatMessageMapper messageMapper;
  private final TurnProperties turnProperties;
  private final Clock clock;

  /**
   * 处理一次对话轮次
   */
  public TurnResult submitTurn(TurnCommand command) {
    boolean ownsTrace = TraceContext.currentTraceId() == null;
    String traceId = ownsTrace ? TraceContext.start() : TraceContext.currentTraceId();
    try {
      Instant startedAt = clock.instant();
      TurnDeadline deadline = TurnDeadline.after(turnProperties.getDeadline(), clock);

      UserContext user = authenticator.authenticate(command.getAuthorization(),
        command.getPathUserId());
      validateMessage(command.getMessage());
      rateLimiter.check(user);
      // reject impersonation before anything is created
      isolationGuard.screenToolChain(user, safeCalls(command.getToolCalls()));

      ResolvedConversation conversation = conversationResolver.resolve(user,
        command.getConversationId());
      log.info("Turn started: userId={} conversationId={} state={}", user.getUserId(),
        conversation.getConversationId(), conversation.getState());

      AgentContext context = conversation.isNew()
        ? AgentContext.empty(conversation.getConversationId())
        : contextAssembler.assemble(user, conversation.getConversationId());

      TurnPlan plan = turnPlanner.plan(user, command, context);
      ChainExecutionResult chain = toolDispatcher.dispatch(user, safeCalls(plan.getToolCalls()),
        deadline);
      String responseText = responseComposer.compose(plan, chain);

      persistenceWriter.write(user, TurnRecord.builder()
        .conversationId(conversation.getConversationId())
        .userContent(command.getMessage())
        .assistantContent(responseText)
        .turnStartedAt(startedAt)
        .turnCompletedAt(clock.instant())
        .invocations(chain.getRecords())
        .build());

      log.info("Turn finished: conversationId={} status={} toolCalls={}",
        conversation.getConversationId(), chain.getOverallStatus(),
        chain.getPerCallResults().size());

      return TurnResult.builder()
        .conversationId(conversation.getConversationId().toString())
        .responseText(responseText)
        .toolCalls(summarize(chain))
        .traceId(traceId)
        .timestamp(clock.instant())
        .status(chain.getOverallStatus())
        .conversationState(conversation.getState())
        .build();
    } finally {
      if (ownsTrace) {
        TraceContext.clear();
      }
    }
  }

  public ResolvedConversation createConversation(String authorization, String pathUserId) {
    UserContext user = authenticator.authenticate(authorization, pathUserId);
    return conversationResolver.create(user);
  }

  /**
   * The most recently updated conversations of the caller with message previews.
   */
  public List<ConversationSummary> listConversations(String authorization, String pathUserId) {
    UserContext user = authenticator.authenticate(authorization, pathUserId);
    String userId = user.getUserId();

    List<ConversationSummary> summaries = new ArrayList<>();
    for (Conversation conversation : conversationRepository.findByUserIdOrderByUpdatedAtDesc(
      userId, Limit.of(RECENT_CONVERSATIONS))) {
      UUID id = conversation.getId();
      Optional<ConversationMessage> first =
        messageRepository.findFirstByConversationIdAndUserIdOrderByCreatedAtAscSeqAsc(id, userId);
      Optional<ConversationMessage> last =
        messageRepository.findFirstByConversationIdAndUserIdOrderByCreatedAtDescSeqDesc(id, userId);
      summaries.add(ConversationSummary.builder()
        .id(id.toString())
        .createdAt(ChatMessageMapper.toInstant(conversation.getCreatedAt()))
        .updatedAt(ChatMessageMapper.toInstant(conversation.getUpdatedAt()))
        .firstMessage(first.map(m -> preview(m.getContent())).orElse(""))
        .lastMessage(last.map(m -> preview(m.getContent())).orElse(""))
        .messageCount(messageRepository.countByConversationIdAndUserId(id, userId))
        .build());
    }
    return summaries;
  }

  /**
   * Full history of one conversation, oldest first.
   */
  public List<ChatMessage> getMessages(String authorization, String pathUserId,
    String conversationId) {
    UserContext user = authenticator.authenticate(authorization, pathUserId);
    Conversation conversation = conversationResolver.requireOwned(user, conversationId);
    List<ConversationMessage> rows =
      messageRepository.findByConversationIdAndUserIdOrderByCreatedAtAscSeqAsc(
        conversation.getId(), user.getUserId());
    return isolationGuard.retainOwned(user, messageMapper.toDomainList(rows));
  }

  /**
   * The bounded context the reasoning step receives for the next turn.
   */
  public AgentContext getContext(String authorization, String pathUserId,
    String conversationId) {
    UserContext user = authenticator.authenticate(authorization, pathUserId);
    Conversation conversation = conversationResolver.requireOwned(user, conversationId);
    return contextAssembler.assemble(user, conversation.getId());
  }

  /**
   * Descriptors of every registered tool, for the external reasoning step.
   */
  public List<ToolDefinition> listTools(String authorization, String pathUserId) {
    authenticator.authenticate(authorization, pathUserId);
    return toolRegistry.getAllDefinitions();
  }

  private void validateMessage(String message) {
    if (!StringUtils.hasText(message)) {
      throw new ValidationException(ErrorCode.INVALID_MESSAGE, "Message is empty",
        Map.of("message", "must not be blank"));
    }
    int max = turnProperties.getMaxMessageLength();
    if (message.length() > max) {
      throw new ValidationException(ErrorCode.MESSAGE_TOO_LONG, "Message too long",
        Map.of("message", "must be at most " + max + " characters"));
    }
  }

  private static List<ToolCallRequest> safeCalls(List<ToolCallRequest> calls) {
    return calls != null ? calls : List.of();
  }

  private static List<ToolCallSummary> summarize(ChainExecutionResult chain) {
    List<ToolCallSummary> summaries = new ArrayList<>();
    for (CallResult result : chain.getPerCallResults()) {
      summaries.add(ToolCallSummary.builder()
        .name(result.getToolName())
        .status(result.getStatus())
        .resultOrError(result.getStatus() == InvocationStatus.SUCCESS
          ? result.getResultOrError()
          : disclosure(result))
        .build());
    }
    return summaries;
  }

  private static String disclosure(CallResult result) {
    if (result.getStatus() == InvocationStatus.SKIPPED) {
      return "Not attempted.";
    }
    ErrorCode code = result.getErrorCode() != null ? result.getErrorCode() : ErrorCode.TOOL_ERROR;
    return code.getDisclosure();
  }

  static String preview(String content) {
    if (content == null) {
      return "";
    }
    return content.length() > PREVIEW_LENGTH
      ? content.substring(0, PREVIEW_LENGTH) + "..."
      : content;
  }
}
