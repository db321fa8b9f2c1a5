package com.github.spud.sample.ai.taskchat.interfaces.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.github.spud.sample.ai.taskchat.application.ConversationSummary;
import com.github.spud.sample.ai.taskchat.application.TurnCommand;
import com.github.spud.sample.ai.taskchat.application.TurnResult;
import com.github.spud.sample.ai.taskchat.application.TurnService;
import com.github.spud.sample.ai.taskchat.domain.context.AgentContext;
import com.github.spud.sample.ai.taskchat.domain.conversation.ResolvedConversation;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessage;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolCallRequest;
import com.github.spud.sample.ai.taskchat.infrastructure.observability.TraceContext;
import com.github.spud.sample.ai.taskchat.infrastructure.observability.TraceIdWebFilter;
import com.github.spud.sample.ai.taskchat.util.JsonUtils;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ServerWebExchange;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Task Chat API：对话轮次提交与会话查询
 *
 * <p>阻塞的轮次处理在 boundedElastic 上执行，traceId 由 {@link TraceIdWebFilter} 分配
 */
@Slf4j
@RestController
@RequestMapping("/api/{user_id}")
@RequiredArgsConstructor
public class ChatController {

  private final TurnService turnService;

  /**
   * 提交一次对话轮次
   */
  @PostMapping("/chat")
  public Mono<ResponseEntity<ChatResponse>> chat(@PathVariable("user_id") String userId,
    @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
    @RequestBody ChatRequest request, ServerWebExchange exchange) {
    return inTrace(exchange, () -> {
      TurnResult result = turnService.submitTurn(TurnCommand.builder()
        .pathUserId(userId)
        .authorization(authorization)
        .conversationId(request.getConversationId())
        .message(request.getMessage())
        .toolCalls(request.toToolCalls())
        .assistantReply(request.getAssistantReply())
        .build());
      return ResponseEntity.ok(ChatResponse.fromResult(result));
    });
  }

  /**
   * 创建空会话
   */
  @PostMapping("/conversations")
  public Mono<ResponseEntity<ConversationView>> createConversation(
    @PathVariable("user_id") String userId,
    @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
    ServerWebExchange exchange) {
    return inTrace(exchange, () -> {
      ResolvedConversation created = turnService.createConversation(authorization, userId);
      return ResponseEntity.status(HttpStatus.CREATED).body(ConversationView.fromResolved(created));
    });
  }

  /**
   * 最近更新的会话列表
   */
  @GetMapping("/conversations")
  public Mono<ResponseEntity<List<ConversationView>>> listConversations(
    @PathVariable("user_id") String userId,
    @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
    ServerWebExchange exchange) {
    return inTrace(exchange, () -> ResponseEntity.ok(
      turnService.listConversations(authorization, userId).stream()
        .map(ConversationView::fromSummary)
        .toList()));
  }

  @GetMapping("/conversations/{conversation_id}/messages")
  public Mono<ResponseEntity<List<MessageView>>> getMessages(
    @PathVariable("user_id") String userId,
    @PathVariable("conversation_id") String conversationId,
    @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
    ServerWebExchange exchange) {
    return inTrace(exchange, () -> ResponseEntity.ok(
      turnService.getMessages(authorization, userId, conversationId).stream()
        .map(MessageView::fromMessage)
        .toList()));
  }

  @GetMapping("/conversations/{conversation_id}/context")
  public Mono<ResponseEntity<ContextView>> getContext(
    @PathVariable("user_id") String userId,
    @PathVariable("conversation_id") String conversationId,
    @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
    ServerWebExchange exchange) {
    return inTrace(exchange, () -> ResponseEntity.ok(
      ContextView.fromContext(turnService.getContext(authorization, userId, conversationId))));
  }

  /**
   * 可用工具描述（名称、说明、JSON 入参 Schema），供外部推理步骤选择工具
   */
  @GetMapping("/tools")
  public Mono<ResponseEntity<List<ToolView>>> listTools(@PathVariable("user_id") String userId,
    @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
    ServerWebExchange exchange) {
    return inTrace(exchange, () -> ResponseEntity.ok(
      turnService.listTools(authorization, userId).stream()
        .map(ToolView::fromDefinition)
        .toList()));
  }

  private static <T> Mono<T> inTrace(ServerWebExchange exchange, Callable<T> work) {
    String traceId = TraceIdWebFilter.traceIdOf(exchange);
    return Mono.fromCallable(() -> TraceContext.callWith(traceId, work))
      .subscribeOn(Schedulers.boundedElastic());
  }

  private static String lower(Enum<?> value) {
    return value != null ? value.name().toLowerCase(Locale.ROOT) : null;
  }

  // ===== Request/Response DTOs =====

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ChatRequest {

    private String conversationId;
    private String message;
    private List<ToolCallDto> toolCalls;
    private String assistantReply;

    List<ToolCallRequest> toToolCalls() {
      List<ToolCallRequest> calls = new ArrayList<>();
      if (toolCalls == null) {
        return calls;
      }
      for (ToolCallDto dto : toolCalls) {
        calls.add(ToolCallRequest.builder()
          .name(dto.getName())
          .parameters(dto.getParameters() != null
            ? new LinkedHashMap<>(dto.getParameters())
            : new LinkedHashMap<>())
          .outputName(dto.getOutputName())
          .parallelSafe(Boolean.TRUE.equals(dto.getParallelSafe()))
          .build());
      }
      return calls;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ToolCallDto {

    private String name;
    private Map<String, Object> parameters;
    private String outputName;
    private Boolean parallelSafe;
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ChatResponse {

    private String conversationId;
    private String responseText;
    private List<ToolCallView> toolCalls;
    private String traceId;
    private Instant timestamp;
    private String status;
    private String conversationState;

    public static ChatResponse fromResult(TurnResult result) {
      ChatResponse resp = new ChatResponse();
      resp.setConversationId(result.getConversationId());
      resp.setResponseText(result.getResponseText());
      resp.setToolCalls(result.getToolCalls() == null ? List.of() : result.getToolCalls().stream()
        .map(ToolCallView::fromSummary)
        .toList());
      resp.setTraceId(result.getTraceId());
      resp.setTimestamp(result.getTimestamp());
      resp.setStatus(lower(result.getStatus()));
      resp.setConversationState(lower(result.getConversationState()));
      return resp;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ToolCallView {

    private String name;
    private String status;
    private String resultOrError;

    public static ToolCallView fromSummary(TurnResult.ToolCallSummary summary) {
      ToolCallView view = new ToolCallView();
      view.setName(summary.getName());
      view.setStatus(lower(summary.getStatus()));
      view.setResultOrError(summary.getResultOrError());
      return view;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ToolView {

    private String name;
    private String description;
    private JsonNode inputSchema;

    public static ToolView fromDefinition(ToolDefinition definition) {
      ToolView view = new ToolView();
      view.setName(definition.name());
      view.setDescription(definition.description());
      view.setInputSchema(JsonUtils.readTree(definition.inputSchema()));
      return view;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ConversationView {

    private String id;
    private Instant createdAt;
    private Instant updatedAt;
    private String firstMessage;
    private String lastMessage;
    private Long messageCount;

    public static ConversationView fromResolved(ResolvedConversation conversation) {
      ConversationView view = new ConversationView();
      view.setId(conversation.getConversationId().toString());
      view.setCreatedAt(conversation.getCreatedAt());
      view.setUpdatedAt(conversation.getUpdatedAt());
      view.setMessageCount(0L);
      return view;
    }

    public static ConversationView fromSummary(ConversationSummary summary) {
      ConversationView view = new ConversationView();
      view.setId(summary.getId());
      view.setCreatedAt(summary.getCreatedAt());
      view.setUpdatedAt(summary.getUpdatedAt());
      view.setFirstMessage(summary.getFirstMessage());
      view.setLastMessage(summary.getLastMessage());
      view.setMessageCount(summary.getMessageCount());
      return view;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class MessageView {

    private String id;
    private String conversationId;
    private String role;
    private String content;
    private List<String> toolCalls;
    private Instant createdAt;
    private boolean synthetic;

    public static MessageView fromMessage(ChatMessage message) {
      MessageView view = new MessageView();
      view.setId(message.getId() != null ? message.getId().toString() : null);
      view.setConversationId(message.getConversationId() != null
        ? message.getConversationId().toString() : null);
      view.setRole(lower(message.getRole()));
      view.setContent(message.getContent());
      view.setToolCalls(message.getToolCalls());
      view.setCreatedAt(message.getCreatedAt());
      view.setSynthetic(message.isSynthetic());
      return view;
    }
  }

  @Data
  @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
  public static class ContextView {

    private String conversationId;
    private List<MessageView> orderedMessages;
    private int droppedCount;
    private boolean summarized;
    private int estimatedTokens;

    public static ContextView fromContext(AgentContext context) {
      ContextView view = new ContextView();
      view.setConversationId(context.getConversationId() != null
        ? context.getConversationId().toString() : null);
      view.setOrderedMessages(context.getOrderedMessages().stream()
        .map(MessageView::fromMessage)
        .toList());
      view.setDroppedCount(context.getDroppedCount());
      view.setSummarized(context.isSummarized());
      view.setEstimatedTokens(context.getEstimatedTokens());
      return view;
    }
  }
}
