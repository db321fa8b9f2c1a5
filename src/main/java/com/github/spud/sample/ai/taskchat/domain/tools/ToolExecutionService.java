package com.github.spud.sample.ai.taskchat.domain.tools;

import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.ToolExecutionException;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolRegistry.Registration;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * 工具执行服务：执行单次尝试，施加超时，统一捕获异常并返回结构化结果
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolExecutionService {

  /**
   * ToolContext 键：由调度器注入的已认证用户
   */
  public static final String USER_ID = "user_id";

  /**
   * ToolContext 键：同一次调用的所有重试共享的幂等键
   */
  public static final String IDEMPOTENCY_KEY = "idempotency_key";

  private final ErrorClassifier errorClassifier;
  private final Clock clock;

  /**
   * 执行一次工具调用尝试
   */
  public ToolExecutionResult execute(Registration registration, String arguments, String userId,
    String idempotencyKey, Duration timeout) {
    String toolName = registration.getDefinition().name();
    ToolContext toolContext = toolContext(userId, idempotencyKey);
    Instant startedAt = clock.instant();
    long startNanos = System.nanoTime();

    try {
      log.debug("Executing tool: {} for userId={}", toolName, userId);
      String result = Mono
        .fromCallable(() -> registration.getCallback().call(arguments, toolContext))
        .subscribeOn(Schedulers.boundedElastic())
        .timeout(timeout, Mono.error(() -> new ToolExecutionException(ErrorCode.TOOL_TIMEOUT,
          "Tool " + toolName + " exceeded " + timeout.toMillis() + "ms", true)))
        .block();

      long duration = (System.nanoTime() - startNanos) / 1_000_000;
      log.debug("Tool {} completed in {}ms", toolName, duration);

      return ToolExecutionResult.builder()
        .toolName(toolName)
        .arguments(arguments)
        .result(result)
        .success(true)
        .durationMs(duration)
        .startedAt(startedAt)
        .completedAt(clock.instant())
        .build();

    } catch (Exception e) {
      Throwable cause = errorClassifier.unwrap(e);
      long duration = (System.nanoTime() - startNanos) / 1_000_000;
      log.debug("Tool {} failed after {}ms: {}", toolName, duration, cause.toString());
      return ToolExecutionResult.builder()
        .toolName(toolName)
        .arguments(arguments)
        .success(false)
        .error(cause)
        .durationMs(duration)
        .startedAt(startedAt)
        .completedAt(clock.instant())
        .build();
    }
  }

  private static ToolContext toolContext(String userId, String idempotencyKey) {
    Map<String, Object> context = new HashMap<>();
    context.put(USER_ID, userId);
    if (idempotencyKey != null) {
      context.put(IDEMPOTENCY_KEY, idempotencyKey);
    }
    return new ToolContext(context);
  }

  @Data
  @Builder
  public static class ToolExecutionResult {

    private String toolName;
    private String arguments;
    private String result;
    private boolean success;
    private Throwable error;
    private long durationMs;
    private Instant startedAt;
    private Instant completedAt;
  }
}
