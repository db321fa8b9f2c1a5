package com.github.spud.sample.ai.taskchat.domain.tools;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.spud.sample.ai.taskchat.application.config.DispatcherProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.AuthorizationException;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.isolation.IsolationGuard;
import com.github.spud.sample.ai.taskchat.domain.isolation.SecurityAuditEvent;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolRegistry.Registration;
import com.github.spud.sample.ai.taskchat.domain.tools.task.AddTaskParams;
import com.github.spud.sample.ai.taskchat.domain.tools.task.ListTasksParams;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskOperation;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreException;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreTimeoutException;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskToolsConfig;
import com.github.spud.sample.ai.taskchat.support.InMemoryTaskStore;
import com.github.spud.sample.ai.taskchat.support.MutableClock;
import jakarta.validation.Validation;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.ai.chat.model.ToolContext;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.DefaultToolDefinition;
import org.springframework.ai.tool.definition.ToolDefinition;

/**
 * 工具链调度：重试、链策略、输出引用、校验、截止时间与并行
 */
class ToolDispatcherTest {

  private final UserContext alice = UserContext.builder().userId("alice").build();
  private final List<SecurityAuditEvent> auditEvents = new ArrayList<>();

  private MutableClock clock;
  private InMemoryTaskStore store;
  private ToolRegistry registry;
  private DispatcherProperties properties;
  private ToolDispatcher dispatcher;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-02-01T08:00:00Z"));
    store = new InMemoryTaskStore();
    registry = new ToolRegistry();
    new TaskToolsConfig(registry, store).registerTaskTools();

    properties = new DispatcherProperties();
    properties.setCallTimeout(Duration.ofSeconds(2));
    properties.setMaxAttempts(3);
    properties.setInitialBackoff(Duration.ofMillis(1));
    properties.setMaxBackoff(Duration.ofMillis(5));

    ErrorClassifier classifier = new ErrorClassifier();
    dispatcher = new ToolDispatcher(registry,
      new ParameterValidator(Validation.buildDefaultValidatorFactory().getValidator()),
      new ToolExecutionService(classifier, clock),
      new RetryPolicy(properties),
      classifier,
      new IsolationGuard(auditEvents::add, clock),
      properties,
      clock);
  }

  @Test
  @DisplayName("Timed out twice, succeeds on the third attempt")
  void timeoutTwiceThenSuccess() {
    store.failNext(TaskOperation.ADD, 2, () -> new TaskStoreTimeoutException("slow", null));

    ChainExecutionResult result = dispatcher.dispatch(alice,
      List.of(call("add_task", Map.of("title", "buy milk"))), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.SUCCESS);
    assertThat(result.getRecords()).extracting(ToolInvocationRecord::getStatus)
      .containsExactly(InvocationStatus.TIMEOUT, InvocationStatus.TIMEOUT,
        InvocationStatus.SUCCESS);
    assertThat(result.getRecords()).extracting(ToolInvocationRecord::getAttemptNumber)
      .containsExactly(1, 2, 3);
    assertThat(result.getRecords()).extracting(ToolInvocationRecord::getErrorCode)
      .containsExactly(ErrorCode.TOOL_TIMEOUT, ErrorCode.TOOL_TIMEOUT, null);
    assertThat(store.getSideEffects()).isEqualTo(1);
    assertThat(store.tasksOf("alice")).hasSize(1);
  }

  @Test
  void retriesReuseTheIdempotencyKeySoSideEffectHappensOnce() {
    store.loseNextResponse(TaskOperation.ADD);

    ChainExecutionResult result = dispatcher.dispatch(alice,
      List.of(call("add_task", Map.of("title", "buy milk"))), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.SUCCESS);
    assertThat(result.getRecords()).hasSize(2);
    assertThat(store.getReceivedKeys()).hasSize(2).doesNotContainNull();
    assertThat(store.getReceivedKeys().get(0)).isEqualTo(store.getReceivedKeys().get(1));
    assertThat(result.getRecords()).extracting(ToolInvocationRecord::getIdempotencyKey)
      .containsOnly(store.getReceivedKeys().get(0));
    assertThat(store.getSideEffects()).isEqualTo(1);
  }

  @Test
  void readOnlyToolGetsNoIdempotencyKey() {
    ChainExecutionResult result = dispatcher.dispatch(alice,
      List.of(call("list_tasks", Map.of())), deadline());

    assertThat(result.getRecords()).singleElement()
      .extracting(ToolInvocationRecord::getIdempotencyKey).isNull();
  }

  @Test
  @DisplayName("Exhausted retries continue the chain by default")
  void exhaustedRetriesContinueWithPartialResult() {
    store.failNext(TaskOperation.ADD, 3, () -> new TaskStoreTimeoutException("slow", null));

    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      call("add_task", Map.of("title", "buy milk")),
      call("list_tasks", Map.of())), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.PARTIAL);
    assertThat(result.getFailedToolNames()).containsExactly("add_task");
    assertThat(result.getPerCallResults()).extracting(CallResult::getStatus)
      .containsExactly(InvocationStatus.ERROR, InvocationStatus.SUCCESS);
    assertThat(result.getPerCallResults().get(0).getAttempts()).isEqualTo(3);
    assertThat(result.getPerCallResults().get(0).getErrorCode())
      .isEqualTo(ErrorCode.TOOL_TIMEOUT);
    assertThat(result.getRecords()).hasSize(4);
  }

  @Test
  @DisplayName("Exhausted retries abort the chain for a critical tool")
  void exhaustedRetriesAbortForCriticalTool() {
    DispatcherProperties.ToolSettings critical = new DispatcherProperties.ToolSettings();
    critical.setChainPolicy(ChainPolicy.ABORT_CHAIN);
    properties.getTools().put("add_task", critical);
    store.failNext(TaskOperation.ADD, 3, () -> new TaskStoreTimeoutException("slow", null));

    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      call("add_task", Map.of("title", "buy milk")),
      call("list_tasks", Map.of())), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.ERROR);
    assertThat(result.getPerCallResults()).extracting(CallResult::getStatus)
      .containsExactly(InvocationStatus.ERROR, InvocationStatus.SKIPPED);
    ToolInvocationRecord skipped = result.getRecords().get(result.getRecords().size() - 1);
    assertThat(skipped.getStatus()).isEqualTo(InvocationStatus.SKIPPED);
    assertThat(skipped.getAttemptNumber()).isZero();
    assertThat(store.getCalls()).isEqualTo(3);
  }

  @Test
  void permanentStoreFailureIsNotRetried() {
    store.failNext(TaskOperation.COMPLETE, 1, () -> new TaskStoreException("Task not found",
      false));

    ChainExecutionResult result = dispatcher.dispatch(alice,
      List.of(call("complete_task", Map.of("task_identifier", "42"))), deadline());

    assertThat(result.getRecords()).singleElement()
      .satisfies(record -> {
        assertThat(record.getStatus()).isEqualTo(InvocationStatus.ERROR);
        assertThat(record.getErrorCode()).isEqualTo(ErrorCode.TOOL_ERROR);
      });
    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.PARTIAL);
  }

  @Test
  void invalidParametersAreRejectedWithoutExecution() {
    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      call("add_task", Map.of("title", "")),
      call("add_task", Map.of("title", "x", "colour", "red")),
      call("add_task", Map.of("title", "x", "priority", "urgent")),
      call("send_email", Map.of("to", "someone"))), deadline());

    assertThat(result.getRecords()).hasSize(4)
      .allSatisfy(record -> {
        assertThat(record.getStatus()).isEqualTo(InvocationStatus.ERROR);
        assertThat(record.getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS);
        assertThat(record.getAttemptNumber()).isEqualTo(1);
      });
    assertThat(store.getCalls()).isZero();
  }

  @Test
  @DisplayName("Missing, blank or oversized tool names are rejected under a placeholder name")
  void unusableToolNamesAreRejectedAndStillRecorded() {
    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      call(null, Map.of("title", "x")),
      call("  ", Map.of("title", "x")),
      call("a".repeat(ToolDispatcher.MAX_TOOL_NAME_LENGTH + 1), Map.of("title", "x")),
      call("add_task", Map.of("title", "still runs"))), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.PARTIAL);
    assertThat(result.getRecords()).hasSize(4);
    assertThat(result.getRecords().subList(0, 3)).allSatisfy(record -> {
      assertThat(record.getToolName()).isEqualTo(ToolDispatcher.UNNAMED_TOOL);
      assertThat(record.getStatus()).isEqualTo(InvocationStatus.ERROR);
      assertThat(record.getErrorCode()).isEqualTo(ErrorCode.INVALID_PARAMETERS);
      assertThat(record.getAttemptNumber()).isEqualTo(1);
    });
    assertThat(result.getPerCallResults()).extracting(CallResult::getToolName)
      .containsExactly(ToolDispatcher.UNNAMED_TOOL, ToolDispatcher.UNNAMED_TOOL,
        ToolDispatcher.UNNAMED_TOOL, "add_task");
    assertThat(result.getFailedToolNames()).doesNotContainNull();
    assertThat(store.tasksOf("alice")).hasSize(1);
  }

  @Test
  void laterCallConsumesEarlierOutput() {
    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      ToolCallRequest.builder()
        .name("add_task")
        .parameters(params(Map.of("title", "buy milk")))
        .outputName("created")
        .build(),
      call("complete_task", Map.of("task_identifier", "${created.task.id}"))), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.SUCCESS);
    ToolInvocationRecord complete = result.getRecords().get(1);
    assertThat(complete.getParameters()).containsEntry("task_identifier", "1");
    assertThat(store.tasksOf("alice").get(0)).containsEntry("completed", true);
  }

  @Test
  void referenceToFailedCallIsSkipped() {
    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      call("add_task", Map.of("title", "")),
      call("complete_task", Map.of("task_identifier", "${add_task.task.id}"))), deadline());

    assertThat(result.getPerCallResults()).extracting(CallResult::getStatus)
      .containsExactly(InvocationStatus.ERROR, InvocationStatus.SKIPPED);
    assertThat(result.getRecords().get(1).getAttemptNumber()).isZero();
    assertThat(store.getCalls()).isZero();
  }

  @Test
  void expiredDeadlineSkipsEverything() {
    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      call("add_task", Map.of("title", "buy milk")),
      call("list_tasks", Map.of())), TurnDeadline.after(Duration.ZERO, clock));

    assertThat(result.isDeadlineExceeded()).isTrue();
    assertThat(result.getPerCallResults()).extracting(CallResult::getStatus)
      .containsOnly(InvocationStatus.SKIPPED);
    assertThat(store.getCalls()).isZero();
  }

  @Test
  void noRetryStartsAfterTheDeadline() {
    store.failNext(TaskOperation.ADD, 3, () -> {
      clock.advance(Duration.ofMinutes(1));
      return new TaskStoreTimeoutException("slow", null);
    });

    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      call("add_task", Map.of("title", "buy milk")),
      call("list_tasks", Map.of())), deadline());

    assertThat(result.getPerCallResults().get(0).getAttempts()).isEqualTo(1);
    assertThat(result.getPerCallResults()).extracting(CallResult::getStatus)
      .containsExactly(InvocationStatus.ERROR, InvocationStatus.SKIPPED);
    assertThat(result.isDeadlineExceeded()).isTrue();
    assertThat(store.getCalls()).isEqualTo(1);
  }

  @Test
  void parallelSafeRunExecutesEveryCallAndKeepsOrder() {
    store.execute("alice", TaskOperation.ADD, AddTaskParams.builder().title("seed").build(),
      null);

    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      parallel("list_tasks", "all", Map.of("status", "all")),
      parallel("list_tasks", "pending", Map.of("status", "pending")),
      parallel("list_tasks", "done", Map.of("status", "completed"))), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.SUCCESS);
    assertThat(result.getPerCallResults()).extracting(CallResult::getCallIndex)
      .containsExactly(0, 1, 2);
    assertThat(result.getRecords()).extracting(ToolInvocationRecord::getCallIndex)
      .containsExactly(0, 1, 2);
  }

  @Test
  void dependentCallsInsideParallelRunStillSeeEarlierOutput() {
    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(
      parallel("add_task", "created", Map.of("title", "buy milk")),
      parallel("complete_task", "completed", Map.of("task_identifier", "${created.task.id}"))),
      deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.SUCCESS);
    assertThat(store.tasksOf("alice").get(0)).containsEntry("completed", true);
  }

  @Test
  void toolReceivesAuthenticatedUserOnly() {
    dispatcher.dispatch(alice, List.of(
      call("add_task", Map.of("title", "a")),
      call("list_tasks", Map.of())), deadline());

    assertThat(store.getReceivedUserIds()).containsOnly("alice");
  }

  @Test
  void callerSuppliedIdentityRejectsWholeChainBeforeExecution() {
    assertThatThrownBy(() -> dispatcher.dispatch(alice, List.of(
      call("list_tasks", Map.of()),
      call("add_task", Map.of("title", "x", "user_id", "bob"))), deadline()))
      .isInstanceOf(AuthorizationException.class)
      .hasFieldOrPropertyWithValue("code", ErrorCode.CROSS_USER_ACCESS);

    assertThat(store.getCalls()).isZero();
    assertThat(auditEvents).singleElement()
      .extracting(SecurityAuditEvent::getCode).isEqualTo(ErrorCode.CROSS_USER_ACCESS);
  }

  @Test
  void slowToolIsCutOffByCallTimeout() {
    properties.setCallTimeout(Duration.ofMillis(50));
    registry.register(slowTool());

    ChainExecutionResult result = dispatcher.dispatch(alice,
      List.of(call("slow_tool", Map.of())), deadline());

    assertThat(result.getRecords()).hasSize(3)
      .extracting(ToolInvocationRecord::getStatus).containsOnly(InvocationStatus.TIMEOUT);
    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.PARTIAL);
  }

  @Test
  void emptyChainSucceeds() {
    ChainExecutionResult result = dispatcher.dispatch(alice, List.of(), deadline());

    assertThat(result.getOverallStatus()).isEqualTo(ChainStatus.SUCCESS);
    assertThat(result.getRecords()).isEmpty();
  }

  private TurnDeadline deadline() {
    return TurnDeadline.after(Duration.ofSeconds(30), clock);
  }

  private static ToolCallRequest call(String name, Map<String, Object> parameters) {
    return ToolCallRequest.builder().name(name).parameters(params(parameters)).build();
  }

  private static ToolCallRequest parallel(String name, String outputName,
    Map<String, Object> parameters) {
    return ToolCallRequest.builder()
      .name(name)
      .parameters(params(parameters))
      .outputName(outputName)
      .parallelSafe(true)
      .build();
  }

  private static Map<String, Object> params(Map<String, Object> parameters) {
    return new LinkedHashMap<>(parameters);
  }

  private static Registration slowTool() {
    ToolDefinition definition = DefaultToolDefinition.builder()
      .name("slow_tool")
      .description("Never answers in time")
      .inputSchema("{\"type\": \"object\"}")
      .build();
    ToolCallback callback = new ToolCallback() {
      @Override
      public ToolDefinition getToolDefinition() {
        return definition;
      }

      @Override
      public String call(String toolInput) {
        return call(toolInput, null);
      }

      @Override
      public String call(String toolInput, ToolContext toolContext) {
        try {
          Thread.sleep(500);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        }
        return "{}";
      }
    };
    return Registration.builder()
      .definition(definition)
      .callback(callback)
      .parametersType(ListTasksParams.class)
      .readOnly(true)
      .build();
  }
}
