package com.github.spud.sample.ai.taskchat.domain.tools;

import com.github.spud.sample.ai.taskchat.application.config.DispatcherProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier.Classification;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.ValidationException;
import com.github.spud.sample.ai.taskchat.domain.isolation.IsolationGuard;
import com.github.spud.sample.ai.taskchat.domain.tools.OutputSlots.UnresolvedReferenceException;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolExecutionService.ToolExecutionResult;
import com.github.spud.sample.ai.taskchat.domain.tools.ToolRegistry.Registration;
import com.github.spud.sample.ai.taskchat.util.JsonUtils;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.stream.IntStream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Executes the ordered tool chain decided by the reasoning step.
 *
 * <p>Calls run sequentially. A maximal run of consecutive calls marked {@code parallelSafe} runs
 * concurrently unless one of them consumes an output produced inside the run. Each call is
 * validated, bound to the authenticated user, executed with a per-call timeout and retried while
 * the {@link ErrorClassifier} reports a transient failure. Every attempt is recorded. A failed
 * call either aborts the rest of the chain or lets it continue, per tool configuration.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ToolDispatcher {

  /**
   * Recorded in place of a missing or unusable tool name.
   */
  public static final String UNNAMED_TOOL = "<unnamed>";

  static final int MAX_TOOL_NAME_LENGTH = 100;

  private final ToolRegistry toolRegistry;
  private final ParameterValidator parameterValidator;
  private final ToolExecutionService executionService;
  private final RetryPolicy retryPolicy;
  private final ErrorClassifier errorClassifier;
  private final IsolationGuard isolationGuard;
  private final DispatcherProperties properties;
  private final Clock clock;

  public ChainExecutionResult dispatch(UserContext user, List<ToolCallRequest> calls,
    TurnDeadline deadline) {
    if (calls == null || calls.isEmpty()) {
      return ChainExecutionResult.empty();
    }
    // nothing runs if any call carries a caller-supplied identity
    isolationGuard.screenToolChain(user, calls);

    OutputSlots slots = new OutputSlots();
    CallOutcome[] outcomes = new CallOutcome[calls.size()];
    boolean aborted = false;
    boolean deadlineExceeded = false;
    int sequentialUntil = 0;

    int index = 0;
    while (index < calls.size()) {
      ToolCallRequest call = calls.get(index);
      if (aborted) {
        outcomes[index] = skipped(index, call, call.getParameters(), "chain aborted");
        index++;
        continue;
      }
      if (deadline.isExpired()) {
        deadlineExceeded = true;
        outcomes[index] = skipped(index, call, call.getParameters(), "turn deadline exceeded");
        index++;
        continue;
      }

      int runEnd = index + 1;
      if (index >= sequentialUntil && call.isParallelSafe()) {
        runEnd = parallelRunEnd(calls, index);
        if (runEnd - index > 1 && dependsWithinRun(calls, index, runEnd)) {
          sequentialUntil = runEnd;
          runEnd = index + 1;
        }
      }

      if (runEnd - index > 1) {
        log.debug("Executing calls {}..{} in parallel", index, runEnd - 1);
        for (CallOutcome outcome : executeParallel(user, calls, index, runEnd, slots, deadline)) {
          outcomes[outcome.result.getCallIndex()] = outcome;
        }
      } else {
        outcomes[index] = executeCall(user, index, call, slots, deadline);
      }

      for (int i = index; i < runEnd; i++) {
        CallResult result = outcomes[i].result;
        if (result.isSuccess()) {
          slots.bind(result.getSlotName(), result.getResultOrError());
        } else if (result.isFailed() && result.getChainPolicy() == ChainPolicy.ABORT_CHAIN) {
          log.warn("Tool {} failed with {}, aborting remaining calls", result.getToolName(),
            result.getErrorCode());
          aborted = true;
        }
      }
      index = runEnd;
    }

    ChainExecutionResult result = summarize(outcomes, deadlineExceeded);
    log.info("Tool chain finished: status={} calls={} failed={}", result.getOverallStatus(),
      calls.size(), result.getFailedToolNames());
    return result;
  }

  private CallOutcome executeCall(UserContext user, int index, ToolCallRequest call,
    OutputSlots slots, TurnDeadline deadline) {
    String toolName = call.getName();
    if (!isUsableName(toolName)) {
      return rejected(index, call, call.getParameters(), "Tool name is missing or too long");
    }

    Map<String, Object> resolved;
    try {
      resolved = slots.resolve(call.getParameters());
    } catch (UnresolvedReferenceException e) {
      return skipped(index, call, call.getParameters(), e.getMessage());
    }

    Optional<Registration> found = toolRegistry.find(toolName);
    if (found.isEmpty()) {
      return rejected(index, call, resolved, "Unknown tool " + toolName);
    }
    Registration registration = found.get();

    Object typed;
    try {
      typed = parameterValidator.validate(toolName, resolved, registration.getParametersType());
    } catch (ValidationException e) {
      return rejected(index, call, resolved, e.getMessage());
    }

    String arguments = JsonUtils.toToolJson(typed);
    Map<String, Object> parameters = JsonUtils.toMap(typed);
    String idempotencyKey = registration.isIdempotent() ? UUID.randomUUID().toString() : null;

    List<ToolInvocationRecord> records = new ArrayList<>();
    Classification classification;
    int attempt = 1;
    while (true) {
      ToolExecutionResult execution = executionService.execute(registration, arguments,
        user.getUserId(), idempotencyKey, properties.getCallTimeout());

      if (execution.isSuccess()) {
        records.add(record(index, toolName, parameters, attempt, InvocationStatus.SUCCESS,
          execution.getResult(), null, idempotencyKey, execution.getStartedAt(),
          execution.getCompletedAt()));
        return new CallOutcome(CallResult.builder()
          .callIndex(index)
          .toolName(toolName)
          .slotName(call.slotName())
          .status(InvocationStatus.SUCCESS)
          .resultOrError(execution.getResult())
          .attempts(attempt)
          .chainPolicy(policyFor(toolName))
          .build(), records);
      }

      classification = errorClassifier.classifyToolFailure(execution.getError());
      InvocationStatus status = classification.getCode() == ErrorCode.TOOL_TIMEOUT
        ? InvocationStatus.TIMEOUT
        : InvocationStatus.ERROR;
      records.add(record(index, toolName, parameters, attempt, status,
        describe(execution.getError()), classification.getCode(), idempotencyKey,
        execution.getStartedAt(), execution.getCompletedAt()));

      if (!retryPolicy.shouldRetry(classification, attempt)) {
        break;
      }
      Duration backoff = retryPolicy.backoffBefore(attempt + 1);
      if (deadline.remaining().compareTo(backoff) <= 0) {
        log.warn("Tool {} attempt {} failed with {}, no time left for a retry", toolName,
          attempt, classification.getCode());
        break;
      }
      log.warn("Tool {} attempt {} failed with {}, retrying in {}ms", toolName, attempt,
        classification.getCode(), backoff.toMillis());
      if (!pause(backoff)) {
        break;
      }
      attempt++;
    }

    return new CallOutcome(CallResult.builder()
      .callIndex(index)
      .toolName(toolName)
      .slotName(call.slotName())
      .status(InvocationStatus.ERROR)
      .resultOrError(records.get(records.size() - 1).getResultOrError())
      .errorCode(classification.getCode())
      .attempts(attempt)
      .chainPolicy(policyFor(toolName))
      .build(), records);
  }

  private List<CallOutcome> executeParallel(UserContext user, List<ToolCallRequest> calls,
    int start, int end, OutputSlots slots, TurnDeadline deadline) {
    return Flux.fromStream(IntStream.range(start, end).boxed())
      .flatMap(i -> Mono.fromCallable(() -> executeCall(user, i, calls.get(i), slots, deadline))
        .subscribeOn(Schedulers.boundedElastic()))
      .collectList()
      .block();
  }

  private static int parallelRunEnd(List<ToolCallRequest> calls, int start) {
    int end = start;
    while (end < calls.size() && calls.get(end).isParallelSafe()) {
      end++;
    }
    return end;
  }

  private static boolean dependsWithinRun(List<ToolCallRequest> calls, int start, int end) {
    Set<String> produced = new HashSet<>();
    for (int i = start; i < end; i++) {
      produced.add(calls.get(i).slotName());
    }
    for (int i = start; i < end; i++) {
      for (String slot : OutputSlots.referencedSlots(calls.get(i).getParameters())) {
        if (produced.contains(slot)) {
          return true;
        }
      }
    }
    return false;
  }

  private ChainExecutionResult summarize(CallOutcome[] outcomes, boolean deadlineExceeded) {
    List<CallResult> results = new ArrayList<>(outcomes.length);
    List<ToolInvocationRecord> records = new ArrayList<>();
    List<String> failedToolNames = new ArrayList<>();
    boolean allSucceeded = true;
    boolean abortedByFailure = false;

    for (CallOutcome outcome : outcomes) {
      CallResult result = outcome.result;
      results.add(result);
      records.addAll(outcome.records);
      if (!result.isSuccess()) {
        allSucceeded = false;
      }
      if (result.isFailed()) {
        failedToolNames.add(result.getToolName());
        if (result.getChainPolicy() == ChainPolicy.ABORT_CHAIN) {
          abortedByFailure = true;
        }
      }
    }

    ChainStatus status = allSucceeded
      ? ChainStatus.SUCCESS
      : abortedByFailure ? ChainStatus.ERROR : ChainStatus.PARTIAL;
    return ChainExecutionResult.builder()
      .perCallResults(results)
      .records(records)
      .overallStatus(status)
      .failedToolNames(failedToolNames)
      .deadlineExceeded(deadlineExceeded)
      .build();
  }

  /**
   * Validation failure: one error record, no execution.
   */
  private CallOutcome rejected(int index, ToolCallRequest call, Map<String, Object> parameters,
    String reason) {
    String toolName = recordedName(call);
    log.warn("Tool {} rejected: {}", toolName, reason);
    Instant now = clock.instant();
    ToolInvocationRecord record = record(index, toolName, parameters, 1,
      InvocationStatus.ERROR, reason, ErrorCode.INVALID_PARAMETERS, null, now, now);
    return new CallOutcome(CallResult.builder()
      .callIndex(index)
      .toolName(toolName)
      .slotName(call.slotName())
      .status(InvocationStatus.ERROR)
      .resultOrError(reason)
      .errorCode(ErrorCode.INVALID_PARAMETERS)
      .attempts(1)
      .chainPolicy(policyFor(toolName))
      .build(), List.of(record));
  }

  private CallOutcome skipped(int index, ToolCallRequest call, Map<String, Object> parameters,
    String reason) {
    String toolName = recordedName(call);
    log.debug("Tool {} skipped: {}", toolName, reason);
    Instant now = clock.instant();
    ToolInvocationRecord record = record(index, toolName, parameters, 0,
      InvocationStatus.SKIPPED, reason, null, null, now, now);
    return new CallOutcome(CallResult.builder()
      .callIndex(index)
      .toolName(toolName)
      .slotName(call.slotName())
      .status(InvocationStatus.SKIPPED)
      .resultOrError(reason)
      .attempts(0)
      .chainPolicy(policyFor(toolName))
      .build(), List.of(record));
  }

  private static boolean isUsableName(String toolName) {
    return StringUtils.hasText(toolName) && toolName.length() <= MAX_TOOL_NAME_LENGTH;
  }

  private static String recordedName(ToolCallRequest call) {
    return isUsableName(call.getName()) ? call.getName() : UNNAMED_TOOL;
  }

  private ChainPolicy policyFor(String toolName) {
    return properties.chainPolicyFor(toolName);
  }

  private static ToolInvocationRecord record(int index, String toolName,
    Map<String, Object> parameters, int attempt, InvocationStatus status, String resultOrError,
    ErrorCode errorCode, String idempotencyKey, Instant startedAt, Instant completedAt) {
    return ToolInvocationRecord.builder()
      .callIndex(index)
      .toolName(toolName)
      .parameters(parameters != null ? new LinkedHashMap<>(parameters) : Map.of())
      .attemptNumber(attempt)
      .status(status)
      .resultOrError(resultOrError)
      .errorCode(errorCode)
      .idempotencyKey(idempotencyKey)
      .startedAt(startedAt)
      .completedAt(completedAt)
      .build();
  }

  private static String describe(Throwable error) {
    if (error == null) {
      return "unknown error";
    }
    String message = error.getMessage();
    return error.getClass().getSimpleName() + (message != null ? ": " + message : "");
  }

  private static boolean pause(Duration backoff) {
    try {
      Thread.sleep(backoff.toMillis());
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Retry backoff interrupted");
      return false;
    }
  }

  static final class CallOutcome {

    private final CallResult result;
    private final List<ToolInvocationRecord> records;

    CallOutcome(CallResult result, List<ToolInvocationRecord> records) {
      this.result = result;
      this.records = records;
    }
  }
}
