package com.github.spud.sample.ai.taskchat.domain.error;

import static org.assertj.core.api.Assertions.assertThat;

import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier.Classification;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreException;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreTimeoutException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.TimeoutException;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;
import reactor.core.Exceptions;

class ErrorClassifierTest {

  private final ErrorClassifier classifier = new ErrorClassifier();

  @Test
  void timeoutsAreRetryableToolTimeouts() {
    assertTool(new TimeoutException("Did not observe any item"), ErrorCode.TOOL_TIMEOUT, true);
    assertTool(new SocketTimeoutException("read timed out"), ErrorCode.TOOL_TIMEOUT, true);
    assertTool(new TaskStoreTimeoutException("slow", null), ErrorCode.TOOL_TIMEOUT, true);
  }

  @Test
  void wrappedTimeoutIsUnwrapped() {
    Throwable wrapped = new CompletionException(Exceptions.propagate(new TimeoutException()));

    assertTool(wrapped, ErrorCode.TOOL_TIMEOUT, true);
  }

  @Test
  void toolExecutionExceptionCarriesItsOwnVerdict() {
    assertTool(new ToolExecutionException(ErrorCode.TOOL_TIMEOUT, "slow", true),
      ErrorCode.TOOL_TIMEOUT, true);
    assertTool(new ToolExecutionException(ErrorCode.TOOL_ERROR, "rejected", false),
      ErrorCode.TOOL_ERROR, false);
  }

  @Test
  void taskStoreFailuresFollowTheirTransientFlag() {
    assertTool(new TaskStoreException("503", true), ErrorCode.TOOL_ERROR, true);
    assertTool(new TaskStoreException("404", false), ErrorCode.TOOL_ERROR, false);
  }

  @Test
  void connectionFailuresAreRetryable() {
    assertTool(new ConnectException("refused"), ErrorCode.TOOL_ERROR, true);
    assertTool(new IllegalStateException("wrapper", new ConnectException("refused")),
      ErrorCode.TOOL_ERROR, true);
  }

  @Test
  void validationAndUnknownFailuresAreNeverRetried() {
    assertTool(new ValidationException(ErrorCode.INVALID_PARAMETERS, "bad"),
      ErrorCode.INVALID_PARAMETERS, false);
    assertTool(new IllegalArgumentException("boom"), ErrorCode.TOOL_ERROR, false);
  }

  @Test
  void persistenceConnectionFailuresAreRetryableAtWriteLayer() {
    Classification classification = classifier.classifyPersistenceFailure(
      new CannotCreateTransactionException("pool exhausted",
        new SQLTransientConnectionException("timeout")));

    assertThat(classification.getCode()).isEqualTo(ErrorCode.CONNECTION_FAILED);
    assertThat(classification.isRetryable()).isTrue();
  }

  @Test
  void transientDataAccessIsRetryableTransactionFailure() {
    Classification classification =
      classifier.classifyPersistenceFailure(new QueryTimeoutException("slow"));

    assertThat(classification.getCode()).isEqualTo(ErrorCode.TRANSACTION_FAILED);
    assertThat(classification.isRetryable()).isTrue();
  }

  @Test
  void integrityViolationIsNotRetried() {
    Classification classification = classifier.classifyPersistenceFailure(
      new DataIntegrityViolationException("fk"));

    assertThat(classification.getCode()).isEqualTo(ErrorCode.TRANSACTION_FAILED);
    assertThat(classification.isRetryable()).isFalse();
  }

  @Test
  void everyCodeHasHttpStatusAndDisclosure() {
    for (ErrorCode code : ErrorCode.values()) {
      assertThat(code.getHttpStatus()).as(code.name()).isNotNull();
      assertThat(code.getDisclosure()).as(code.name()).isNotBlank()
        .doesNotContainIgnoringCase("timeout")
        .doesNotContainIgnoringCase("exception");
    }
  }

  private void assertTool(Throwable error, ErrorCode code, boolean retryable) {
    Classification classification = classifier.classifyToolFailure(error);
    assertThat(classification.getCode()).as(error.toString()).isEqualTo(code);
    assertThat(classification.isRetryable()).as(error.toString()).isEqualTo(retryable);
  }
}
