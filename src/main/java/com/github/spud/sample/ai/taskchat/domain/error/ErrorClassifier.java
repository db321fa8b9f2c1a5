package com.github.spud.sample.ai.taskchat.domain.error;

import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreException;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreTimeoutException;
import java.io.IOException;
import java.lang.reflect.UndeclaredThrowableException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.sql.SQLTransientConnectionException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import reactor.core.Exceptions;

/**
 * Central retry/surface decision table. Every component that catches a foreign exception asks
 * this class what it means instead of deciding locally.
 */
@Component
public class ErrorClassifier {

  /**
   * 工具调用失败分类：超时与连接失败可重试，校验与权限失败永不重试
   */
  public Classification classifyToolFailure(Throwable error) {
    Throwable root = unwrap(error);

    if (root instanceof ToolExecutionException toolError) {
      return Classification.of(toolError.getCode(), toolError.isTransientFailure());
    }
    if (root instanceof TaskChatException chatError) {
      return Classification.of(chatError.getCode(), false);
    }
    if (root instanceof TimeoutException
      || root instanceof SocketTimeoutException
      || root instanceof TaskStoreTimeoutException) {
      return Classification.of(ErrorCode.TOOL_TIMEOUT, true);
    }
    if (root instanceof TaskStoreException storeError) {
      return Classification.of(ErrorCode.TOOL_ERROR, storeError.isTransientFailure());
    }
    if (root instanceof ConnectException || hasCause(root, ConnectException.class)) {
      return Classification.of(ErrorCode.TOOL_ERROR, true);
    }
    if (root instanceof IOException) {
      return Classification.of(ErrorCode.TOOL_ERROR, true);
    }
    return Classification.of(ErrorCode.TOOL_ERROR, false);
  }

  /**
   * 持久化失败分类：仅连接类与瞬时事务失败允许在写入层有限重试
   */
  public Classification classifyPersistenceFailure(Throwable error) {
    Throwable root = unwrap(error);

    if (root instanceof TaskChatException chatError) {
      return Classification.of(chatError.getCode(),
        chatError.getCode().getRetryScope() == RetryScope.WRITE_LAYER);
    }
    if (root instanceof CannotCreateTransactionException
      || root instanceof DataAccessResourceFailureException
      || root instanceof SQLTransientConnectionException
      || hasCause(root, SQLTransientConnectionException.class)) {
      return Classification.of(ErrorCode.CONNECTION_FAILED, true);
    }
    if (root instanceof TransientDataAccessException) {
      return Classification.of(ErrorCode.TRANSACTION_FAILED, true);
    }
    return Classification.of(ErrorCode.TRANSACTION_FAILED, false);
  }

  /**
   * Strips executor, reactor and proxy wrappers.
   */
  public Throwable unwrap(Throwable error) {
    Throwable current = Exceptions.unwrap(error);
    while ((current instanceof CompletionException
      || current instanceof ExecutionException
      || current instanceof UndeclaredThrowableException)
      && current.getCause() != null) {
      current = Exceptions.unwrap(current.getCause());
    }
    return current;
  }

  private static boolean hasCause(Throwable error, Class<? extends Throwable> type) {
    Throwable cause = error.getCause();
    while (cause != null && cause != cause.getCause()) {
      if (type.isInstance(cause)) {
        return true;
      }
      cause = cause.getCause();
    }
    return false;
  }

  @Getter
  @ToString
  @AllArgsConstructor(staticName = "of")
  public static class Classification {

    private final ErrorCode code;
    private final boolean retryable;
  }
}
