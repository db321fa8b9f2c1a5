package com.github.spud.sample.ai.taskchat.infrastructure.observability;

import java.util.UUID;
import java.util.concurrent.Callable;
import org.slf4j.MDC;

/**
 * Trace id of the request being handled on the current thread, exposed to logs through the MDC.
 * Only the trace id lives here; the caller identity is always passed explicitly.
 */
public final class TraceContext {

  public static final String MDC_KEY = "traceId";

  private TraceContext() {
  }

  public static String newTraceId() {
    return UUID.randomUUID().toString();
  }

  public static String start() {
    return start(newTraceId());
  }

  public static String start(String traceId) {
    MDC.put(MDC_KEY, traceId);
    return traceId;
  }

  /**
   * 当前线程的 traceId，未设置时返回 null
   */
  public static String currentTraceId() {
    return MDC.get(MDC_KEY);
  }

  public static void clear() {
    MDC.remove(MDC_KEY);
  }

  /**
   * Run {@code work} with {@code traceId} in the MDC, restoring the previous value afterwards.
   */
  public static <T> T callWith(String traceId, Callable<T> work) throws Exception {
    String previous = currentTraceId();
    start(traceId);
    try {
      return work.call();
    } finally {
      if (previous != null) {
        MDC.put(MDC_KEY, previous);
      } else {
        clear();
      }
    }
  }
}
