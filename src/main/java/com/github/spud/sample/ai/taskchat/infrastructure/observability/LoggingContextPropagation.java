package com.github.spud.sample.ai.taskchat.infrastructure.observability;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.util.Map;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import reactor.core.scheduler.Schedulers;

/**
 * Carries the MDC across Reactor thread switches so tool calls executed on scheduler threads log
 * with the trace id of the turn that scheduled them.
 */
@Component
public class LoggingContextPropagation {

  private static final String HOOK_KEY = "taskchat-mdc";

  @PostConstruct
  public void install() {
    Schedulers.onScheduleHook(HOOK_KEY, runnable -> {
      Map<String, String> captured = MDC.getCopyOfContextMap();
      return () -> {
        Map<String, String> previous = MDC.getCopyOfContextMap();
        try {
          if (captured != null) {
            MDC.setContextMap(captured);
          } else {
            MDC.clear();
          }
          runnable.run();
        } finally {
          if (previous != null) {
            MDC.setContextMap(previous);
          } else {
            MDC.clear();
          }
        }
      };
    });
  }

  @PreDestroy
  public void uninstall() {
    Schedulers.resetOnScheduleHook(HOOK_KEY);
  }
}
