package com.github.spud.sample.ai.taskchat.domain.tools;

import com.github.spud.sample.ai.taskchat.application.config.DispatcherProperties;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorClassifier.Classification;
import java.time.Duration;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * 工具调用重试策略：仅可重试的失败才会再次尝试，指数退避并封顶
 */
@Component
@RequiredArgsConstructor
public class RetryPolicy {

  private final DispatcherProperties properties;

  public int maxAttempts() {
    return Math.max(1, properties.getMaxAttempts());
  }

  /**
   * Whether another attempt may follow the failed attempt {@code attemptNumber} (1-based).
   */
  public boolean shouldRetry(Classification classification, int attemptNumber) {
    return classification.isRetryable() && attemptNumber < maxAttempts();
  }

  /**
   * Delay before attempt {@code nextAttempt}: initial, initial * factor, ... capped at the max.
   */
  public Duration backoffBefore(int nextAttempt) {
    if (nextAttempt <= 1) {
      return Duration.ZERO;
    }
    double factor = Math.pow(properties.getBackoffMultiplier(), nextAttempt - 2);
    long millis = Math.round(properties.getInitialBackoff().toMillis() * factor);
    long cap = properties.getMaxBackoff().toMillis();
    return Duration.ofMillis(Math.min(millis, cap));
  }
}
