package com.github.spud.sample.ai.taskchat.application.config;

import java.time.Duration;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Per-turn limits: overall deadline, message size, staleness, rate limit and the bounded retry of
 * the audit-trail write.
 */
@Data
@Component
@ConfigurationProperties(prefix = "taskchat.turn")
public class TurnProperties {

  private Duration deadline = Duration.ofSeconds(30);

  private int maxMessageLength = 4000;

  /**
   * A resumed conversation idle for longer than this is reported as stale.
   */
  private Duration staleAfter = Duration.ofDays(30);

  private RateLimit rateLimit = new RateLimit();

  private Persistence persistence = new Persistence();

  @Data
  public static class RateLimit {

    private boolean enabled = true;

    private int maxTurns = 30;

    private Duration window = Duration.ofMinutes(1);
  }

  @Data
  public static class Persistence {

    private int maxAttempts = 3;

    private Duration backoff = Duration.ofMillis(50);
  }
}
