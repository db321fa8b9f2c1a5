package com.github.spud.sample.ai.taskchat.domain.tools;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Request-level deadline. Calls that have not started when it passes are skipped and no retry
 * attempt starts after it; calls in flight run to completion or to their own timeout.
 */
public class TurnDeadline {

  private final Clock clock;
  private final Instant expiresAt;

  private TurnDeadline(Clock clock, Instant expiresAt) {
    this.clock = clock;
    this.expiresAt = expiresAt;
  }

  public static TurnDeadline after(Duration budget, Clock clock) {
    return new TurnDeadline(clock, clock.instant().plus(budget));
  }

  public boolean isExpired() {
    return !clock.instant().isBefore(expiresAt);
  }

  public Duration remaining() {
    Duration left = Duration.between(clock.instant(), expiresAt);
    return left.isNegative() ? Duration.ZERO : left;
  }

  public Instant getExpiresAt() {
    return expiresAt;
  }
}
