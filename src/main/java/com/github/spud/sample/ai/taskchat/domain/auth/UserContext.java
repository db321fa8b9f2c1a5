package com.github.spud.sample.ai.taskchat.domain.auth;

import java.time.Instant;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Verified identity of the caller for exactly one request. Passed explicitly down the pipeline and
 * never stored.
 */
@Getter
@Builder
@ToString
public class UserContext {

  private final String userId;

  @ToString.Exclude
  private final String email;

  private final Instant issuedAt;

  private final Instant expiresAt;

  private final Instant authenticatedAt;
}
