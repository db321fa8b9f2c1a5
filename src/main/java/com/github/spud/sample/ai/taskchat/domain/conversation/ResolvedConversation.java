package com.github.spud.sample.ai.taskchat.domain.conversation;

import java.time.Instant;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString
public class ResolvedConversation {

  private final UUID conversationId;

  private final String userId;

  private final ResolutionState state;

  private final Instant createdAt;

  private final Instant updatedAt;

  public boolean isNew() {
    return state == ResolutionState.NEW;
  }

  public boolean isStale() {
    return state == ResolutionState.STALE;
  }
}
