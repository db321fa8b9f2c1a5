package com.github.spud.sample.ai.taskchat.domain.conversation;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;

@Getter
@Builder
public class PersistedTurn {

  private final UUID userMessageId;

  private final UUID assistantMessageId;

  private final List<UUID> toolInvocationIds;

  private final Instant userMessageAt;

  private final Instant assistantMessageAt;
}
