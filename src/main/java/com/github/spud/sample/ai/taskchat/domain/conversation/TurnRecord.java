package com.github.spud.sample.ai.taskchat.domain.conversation;

import com.github.spud.sample.ai.taskchat.domain.tools.ToolInvocationRecord;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

/**
 * Everything one turn adds to the conversation audit trail.
 */
@Getter
@Builder
@ToString
public class TurnRecord {

  private final UUID conversationId;

  private final String userContent;

  @ToString.Exclude
  private final String assistantContent;

  private final Instant turnStartedAt;

  private final Instant turnCompletedAt;

  private final List<ToolInvocationRecord> invocations;
}
