package com.github.spud.sample.ai.taskchat.application;

import com.github.spud.sample.ai.taskchat.domain.tools.ToolCallRequest;
import java.util.List;
import lombok.Builder;
import lombok.Getter;

/**
 * What the reasoning step decided for this turn.
 */
@Getter
@Builder
public class TurnPlan {

  @Builder.Default
  private final List<ToolCallRequest> toolCalls = List.of();

  private final String assistantReply;
}
