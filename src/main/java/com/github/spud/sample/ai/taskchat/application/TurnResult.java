package com.github.spud.sample.ai.taskchat.application;

import com.github.spud.sample.ai.taskchat.domain.conversation.ResolutionState;
import com.github.spud.sample.ai.taskchat.domain.tools.ChainStatus;
import com.github.spud.sample.ai.taskchat.domain.tools.InvocationStatus;
import java.time.Instant;
import java.util.List;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class TurnResult {

  private String conversationId;

  private String responseText;

  private List<ToolCallSummary> toolCalls;

  private String traceId;

  private Instant timestamp;

  /**
   * success / partial / error of the tool chain
   */
  private ChainStatus status;

  /**
   * NEW, RESUMED or STALE
   */
  private ResolutionState conversationState;

  @Data
  @Builder
  public static class ToolCallSummary {

    private String name;

    private InvocationStatus status;

    /**
     * Tool output on success; generic text otherwise
     */
    private String resultOrError;
  }
}
