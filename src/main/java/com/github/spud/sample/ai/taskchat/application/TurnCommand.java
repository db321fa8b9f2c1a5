package com.github.spud.sample.ai.taskchat.application;

import com.github.spud.sample.ai.taskchat.domain.tools.ToolCallRequest;
import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Data;
import lombok.ToString;

/**
 * Inbound turn as received from the transport layer, before authentication.
 */
@Data
@Builder
public class TurnCommand {

  /**
   * User id from the request path
   */
  private String pathUserId;

  @ToString.Exclude
  private String authorization;

  private String conversationId;

  @ToString.Exclude
  private String message;

  /**
   * Tool chain decided upstream, in execution order
   */
  @Builder.Default
  private List<ToolCallRequest> toolCalls = new ArrayList<>();

  /**
   * Reply text decided upstream
   */
  @ToString.Exclude
  private String assistantReply;
}
