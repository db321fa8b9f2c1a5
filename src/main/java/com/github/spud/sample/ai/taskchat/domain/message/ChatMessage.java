package com.github.spud.sample.ai.taskchat.domain.message;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Data;

/**
 * Domain model for conversation messages (conversion layer between persistence entity, REST view
 * and Spring AI messages)
 */
@Data
@Builder
public class ChatMessage {

  private UUID id;

  private UUID conversationId;

  private String userId;

  private MessageRole role;

  private String content;

  // Ids of the tool invocation records of the turn, assistant messages only
  private List<String> toolCalls;

  // Ordering: created_at first, seq breaks ties
  private Long seq;

  private Instant createdAt;

  /**
   * True for messages produced by context assembly and never persisted
   */
  private boolean synthetic;
}
