package com.github.spud.sample.ai.taskchat.application;

import java.time.Instant;
import lombok.Builder;
import lombok.Data;

/**
 * Conversation list entry with first/last message previews
 */
@Data
@Builder
public class ConversationSummary {

  private String id;

  private Instant createdAt;

  private Instant updatedAt;

  private String firstMessage;

  private String lastMessage;

  private long messageCount;
}
