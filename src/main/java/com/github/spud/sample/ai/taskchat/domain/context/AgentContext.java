package com.github.spud.sample.ai.taskchat.domain.context;

import com.github.spud.sample.ai.taskchat.domain.message.ChatMessage;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import lombok.Builder;
import lombok.Data;

/**
 * 一次对话轮次交给推理步骤的有界历史上下文
 */
@Data
@Builder
public class AgentContext {

  private UUID conversationId;

  /**
   * 按时间升序排列的历史消息（可能以一条合成摘要消息开头）
   */
  @Builder.Default
  private List<ChatMessage> orderedMessages = new ArrayList<>();

  /**
   * 因 token 预算被丢弃的消息数
   */
  private int droppedCount;

  /**
   * 丢弃的区间是否被一条摘要消息替代
   */
  private boolean summarized;

  /**
   * 保留消息的估算 token 总数
   */
  private int estimatedTokens;

  public static AgentContext empty(UUID conversationId) {
    return AgentContext.builder().conversationId(conversationId).build();
  }
}
