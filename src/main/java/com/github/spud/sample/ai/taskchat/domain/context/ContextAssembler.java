package com.github.spud.sample.ai.taskchat.domain.context;

import com.github.spud.sample.ai.taskchat.application.config.ContextWindowProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.isolation.IsolationGuard;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessage;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessageMapper;
import com.github.spud.sample.ai.taskchat.domain.message.MessageRole;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationMessageRepository;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.chat.messages.Message;
import org.springframework.stereotype.Service;

/**
 * Loads the bounded, token-budgeted history window of a conversation.
 *
 * <p>Rows are queried by conversation id and user id, then filtered again through the
 * {@link IsolationGuard}. The window holds at most {@code maxMessages} of the newest messages in
 * chronological order; when their estimated size exceeds the usable budget the oldest are dropped
 * first. Past {@code summaryThreshold} dropped messages, the dropped span is represented by one
 * synthetic system message that is never persisted.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ContextAssembler {

  static final String SUMMARY_TEMPLATE =
    "Earlier conversation summarised: %d messages omitted to fit the context window.";

  private static final Comparator<ChatMessage> CHRONOLOGICAL = Comparator
    .comparing(ChatMessage::getCreatedAt, Comparator.nullsFirst(Comparator.naturalOrder()))
    .thenComparing(ChatMessage::getSeq, Comparator.nullsLast(Comparator.naturalOrder()));

  private final ConversationMessageRepository messageRepository;
  private final ChatMessageMapper messageMapper;
  private final IsolationGuard isolationGuard;
  private final TokenEstimator tokenEstimator;
  private final ContextWindowProperties properties;

  public AgentContext assemble(UserContext user, UUID conversationId) {
    if (conversationId == null) {
      return AgentContext.empty(null);
    }
    List<ConversationMessage> rows = messageRepository.listRecentMessages(conversationId,
      user.getUserId(), properties.getMaxMessages());
    List<ChatMessage> owned = isolationGuard.retainOwned(user, messageMapper.toDomainList(rows));
    owned.sort(CHRONOLOGICAL);
    return applyBudget(conversationId, owned);
  }

  /**
   * Render the window as Spring AI messages for a model-backed reasoning step.
   */
  public List<Message> toPromptMessages(AgentContext context) {
    return messageMapper.toSpringMessages(context.getOrderedMessages());
  }

  AgentContext applyBudget(UUID conversationId, List<ChatMessage> chronological) {
    int budget = properties.usableTokenBudget();

    // walk newest to oldest, keep while it fits
    int total = 0;
    int firstKept = chronological.size();
    for (int i = chronological.size() - 1; i >= 0; i--) {
      int cost = tokenEstimator.estimate(chronological.get(i));
      if (total + cost > budget) {
        break;
      }
      total += cost;
      firstKept = i;
    }

    int dropped = firstKept;
    ChatMessage summary = null;
    if (summaryEnabled() && dropped > properties.getSummaryThreshold()) {
      summary = summaryOf(chronological, dropped);
      int summaryCost = tokenEstimator.estimate(summary);
      while (total + summaryCost > budget && firstKept < chronological.size()) {
        total -= tokenEstimator.estimate(chronological.get(firstKept));
        firstKept++;
        dropped++;
        summary = summaryOf(chronological, dropped);
        summaryCost = tokenEstimator.estimate(summary);
      }
      if (total + summaryCost > budget) {
        summary = null;
      } else {
        total += summaryCost;
      }
    }

    List<ChatMessage> window = new ArrayList<>(chronological.size() - firstKept + 1);
    if (summary != null) {
      window.add(summary);
    }
    window.addAll(chronological.subList(firstKept, chronological.size()));

    if (dropped > 0) {
      log.debug("Context window for conversation {} dropped {} messages (summarized={})",
        conversationId, dropped, summary != null);
    }
    return AgentContext.builder()
      .conversationId(conversationId)
      .orderedMessages(window)
      .droppedCount(dropped)
      .summarized(summary != null)
      .estimatedTokens(total)
      .build();
  }

  private boolean summaryEnabled() {
    return properties.getSummaryThreshold() >= 0;
  }

  /**
   * Placed at the position of the newest dropped message so the window stays chronological.
   */
  private static ChatMessage summaryOf(List<ChatMessage> chronological, int dropped) {
    ChatMessage lastDropped = chronological.get(dropped - 1);
    return ChatMessage.builder()
      .conversationId(lastDropped.getConversationId())
      .userId(lastDropped.getUserId())
      .role(MessageRole.SYSTEM)
      .content(String.format(SUMMARY_TEMPLATE, dropped))
      .createdAt(lastDropped.getCreatedAt())
      .seq(lastDropped.getSeq())
      .synthetic(true)
      .build();
  }
}
