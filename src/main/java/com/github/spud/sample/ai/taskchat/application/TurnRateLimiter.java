package com.github.spud.sample.ai.taskchat.application;

import com.github.spud.sample.ai.taskchat.application.config.TurnProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.RateLimitException;
import com.github.spud.sample.ai.taskchat.domain.message.ChatMessageMapper;
import com.github.spud.sample.ai.taskchat.domain.message.MessageRole;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationMessageRepository;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 按用户限制对话轮次频率。计数来自数据库中窗口内的用户消息，实例之间无共享内存状态
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TurnRateLimiter {

  private final ConversationMessageRepository messageRepository;
  private final TurnProperties turnProperties;
  private final Clock clock;

  public void check(UserContext user) {
    TurnProperties.RateLimit limit = turnProperties.getRateLimit();
    if (!limit.isEnabled()) {
      return;
    }
    Instant now = clock.instant();
    OffsetDateTime windowStart = ChatMessageMapper.toOffset(now.minus(limit.getWindow()));
    long turns = messageRepository.countByUserIdAndRoleAndCreatedAtAfter(user.getUserId(),
      MessageRole.USER, windowStart);
    if (turns < limit.getMaxTurns()) {
      return;
    }

    Duration retryAfter = messageRepository
      .findFirstByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtAsc(user.getUserId(),
        MessageRole.USER, windowStart)
      .map(ConversationMessage::getCreatedAt)
      .map(oldest -> Duration.between(now, oldest.toInstant().plus(limit.getWindow())))
      .orElse(limit.getWindow());
    if (retryAfter.compareTo(Duration.ofSeconds(1)) < 0) {
      retryAfter = Duration.ofSeconds(1);
    }
    log.warn("Rate limit hit for userId={}: {} turns in {}, retry after {}s", user.getUserId(),
      turns, limit.getWindow(), retryAfter.toSeconds());
    throw new RateLimitException("Turn rate limit exceeded", retryAfter);
  }
}
