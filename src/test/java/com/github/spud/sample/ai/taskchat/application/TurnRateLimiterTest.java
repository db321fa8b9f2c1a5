package com.github.spud.sample.ai.taskchat.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.github.spud.sample.ai.taskchat.application.config.TurnProperties;
import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.RateLimitException;
import com.github.spud.sample.ai.taskchat.domain.message.MessageRole;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.entity.ConversationMessage;
import com.github.spud.sample.ai.taskchat.infrastructure.persistence.repository.ConversationMessageRepository;
import com.github.spud.sample.ai.taskchat.support.MutableClock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TurnRateLimiterTest {

  private static final Instant NOW = Instant.parse("2026-02-01T08:00:00Z");

  @Mock
  private ConversationMessageRepository messageRepository;

  private final UserContext alice = UserContext.builder().userId("alice").build();
  private TurnProperties properties;
  private TurnRateLimiter limiter;

  @BeforeEach
  void setUp() {
    properties = new TurnProperties();
    properties.getRateLimit().setMaxTurns(3);
    properties.getRateLimit().setWindow(Duration.ofMinutes(1));
    limiter = new TurnRateLimiter(messageRepository, properties, new MutableClock(NOW));
  }

  @Test
  void allowsTurnsBelowLimit() {
    when(messageRepository.countByUserIdAndRoleAndCreatedAtAfter(eq("alice"),
      eq(MessageRole.USER), eq(OffsetDateTime.parse("2026-02-01T07:59:00Z"))))
      .thenReturn(2L);

    assertThatCode(() -> limiter.check(alice)).doesNotThrowAnyException();
  }

  @Test
  void rejectsWithRetryAfterFromOldestTurnInWindow() {
    when(messageRepository.countByUserIdAndRoleAndCreatedAtAfter(eq("alice"),
      eq(MessageRole.USER), any())).thenReturn(3L);
    ConversationMessage oldest = new ConversationMessage();
    oldest.setCreatedAt(NOW.minusSeconds(45).atOffset(ZoneOffset.UTC));
    when(messageRepository.findFirstByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtAsc(
      eq("alice"), eq(MessageRole.USER), any())).thenReturn(Optional.of(oldest));

    RateLimitException error = catchThrowableOfType(() -> limiter.check(alice),
      RateLimitException.class);

    assertThat(error.getCode()).isEqualTo(ErrorCode.TOO_MANY_REQUESTS);
    assertThat(error.getRetryAfter()).isEqualTo(Duration.ofSeconds(15));
  }

  @Test
  void retryAfterIsAtLeastOneSecond() {
    when(messageRepository.countByUserIdAndRoleAndCreatedAtAfter(eq("alice"),
      eq(MessageRole.USER), any())).thenReturn(5L);
    ConversationMessage oldest = new ConversationMessage();
    oldest.setCreatedAt(NOW.minusSeconds(60).plusMillis(10).atOffset(ZoneOffset.UTC));
    when(messageRepository.findFirstByUserIdAndRoleAndCreatedAtAfterOrderByCreatedAtAsc(
      eq("alice"), eq(MessageRole.USER), any())).thenReturn(Optional.of(oldest));

    RateLimitException error = catchThrowableOfType(() -> limiter.check(alice),
      RateLimitException.class);

    assertThat(error.getRetryAfter()).isEqualTo(Duration.ofSeconds(1));
  }

  @Test
  void disabledLimiterDoesNotQuery() {
    properties.getRateLimit().setEnabled(false);

    limiter.check(alice);

    verifyNoInteractions(messageRepository);
  }
}
