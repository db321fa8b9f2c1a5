package com.github.spud.sample.ai.taskchat.application.config;

import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * 全局基础 Bean
 */
@Configuration
public class TaskChatConfig {

  /**
   * All persisted timestamps are taken from this clock (UTC)
   */
  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }
}
