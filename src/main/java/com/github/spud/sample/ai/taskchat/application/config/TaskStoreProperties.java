package com.github.spud.sample.ai.taskchat.application.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Connection settings for the external task store
 */
@Getter
@Setter
@Component
@ConfigurationProperties(prefix = "taskchat.task-store")
public class TaskStoreProperties {

  private String baseUrl = "http://localhost:8000/api";

  /**
   * Response timeout of a single HTTP exchange. Keep below the dispatcher call timeout.
   */
  private Duration timeout = Duration.ofSeconds(8);
}
