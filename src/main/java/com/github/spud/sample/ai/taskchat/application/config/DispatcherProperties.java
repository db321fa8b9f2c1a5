package com.github.spud.sample.ai.taskchat.application.config;

import com.github.spud.sample.ai.taskchat.domain.tools.ChainPolicy;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * 工具调度配置：超时、重试退避与按工具的链策略
 */
@Data
@Component
@ConfigurationProperties(prefix = "taskchat.dispatcher")
public class DispatcherProperties {

  /**
   * 单次工具调用超时
   */
  private Duration callTimeout = Duration.ofSeconds(10);

  /**
   * 最大尝试次数（含首次）
   */
  private int maxAttempts = 3;

  /**
   * 首次重试前的等待
   */
  private Duration initialBackoff = Duration.ofMillis(100);

  /**
   * 退避倍数
   */
  private double backoffMultiplier = 2.0;

  /**
   * 退避上限
   */
  private Duration maxBackoff = Duration.ofSeconds(1);

  /**
   * 未单独配置的工具使用的链策略
   */
  private ChainPolicy defaultChainPolicy = ChainPolicy.CONTINUE_PARTIAL;

  /**
   * 工具名 -> 工具级配置
   */
  private Map<String, ToolSettings> tools = new HashMap<>();

  public ChainPolicy chainPolicyFor(String toolName) {
    ToolSettings settings = tools.get(toolName);
    if (settings == null || settings.getChainPolicy() == null) {
      return defaultChainPolicy;
    }
    return settings.getChainPolicy();
  }

  @Data
  public static class ToolSettings {

    /**
     * 工具失败后的链策略（关键工具配置为 ABORT_CHAIN）
     */
    private ChainPolicy chainPolicy;
  }
}
