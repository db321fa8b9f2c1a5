package com.github.spud.sample.ai.taskchat.domain.tools;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import lombok.Builder;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.ai.tool.ToolCallback;
import org.springframework.ai.tool.definition.ToolDefinition;
import org.springframework.stereotype.Component;

/**
 * 工具注册中心：工具名 -> 定义、回调、参数类型及幂等/只读声明
 */
@Slf4j
@Component
public class ToolRegistry {

  /**
   * 工具名 -> 注册信息
   */
  private final Map<String, Registration> registrations = new ConcurrentHashMap<>();

  /**
   * 注册工具
   */
  public void register(Registration registration) {
    String toolName = registration.getDefinition().name();
    log.info("Registering tool: {} (idempotent={}, readOnly={})", toolName,
      registration.isIdempotent(), registration.isReadOnly());
    registrations.put(toolName, registration);
  }

  /**
   * 获取工具注册信息
   */
  public Optional<Registration> find(String toolName) {
    return toolName == null ? Optional.empty() : Optional.ofNullable(registrations.get(toolName));
  }

  /**
   * 获取所有工具定义（供外部推理步骤选择工具）
   */
  public List<ToolDefinition> getAllDefinitions() {
    return registrations.values().stream()
      .map(Registration::getDefinition)
      .sorted((a, b) -> a.name().compareTo(b.name()))
      .toList();
  }

  /**
   * 获取工具数量
   */
  public int size() {
    return registrations.size();
  }

  @Getter
  @Builder
  public static class Registration {

    private final ToolDefinition definition;

    private final ToolCallback callback;

    /**
     * 参数类型，校验通过后的参数会绑定到该类型
     */
    private final Class<?> parametersType;

    /**
     * 工具是否支持幂等键（重试不会重复产生外部副作用）
     */
    private final boolean idempotent;

    /**
     * 只读工具无副作用
     */
    private final boolean readOnly;
  }
}
