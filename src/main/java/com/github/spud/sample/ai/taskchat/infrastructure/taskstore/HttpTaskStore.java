package com.github.spud.sample.ai.taskchat.infrastructure.taskstore;

import com.fasterxml.jackson.databind.JsonNode;
import com.github.spud.sample.ai.taskchat.application.config.TaskStoreProperties;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskOperation;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStore;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreException;
import com.github.spud.sample.ai.taskchat.domain.tools.task.TaskStoreTimeoutException;
import com.github.spud.sample.ai.taskchat.util.JsonUtils;
import java.net.SocketTimeoutException;
import java.net.http.HttpClient;
import java.net.http.HttpTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.json.JsonParseException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * 任务存储 HTTP 客户端 按 {@code POST {baseUrl}/{userId}/tasks/ops/{operation}} 调用任务服务
 *
 * <p>5xx 与连接失败为瞬时错误，4xx 与业务失败（{@code "success": false}）为永久错误，
 * 响应超时映射为 {@link TaskStoreTimeoutException}。
 */
@Slf4j
@Component
public class HttpTaskStore implements TaskStore {

  public static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";

  private final String baseUrl;
  private final RestClient restClient;

  @Autowired
  public HttpTaskStore(TaskStoreProperties properties) {
    this(properties, buildRestClient(properties));
  }

  HttpTaskStore(TaskStoreProperties properties, RestClient restClient) {
    String url = properties.getBaseUrl();
    this.baseUrl = url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    this.restClient = restClient;
    log.info("HttpTaskStore initialized: baseUrl={}, timeout={}", this.baseUrl,
      properties.getTimeout());
  }

  @Override
  public String execute(String userId, TaskOperation operation, Object parameters,
    String idempotencyKey) {
    String body = JsonUtils.toToolJson(parameters != null ? parameters : JsonUtils.toolMapper()
      .createObjectNode());
    log.debug("Task store {} for userId={}", operation.getOperation(), userId);

    String response;
    try {
      response = restClient.post()
        .uri(baseUrl + "/{userId}/tasks/ops/{operation}", userId, operation.getOperation())
        .contentType(MediaType.APPLICATION_JSON)
        .accept(MediaType.APPLICATION_JSON)
        .headers(headers -> {
          if (StringUtils.hasText(idempotencyKey)) {
            headers.set(IDEMPOTENCY_KEY_HEADER, idempotencyKey);
          }
        })
        .body(body)
        .retrieve()
        .body(String.class);
    } catch (HttpServerErrorException e) {
      throw new TaskStoreException("Task store " + operation.getOperation() + " failed with "
        + e.getStatusCode().value(), true, e);
    } catch (HttpClientErrorException e) {
      throw new TaskStoreException("Task store rejected " + operation.getOperation() + " with "
        + e.getStatusCode().value() + ": " + abbreviate(e.getResponseBodyAsString()), false, e);
    } catch (ResourceAccessException e) {
      if (isTimeout(e)) {
        throw new TaskStoreTimeoutException("Task store " + operation.getOperation()
          + " timed out", e);
      }
      throw new TaskStoreException("Task store unreachable: " + e.getMessage(), true, e);
    } catch (RestClientException e) {
      throw new TaskStoreException("Task store call failed: " + e.getMessage(), false, e);
    }

    return checkOutcome(operation, response);
  }

  private static String checkOutcome(TaskOperation operation, String response) {
    if (!StringUtils.hasText(response)) {
      return "{}";
    }
    JsonNode node;
    try {
      node = JsonUtils.readTree(response);
    } catch (JsonParseException e) {
      throw new TaskStoreException("Task store returned malformed JSON for "
        + operation.getOperation(), false, e);
    }
    if (node.path("success").isBoolean() && !node.path("success").asBoolean()) {
      throw new TaskStoreException(node.path("message").asText("Task store operation failed"),
        false);
    }
    return response;
  }

  private static boolean isTimeout(Throwable error) {
    Throwable cause = error;
    while (cause != null) {
      if (cause instanceof HttpTimeoutException || cause instanceof SocketTimeoutException) {
        return true;
      }
      cause = cause.getCause() == cause ? null : cause.getCause();
    }
    return false;
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "";
    }
    return text.length() > 200 ? text.substring(0, 200) + "..." : text;
  }

  private static RestClient buildRestClient(TaskStoreProperties properties) {
    HttpClient httpClient = HttpClient.newBuilder()
      .connectTimeout(properties.getTimeout())
      .build();
    JdkClientHttpRequestFactory requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.getTimeout());
    return RestClient.builder()
      .requestFactory(requestFactory)
      .defaultHeader(HttpHeaders.USER_AGENT, "task-chat-orchestrator")
      .build();
  }
}
