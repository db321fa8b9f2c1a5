package com.github.spud.sample.ai.taskchat.interfaces.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCategory;
import com.github.spud.sample.ai.taskchat.domain.error.ErrorCode;
import com.github.spud.sample.ai.taskchat.domain.error.RateLimitException;
import com.github.spud.sample.ai.taskchat.domain.error.TaskChatException;
import com.github.spud.sample.ai.taskchat.infrastructure.observability.TraceIdWebFilter;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.Map;
import lombok.Builder;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.FieldError;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ResponseStatusException;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.ServerWebInputException;

/**
 * Renders every failure as {@link ErrorResponse}. Only the {@link ErrorCode} disclosure text and
 * validation field errors reach the body.
 */
@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

  @Data
  @Builder
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public static class ErrorResponse {
    private String code;
    private String message;
    private String traceId;
    private OffsetDateTime timestamp;
    private Map<String, Object> details;
  }

  @ExceptionHandler(TaskChatException.class)
  public ResponseEntity<ErrorResponse> handleTaskChat(TaskChatException e,
    ServerWebExchange exchange) {
    ErrorCode code = e.getCode();
    String traceId = TraceIdWebFilter.traceIdOf(exchange);
    logFailure(code, traceId, e);

    ErrorResponse.ErrorResponseBuilder body = ErrorResponse.builder()
      .code(code.name())
      .message(code.getDisclosure())
      .traceId(traceId)
      .timestamp(now());
    if (code.getCategory() == ErrorCategory.VALIDATION && !e.getDetails().isEmpty()) {
      body.details(e.getDetails());
    }

    ResponseEntity.BodyBuilder response = ResponseEntity.status(code.getHttpStatus());
    if (code.getCategory() == ErrorCategory.AUTHENTICATION) {
      response.header(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
    }
    if (e instanceof RateLimitException rateLimit && rateLimit.getRetryAfter() != null) {
      response.header(HttpHeaders.RETRY_AFTER,
        String.valueOf(Math.max(1, rateLimit.getRetryAfter().toSeconds())));
    }
    return response.body(body.build());
  }

  @ExceptionHandler(WebExchangeBindException.class)
  public ResponseEntity<ErrorResponse> handleWebExchangeBind(WebExchangeBindException e,
    ServerWebExchange exchange) {
    Map<String, String> fieldErrors = new HashMap<>();
    for (FieldError error : e.getBindingResult().getFieldErrors()) {
      fieldErrors.put(error.getField(), error.getDefaultMessage());
    }
    return badRequest(exchange, Map.of("fieldErrors", fieldErrors));
  }

  /**
   * 请求体缺失或无法解析
   */
  @ExceptionHandler(ServerWebInputException.class)
  public ResponseEntity<ErrorResponse> handleServerWebInput(ServerWebInputException e,
    ServerWebExchange exchange) {
    log.debug("Unreadable request: {}", e.getReason());
    return badRequest(exchange, null);
  }

  @ExceptionHandler(ResponseStatusException.class)
  public ResponseEntity<ErrorResponse> handleResponseStatus(ResponseStatusException e,
    ServerWebExchange exchange) {
    HttpStatus status = HttpStatus.resolve(e.getStatusCode().value());
    if (status == null) {
      status = HttpStatus.INTERNAL_SERVER_ERROR;
    }
    ErrorResponse error = ErrorResponse.builder()
      .code(status.name())
      .message(status.getReasonPhrase())
      .traceId(TraceIdWebFilter.traceIdOf(exchange))
      .timestamp(now())
      .build();
    return ResponseEntity.status(status).body(error);
  }

  @ExceptionHandler(Exception.class)
  public ResponseEntity<ErrorResponse> handleGenericException(Exception e,
    ServerWebExchange exchange) {
    String traceId = TraceIdWebFilter.traceIdOf(exchange);
    log.error("Unhandled exception (traceId={})", traceId, e);
    ErrorResponse error = ErrorResponse.builder()
      .code(ErrorCode.INTERNAL_ERROR.name())
      .message(ErrorCode.INTERNAL_ERROR.getDisclosure())
      .traceId(traceId)
      .timestamp(now())
      .build();
    return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(error);
  }

  private ResponseEntity<ErrorResponse> badRequest(ServerWebExchange exchange,
    Map<String, Object> details) {
    ErrorResponse error = ErrorResponse.builder()
      .code(ErrorCode.INVALID_MESSAGE.name())
      .message(ErrorCode.INVALID_MESSAGE.getDisclosure())
      .traceId(TraceIdWebFilter.traceIdOf(exchange))
      .timestamp(now())
      .details(details)
      .build();
    return ResponseEntity.status(HttpStatus.BAD_REQUEST).body(error);
  }

  private static void logFailure(ErrorCode code, String traceId, TaskChatException e) {
    switch (code.getCategory()) {
      case PERSISTENCE, INTERNAL -> log.error("Turn failed: code={} traceId={}", code, traceId, e);
      case TOOL_EXECUTION, RATE_LIMITING, AUTHORIZATION ->
        log.warn("Request rejected: code={} traceId={}", code, traceId);
      default -> log.info("Request rejected: code={} traceId={}", code, traceId);
    }
  }

  private static OffsetDateTime now() {
    return OffsetDateTime.now(ZoneOffset.UTC);
  }
}
