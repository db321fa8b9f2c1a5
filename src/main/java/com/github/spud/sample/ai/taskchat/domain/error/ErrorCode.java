package com.github.spud.sample.ai.taskchat.domain.error;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Error taxonomy shared by every component of the turn pipeline.
 *
 * <p>Each code carries its HTTP equivalent, whether the engine may retry it, and the only text
 * that may be disclosed to the caller.
 */
@Getter
public enum ErrorCode {

  MISSING_TOKEN(ErrorCategory.AUTHENTICATION, HttpStatus.UNAUTHORIZED, RetryScope.NEVER,
    "Please log in again."),
  INVALID_TOKEN(ErrorCategory.AUTHENTICATION, HttpStatus.UNAUTHORIZED, RetryScope.NEVER,
    "Please log in again."),
  EXPIRED_TOKEN(ErrorCategory.AUTHENTICATION, HttpStatus.UNAUTHORIZED, RetryScope.NEVER,
    "Please log in again."),
  INVALID_SIGNATURE(ErrorCategory.AUTHENTICATION, HttpStatus.UNAUTHORIZED, RetryScope.NEVER,
    "Please log in again."),

  USER_MISMATCH(ErrorCategory.AUTHORIZATION, HttpStatus.FORBIDDEN, RetryScope.NEVER,
    "Access denied."),
  CROSS_USER_ACCESS(ErrorCategory.AUTHORIZATION, HttpStatus.FORBIDDEN, RetryScope.NEVER,
    "Access denied."),
  CONVERSATION_NOT_OWNED(ErrorCategory.AUTHORIZATION, HttpStatus.FORBIDDEN, RetryScope.NEVER,
    "Access denied."),

  INVALID_MESSAGE(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, RetryScope.NEVER,
    "The message is invalid."),
  MESSAGE_TOO_LONG(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, RetryScope.NEVER,
    "The message is too long."),
  INVALID_PARAMETERS(ErrorCategory.VALIDATION, HttpStatus.BAD_REQUEST, RetryScope.NEVER,
    "The request parameters are invalid."),

  CONVERSATION_NOT_FOUND(ErrorCategory.RESOURCE, HttpStatus.NOT_FOUND, RetryScope.NEVER,
    "Conversation not found."),

  TOOL_TIMEOUT(ErrorCategory.TOOL_EXECUTION, HttpStatus.BAD_GATEWAY, RetryScope.TOOL_CALL,
    "Something went wrong. Please try again."),
  TOOL_ERROR(ErrorCategory.TOOL_EXECUTION, HttpStatus.BAD_GATEWAY, RetryScope.TOOL_CALL,
    "Something went wrong. Please try again."),

  CONNECTION_FAILED(ErrorCategory.PERSISTENCE, HttpStatus.INTERNAL_SERVER_ERROR,
    RetryScope.WRITE_LAYER, "An internal error occurred."),
  TRANSACTION_FAILED(ErrorCategory.PERSISTENCE, HttpStatus.INTERNAL_SERVER_ERROR,
    RetryScope.WRITE_LAYER, "An internal error occurred."),

  TOO_MANY_REQUESTS(ErrorCategory.RATE_LIMITING, HttpStatus.TOO_MANY_REQUESTS, RetryScope.NEVER,
    "Too many requests."),

  INTERNAL_ERROR(ErrorCategory.INTERNAL, HttpStatus.INTERNAL_SERVER_ERROR, RetryScope.NEVER,
    "An internal error occurred.");

  private final ErrorCategory category;
  private final HttpStatus httpStatus;
  private final RetryScope retryScope;
  private final String disclosure;

  ErrorCode(ErrorCategory category, HttpStatus httpStatus, RetryScope retryScope,
    String disclosure) {
    this.category = category;
    this.httpStatus = httpStatus;
    this.retryScope = retryScope;
    this.disclosure = disclosure;
  }
}
