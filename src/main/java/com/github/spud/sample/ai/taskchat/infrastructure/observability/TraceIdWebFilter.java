package com.github.spud.sample.ai.taskchat.infrastructure.observability;

import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.server.ServerWebExchange;
import org.springframework.web.server.WebFilter;
import org.springframework.web.server.WebFilterChain;
import reactor.core.publisher.Mono;

/**
 * Assigns every inbound request a trace id, exposed as an exchange attribute for the controller
 * and error handler and echoed in the {@code X-Trace-Id} response header.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
public class TraceIdWebFilter implements WebFilter {

  public static final String TRACE_ID_ATTRIBUTE = TraceIdWebFilter.class.getName() + ".traceId";
  public static final String TRACE_ID_HEADER = "X-Trace-Id";

  @Override
  public Mono<Void> filter(ServerWebExchange exchange, WebFilterChain chain) {
    String traceId = TraceContext.newTraceId();
    exchange.getAttributes().put(TRACE_ID_ATTRIBUTE, traceId);
    exchange.getResponse().getHeaders().set(TRACE_ID_HEADER, traceId);
    return chain.filter(exchange);
  }

  /**
   * Trace id of the exchange, created on first use when the filter did not run.
   */
  public static String traceIdOf(ServerWebExchange exchange) {
    return (String) exchange.getAttributes()
      .computeIfAbsent(TRACE_ID_ATTRIBUTE, key -> TraceContext.newTraceId());
  }
}
