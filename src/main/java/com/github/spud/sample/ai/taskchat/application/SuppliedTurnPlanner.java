package com.github.spud.sample.ai.taskchat.application;

import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.context.AgentContext;
import java.util.List;
import org.springframework.stereotype.Component;

/**
 * Default planner: the reasoning step ran upstream and its decision arrived with the request.
 * A model-backed planner replaces it as a {@code @Primary} bean.
 */
@Component
public class SuppliedTurnPlanner implements TurnPlanner {

  @Override
  public TurnPlan plan(UserContext user, TurnCommand command, AgentContext context) {
    return TurnPlan.builder()
      .toolCalls(command.getToolCalls() != null ? command.getToolCalls() : List.of())
      .assistantReply(command.getAssistantReply())
      .build();
  }
}
