package com.github.spud.sample.ai.taskchat.application;

import com.github.spud.sample.ai.taskchat.domain.auth.UserContext;
import com.github.spud.sample.ai.taskchat.domain.context.AgentContext;

/**
 * Seam to the external intent/reasoning step. Receives the bounded history and the new message,
 * returns the tool chain to execute. Implementations never execute tools themselves.
 */
public interface TurnPlanner {

  TurnPlan plan(UserContext user, TurnCommand command, AgentContext context);
}
