package com.github.spud.sample.ai.taskchat.domain.conversation;

/**
 * Outcome of resolving the conversation a turn belongs to. {@code REJECTED} never leaves the
 * resolver as a value; it is raised as {@code CONVERSATION_NOT_OWNED}.
 */
public enum ResolutionState {
  NEW,
  RESUMED,
  STALE,
  REJECTED
}
