package com.github.spud.sample.ai.taskchat.domain.tools;

/**
 * What the dispatcher does with the rest of a chain once a call has definitively failed.
 */
public enum ChainPolicy {

  /**
   * Stop; every remaining call is recorded as skipped.
   */
  ABORT_CHAIN,

  /**
   * Keep going and report a partial result.
   */
  CONTINUE_PARTIAL
}
