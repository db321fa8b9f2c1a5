package com.github.spud.sample.ai.taskchat.domain.tools;

public enum ChainStatus {
  SUCCESS,
  PARTIAL,
  ERROR
}
