package com.github.spud.sample.ai.agentic.conflict;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ConflictType {
  TEMPORAL,
  SEMANTIC;

  @JsonValue
  public String value() {
    return name().toLowerCase();
  }
}
