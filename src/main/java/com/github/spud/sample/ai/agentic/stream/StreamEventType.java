package com.github.spud.sample.ai.agentic.stream;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

public enum StreamEventType {
  METADATA,
  STATUS,
  TOOL_START,
  TOOL_END,
  TOKEN,
  DONE,
  ERROR;

  @JsonValue
  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
