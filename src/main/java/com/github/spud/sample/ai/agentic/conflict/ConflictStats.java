package com.github.spud.sample.ai.agentic.conflict;

public record ConflictStats(
  long conflictsDetected,
  long conflictsResolved,
  long timestampResolutions,
  long semanticResolutions
) {

}
