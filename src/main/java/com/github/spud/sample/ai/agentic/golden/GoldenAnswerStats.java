package com.github.spud.sample.ai.agentic.golden;

public record GoldenAnswerStats(int totalGoldenAnswers, long totalHits, double avgConfidence) {

}
