package com.github.spud.sample.ai.agentic.kernel;

import java.util.List;
import java.util.Locale;

/**
 * 根据问题措辞推断的讲解深度
 */
public enum ExplanationLevel {

  SIMPLE("Explain in plain language for a newcomer. Avoid jargon, define any legal term you "
    + "must use, and keep the answer short."),
  STANDARD("Give a clear, practical answer with the key requirements and next steps."),
  EXPERT("The user is a professional. Be precise, cite regulation numbers and articles where "
    + "available, and skip introductory explanations.");

  private static final List<String> SIMPLE_MARKERS = List.of(
    "explain like", "in simple terms", "simple explanation", "simply", "for a beginner",
    "i'm new", "i am new", "what does it mean", "eli5", "spiegami", "in parole semplici",
    "jelaskan dengan sederhana");

  private static final List<String> EXPERT_MARKERS = List.of(
    "regulation", "article", "pasal", "undang-undang", "permen", "pp no", "compliance",
    "legal basis", "dasar hukum", "technical", "in detail", "detailed analysis",
    "withholding", "transfer pricing", "tax treaty");

  private final String instruction;

  ExplanationLevel(String instruction) {
    this.instruction = instruction;
  }

  public String instruction() {
    return instruction;
  }

  public static ExplanationLevel detect(String query) {
    if (query == null || query.isBlank()) {
      return STANDARD;
    }
    String lower = query.toLowerCase(Locale.ROOT);
    if (SIMPLE_MARKERS.stream().anyMatch(lower::contains)) {
      return SIMPLE;
    }
    if (EXPERT_MARKERS.stream().anyMatch(lower::contains)) {
      return EXPERT;
    }
    return STANDARD;
  }
}
