package com.github.spud.sample.ai.agentic.conflict;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.github.spud.sample.ai.agentic.rag.RagProperties;
import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

/**
 * 冲突检测与消解测试
 */
class ConflictResolverTest {

  private ConflictResolver resolver;

  @BeforeEach
  void setUp() {
    RagProperties properties = new RagProperties();
    properties.setConflictPairs(List.of(
      new ConflictPair("tax_knowledge", "tax_updates"),
      new ConflictPair("visa_oracle", "immigration_faq")));
    resolver = new ConflictResolver(properties);
  }

  @Test
  void shouldKeepUpdatesPassageForTemporalConflict() {
    RetrievedPassage stale = passage("old-vat", "VAT rate is 11%", 0.91, "tax_knowledge",
      "2022-04-01");
    RetrievedPassage fresh = passage("new-vat", "VAT rate is 12%", 0.84, "tax_updates",
      "2025-01-01");
    Map<String, List<RetrievedPassage>> results = new LinkedHashMap<>();
    results.put("tax_knowledge", List.of(stale));
    results.put("tax_updates", List.of(fresh));

    List<ConflictRecord> conflicts = resolver.detectConflicts(results);
    ConflictResolution resolution = resolver.resolveConflicts(results, conflicts);

    assertThat(resolution.passages()).containsExactly(fresh);
    assertThat(resolution.reports()).hasSize(1);

    ConflictRecord report = resolution.reports().get(0);
    assertEquals(ConflictType.TEMPORAL, report.getType());
    assertEquals(List.of("tax_knowledge", "tax_updates"), report.getCollections());
    assertEquals("tax_updates", report.getWinningCollection());
    assertThat(report.getLosingPassages()).containsExactly(stale);
    assertThat(report.getResolutionReason()).startsWith("temporal_priority")
      .contains("2025-01-01");
  }

  @Test
  void shouldPreferHigherScoreForSemanticConflict() {
    RetrievedPassage low = passage("v1", "30 days", 0.62, "visa_oracle", null);
    RetrievedPassage high = passage("f1", "60 days", 0.88, "immigration_faq", null);
    Map<String, List<RetrievedPassage>> results = Map.of(
      "visa_oracle", List.of(low),
      "immigration_faq", List.of(high));

    ConflictResolution resolution = resolver.resolveConflicts(results,
      resolver.detectConflicts(results));

    ConflictRecord report = resolution.reports().get(0);
    assertEquals(ConflictType.SEMANTIC, report.getType());
    assertEquals("immigration_faq", report.getWinningCollection());
    assertThat(report.getResolutionReason()).startsWith("relevance_score");
    assertThat(resolution.passages()).containsExactly(high);
  }

  @Test
  void shouldPreferFirstDeclaredCollectionOnTie() {
    RetrievedPassage first = passage("v1", "30 days", 0.75, "visa_oracle", null);
    RetrievedPassage second = passage("f1", "60 days", 0.75, "immigration_faq", null);
    Map<String, List<RetrievedPassage>> results = Map.of(
      "visa_oracle", List.of(first),
      "immigration_faq", List.of(second));

    ConflictResolution resolution = resolver.resolveConflicts(results,
      resolver.detectConflicts(results));

    assertEquals("visa_oracle", resolution.reports().get(0).getWinningCollection());
    assertThat(resolution.reports().get(0).getResolutionReason())
      .startsWith("collection_priority");
  }

  @Test
  void shouldSkipPairWhenOneSideIsEmpty() {
    Map<String, List<RetrievedPassage>> results = Map.of(
      "tax_knowledge", List.of(passage("t1", "VAT 11%", 0.9, "tax_knowledge", null)),
      "tax_updates", List.of());

    assertTrue(resolver.detectConflicts(results).isEmpty());
  }

  @Test
  void shouldLeaveUnrelatedCollectionsUntouched() {
    RetrievedPassage stale = passage("old", "11%", 0.9, "tax_knowledge", "2022-01-01");
    RetrievedPassage fresh = passage("new", "12%", 0.8, "tax_updates", "2025-01-01");
    RetrievedPassage kbli = passage("k1", "KBLI 62019", 0.7, "kbli_unified", null);
    Map<String, List<RetrievedPassage>> results = new LinkedHashMap<>();
    results.put("tax_knowledge", List.of(stale));
    results.put("tax_updates", List.of(fresh));
    results.put("kbli_unified", List.of(kbli));

    ConflictResolution resolution = resolver.resolveConflicts(results,
      resolver.detectConflicts(results));

    assertThat(resolution.resolved()).containsOnlyKeys("tax_updates", "kbli_unified");
    assertThat(resolution.passages()).containsExactly(fresh, kbli);
  }

  @Test
  void shouldTrackStats() {
    Map<String, List<RetrievedPassage>> temporal = Map.of(
      "tax_knowledge", List.of(passage("a", "x", 0.5, "tax_knowledge", null)),
      "tax_updates", List.of(passage("b", "y", 0.5, "tax_updates", null)));
    Map<String, List<RetrievedPassage>> semantic = Map.of(
      "visa_oracle", List.of(passage("c", "x", 0.5, "visa_oracle", null)),
      "immigration_faq", List.of(passage("d", "y", 0.6, "immigration_faq", null)));

    resolver.resolveConflicts(temporal, resolver.detectConflicts(temporal));
    resolver.resolveConflicts(semantic, resolver.detectConflicts(semantic));
    resolver.detectConflicts(Map.of());

    ConflictStats stats = resolver.getStats();
    assertEquals(2, stats.conflictsDetected());
    assertEquals(2, stats.conflictsResolved());
    assertEquals(1, stats.timestampResolutions());
    assertEquals(1, stats.semanticResolutions());
  }

  private static RetrievedPassage passage(String id, String text, double score,
    String collection, String timestamp) {
    Map<String, Object> metadata = timestamp != null
      ? Map.of("title", id, "timestamp", timestamp) : Map.of("title", id);
    return new RetrievedPassage(id, text, metadata, score, collection);
  }
}
