package com.github.spud.sample.ai.agentic.conflict;

import com.github.spud.sample.ai.agentic.rag.RagProperties;
import com.github.spud.sample.ai.agentic.rag.RetrievedPassage;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicLong;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * 多集合检索冲突消解
 * <p>
 * 只评估白名单中的冲突对：含 updates 集合的冲突对为时间型冲突，updates 一方总是胜出；
 * 其余为语义型冲突，按最高检索分数决胜，平分时冲突对中先声明的集合胜出。
 * 落败集合的段落从结果中移除并记录在冲突报告中。
 */
@Slf4j
@Component
public class ConflictResolver {

  private final List<ConflictPair> conflictPairs;

  private final AtomicLong conflictsDetected = new AtomicLong();
  private final AtomicLong conflictsResolved = new AtomicLong();
  private final AtomicLong timestampResolutions = new AtomicLong();
  private final AtomicLong semanticResolutions = new AtomicLong();

  public ConflictResolver(RagProperties ragProperties) {
    this.conflictPairs = List.copyOf(ragProperties.getConflictPairs());
  }

  /**
   * 检测冲突，任一侧无结果的冲突对跳过
   */
  public List<ConflictRecord> detectConflicts(Map<String, List<RetrievedPassage>> resultsByCollection) {
    List<ConflictRecord> conflicts = new ArrayList<>();

    for (ConflictPair pair : conflictPairs) {
      List<RetrievedPassage> first = resultsByCollection.getOrDefault(pair.first(), List.of());
      List<RetrievedPassage> second = resultsByCollection.getOrDefault(pair.second(), List.of());
      if (first.isEmpty() || second.isEmpty()) {
        continue;
      }

      RetrievedPassage firstTop = top(first);
      RetrievedPassage secondTop = top(second);

      ConflictRecord conflict = ConflictRecord.builder()
        .type(pair.type())
        .collections(List.of(pair.first(), pair.second()))
        .firstTopScore(firstTop.score())
        .secondTopScore(secondTop.score())
        .firstTimestamp(firstTop.metadataText("timestamp"))
        .secondTimestamp(secondTop.metadataText("timestamp"))
        .build();
      conflicts.add(conflict);

      log.info("Conflict detected: type={}, {} vs {}", conflict.getType().value(), pair.first(),
        pair.second());
    }

    conflictsDetected.addAndGet(conflicts.size());
    return conflicts;
  }

  /**
   * 消解冲突 移除落败集合的段落，未涉及冲突的段落原样保留
   */
  public ConflictResolution resolveConflicts(Map<String, List<RetrievedPassage>> results,
    List<ConflictRecord> conflicts) {
    Set<String> losers = new HashSet<>();
    List<ConflictRecord> reports = new ArrayList<>();

    for (ConflictRecord conflict : conflicts) {
      String winner = decideWinner(conflict);
      String loser = winner.equals(conflict.first()) ? conflict.second() : conflict.first();

      ConflictRecord report = conflict.toBuilder()
        .winningCollection(winner)
        .losingPassages(List.copyOf(results.getOrDefault(loser, List.of())))
        .resolutionReason(reason(conflict, winner, loser))
        .build();
      reports.add(report);
      losers.add(loser);

      conflictsResolved.incrementAndGet();
      if (conflict.getType() == ConflictType.TEMPORAL) {
        timestampResolutions.incrementAndGet();
      } else {
        semanticResolutions.incrementAndGet();
      }
      log.info("Conflict resolved: winner={}, dropped {} passages from {} ({})", winner,
        report.getLosingPassages().size(), loser, report.getResolutionReason());
    }

    Map<String, List<RetrievedPassage>> resolved = new LinkedHashMap<>();
    results.forEach((collection, passages) -> {
      if (!losers.contains(collection)) {
        resolved.put(collection, passages);
      }
    });

    return new ConflictResolution(resolved, reports);
  }

  public ConflictStats getStats() {
    return new ConflictStats(conflictsDetected.get(), conflictsResolved.get(),
      timestampResolutions.get(), semanticResolutions.get());
  }

  public List<ConflictPair> getConflictPairs() {
    return conflictPairs;
  }

  private String decideWinner(ConflictRecord conflict) {
    if (conflict.getType() == ConflictType.TEMPORAL) {
      return new ConflictPair(conflict.first(), conflict.second()).updatesCollection();
    }
    // 平分时先声明的集合优先
    return conflict.getSecondTopScore() > conflict.getFirstTopScore()
      ? conflict.second() : conflict.first();
  }

  private String reason(ConflictRecord conflict, String winner, String loser) {
    if (conflict.getType() == ConflictType.TEMPORAL) {
      String winnerTs = winner.equals(conflict.first())
        ? conflict.getFirstTimestamp() : conflict.getSecondTimestamp();
      String loserTs = winner.equals(conflict.first())
        ? conflict.getSecondTimestamp() : conflict.getFirstTimestamp();
      return String.format("temporal_priority: %s is the updates companion of %s (timestamp %s vs %s)",
        winner, loser, winnerTs != null ? winnerTs : "unknown", loserTs != null ? loserTs : "unknown");
    }
    double winnerScore = winner.equals(conflict.first())
      ? conflict.getFirstTopScore() : conflict.getSecondTopScore();
    double loserScore = winner.equals(conflict.first())
      ? conflict.getSecondTopScore() : conflict.getFirstTopScore();
    if (Double.compare(winnerScore, loserScore) == 0) {
      return String.format("collection_priority: equal relevance %.3f, %s is declared first",
        winnerScore, winner);
    }
    return String.format("relevance_score: %s %.3f > %s %.3f", winner, winnerScore, loser,
      loserScore);
  }

  private RetrievedPassage top(List<RetrievedPassage> passages) {
    RetrievedPassage best = passages.get(0);
    for (RetrievedPassage passage : passages) {
      if (passage.score() > best.score()) {
        best = passage;
      }
    }
    return best;
  }
}
