package com.github.spud.sample.ai.agentic.conflict;

/**
 * 冲突对 两个已知可能给出矛盾信息的知识集合，first 在语义平分时优先
 */
public record ConflictPair(String first, String second) {

  private static final String UPDATES_MARKER = "updates";

  public boolean involves(String collection) {
    return first.equals(collection) || second.equals(collection);
  }

  /**
   * 时间序的 updates 集合，没有则返回 null
   */
  public String updatesCollection() {
    boolean firstIsUpdates = first.contains(UPDATES_MARKER);
    boolean secondIsUpdates = second.contains(UPDATES_MARKER);
    if (firstIsUpdates == secondIsUpdates) {
      return null;
    }
    return firstIsUpdates ? first : second;
  }

  public ConflictType type() {
    return updatesCollection() != null ? ConflictType.TEMPORAL : ConflictType.SEMANTIC;
  }
}
