package com.flamingo.ai.guidelines.domain.enums;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Semantic label of a chunk.
 *
 * <p>Constants are declared in classification priority order: the first constant whose cue stems
 * occur in the inspected text wins. {@link #OTHER} has no cues and is the fallback.
 */
public enum ChunkType {
  /** Clinical recommendation statements. */
  RECOMMENDATION("recommendation", List.of("рекомендац", "recommend")),

  /** Diagnostic or treatment algorithms. */
  ALGORITHM("algorithm", List.of("алгоритм", "algorithm")),

  TABLE("table", List.of("таблица", "table")),

  DEFINITION("definition", List.of("определен", "definition")),

  /** Evidence levels and supporting literature. */
  EVIDENCE("evidence", List.of("доказатель", "evidence")),

  APPENDIX("appendix", List.of("приложени", "appendix")),

  OTHER("other", List.of());

  private final String value;
  private final List<String> cues;

  ChunkType(String value, List<String> cues) {
    this.value = value;
    this.cues = cues;
  }

  @JsonValue
  public String getValue() {
    return value;
  }

  /**
   * Returns whether any cue stem of this type occurs in the given lower-cased text.
   *
   * @param lowerCaseSource text already folded to lower case
   * @return true on the first substring hit
   */
  public boolean matches(String lowerCaseSource) {
    for (String cue : cues) {
      if (lowerCaseSource.contains(cue)) {
        return true;
      }
    }
    return false;
  }

  /** Recommendation and algorithm chunks get priority in reranking and packing. */
  public boolean isPrioritized() {
    return this == RECOMMENDATION || this == ALGORITHM;
  }

  /**
   * Resolves a stored value back to its constant; unknown values map to {@link #OTHER}.
   *
   * @param value the stored value, case-insensitive
   * @return the matching type
   */
  public static ChunkType fromValue(String value) {
    return value == null ? OTHER : find(value).orElse(OTHER);
  }

  /**
   * Strict counterpart of {@link #fromValue} for caller input.
   *
   * @throws IllegalArgumentException if the value names no type
   */
  public static ChunkType parse(String value) {
    return find(value == null ? "" : value)
        .orElseThrow(
            () ->
                new IllegalArgumentException(
                    "Unknown chunk type '" + value + "', expected one of " + allValues()));
  }

  private static Optional<ChunkType> find(String value) {
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return Arrays.stream(values()).filter(type -> type.value.equals(normalized)).findFirst();
  }

  private static List<String> allValues() {
    return Arrays.stream(values()).map(type -> type.value).toList();
  }
}
