package com.flamingo.ai.guidelines.domain.model;

import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import java.util.Set;

/**
 * Optional restrictions applied inside both hybrid search streams.
 *
 * @param sectionPrefix only chunks whose section path starts with this prefix
 * @param chunkTypes only chunks of these types; empty means any type
 * @param pageStart lower bound of the page window, inclusive
 * @param pageEnd upper bound of the page window, inclusive; a chunk qualifies when its page range
 *     overlaps the window
 */
public record RetrievalFilters(
    String sectionPrefix, Set<ChunkType> chunkTypes, Integer pageStart, Integer pageEnd) {

  public RetrievalFilters {
    chunkTypes = chunkTypes == null ? Set.of() : Set.copyOf(chunkTypes);
    if (pageStart != null && pageEnd != null && pageEnd < pageStart) {
      throw new IllegalArgumentException(
          "pageEnd " + pageEnd + " is before pageStart " + pageStart);
    }
  }

  public static RetrievalFilters none() {
    return new RetrievalFilters(null, Set.of(), null, null);
  }

  public boolean hasSectionPrefix() {
    return sectionPrefix != null && !sectionPrefix.isBlank();
  }

  public boolean isEmpty() {
    return !hasSectionPrefix() && chunkTypes.isEmpty() && pageStart == null && pageEnd == null;
  }
}
