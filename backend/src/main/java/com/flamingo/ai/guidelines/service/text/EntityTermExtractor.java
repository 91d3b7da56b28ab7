package com.flamingo.ai.guidelines.service.text;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Extracts capitalised terms (drug names, conditions, scales) from chunk text.
 *
 * <p>A term starts with an upper-case Latin or Cyrillic letter followed by at least three letters
 * or hyphens.
 */
@Component
public class EntityTermExtractor {

  static final int MAX_MENTIONS = 10;
  static final int MAX_EXPANSION_TERMS = 3;

  private static final Pattern CAPITALISED_TERM =
      Pattern.compile("\\b[А-ЯЁA-Z][а-яёa-zA-Z\\-]{3,}\\b", Pattern.UNICODE_CHARACTER_CLASS);

  /**
   * The most frequent capitalised terms of a chunk, stored with the chunk for expansion lookups.
   *
   * @param text chunk text
   * @return up to ten terms, most frequent first, first occurrence breaking ties
   */
  public List<String> mentions(String text) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (String term : findAll(text)) {
      counts.merge(term, 1, Integer::sum);
    }
    List<Map.Entry<String, Integer>> ranked = new ArrayList<>(counts.entrySet());
    // stable sort keeps first-occurrence order among equal counts
    ranked.sort(Map.Entry.<String, Integer>comparingByValue(Comparator.reverseOrder()));
    return ranked.stream().limit(MAX_MENTIONS).map(Map.Entry::getKey).toList();
  }

  /**
   * Terms of a seed chunk used to look up entity-linked chunks.
   *
   * @param text seed chunk text
   * @return up to three distinct terms in first-occurrence order
   */
  public List<String> expansionTerms(String text) {
    Set<String> distinct = new LinkedHashSet<>(findAll(text));
    return distinct.stream().limit(MAX_EXPANSION_TERMS).toList();
  }

  private static List<String> findAll(String text) {
    List<String> terms = new ArrayList<>();
    if (text == null || text.isEmpty()) {
      return terms;
    }
    Matcher matcher = CAPITALISED_TERM.matcher(text);
    while (matcher.find()) {
      terms.add(matcher.group());
    }
    return terms;
  }
}
