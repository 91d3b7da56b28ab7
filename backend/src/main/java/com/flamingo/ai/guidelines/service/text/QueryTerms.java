package com.flamingo.ai.guidelines.service.text;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/** Bag-of-terms tokenizer shared by the reranker and the context packer. */
public final class QueryTerms {

  /** Runs of at least three word characters or hyphens, Cyrillic included. */
  private static final Pattern TERM =
      Pattern.compile("[\\w\\-]{3,}", Pattern.UNICODE_CHARACTER_CLASS);

  private QueryTerms() {}

  /** Case-folded, order-irrelevant set of terms of a text. */
  public static Set<String> of(String text) {
    Set<String> terms = new LinkedHashSet<>();
    if (text == null || text.isEmpty()) {
      return terms;
    }
    Matcher matcher = TERM.matcher(text.toLowerCase(Locale.ROOT));
    while (matcher.find()) {
      terms.add(matcher.group());
    }
    return terms;
  }

  /** Number of distinct terms two term sets share. */
  public static int overlap(Set<String> queryTerms, Set<String> textTerms) {
    int shared = 0;
    for (String term : queryTerms) {
      if (textTerms.contains(term)) {
        shared++;
      }
    }
    return shared;
  }
}
