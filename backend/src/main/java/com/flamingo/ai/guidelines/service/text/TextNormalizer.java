package com.flamingo.ai.guidelines.service.text;

import com.google.common.base.CharMatcher;
import com.google.common.base.Splitter;
import com.google.common.collect.Iterables;
import com.google.common.hash.Hashing;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

/** Whitespace normalization, token estimation and stable content hashing. */
public final class TextNormalizer {

  private static final double TOKENS_PER_WORD = 1.3;

  private static final Splitter WORD_SPLITTER =
      Splitter.on(CharMatcher.whitespace()).omitEmptyStrings();

  private TextNormalizer() {}

  /** Collapses every whitespace run, line breaks included, to one space and trims the ends. */
  public static String normalizeSpace(String text) {
    if (text == null) {
      return "";
    }
    return CharMatcher.whitespace().trimAndCollapseFrom(text, ' ');
  }

  /**
   * Estimates the token count of a text as {@code floor(max(1, words) * 1.3)}, so the result is
   * never below 1.
   */
  public static int estimateTokens(String text) {
    int words = text == null ? 0 : Iterables.size(WORD_SPLITTER.split(text));
    return (int) (Math.max(1, words) * TOKENS_PER_WORD);
  }

  /** Lower-hex SHA-256 of the UTF-8 bytes of the text. */
  public static String stableHash(String text) {
    return Hashing.sha256().hashString(text, StandardCharsets.UTF_8).toString();
  }

  /** Key used to detect near-duplicate chunk text: whitespace collapsed and lower-cased. */
  public static String dedupKey(String text) {
    return normalizeSpace(text).toLowerCase(Locale.ROOT);
  }
}
