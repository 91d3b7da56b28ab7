package com.flamingo.ai.guidelines.service.ingestion.model;

/**
 * Whitespace-normalized text of one page.
 *
 * @param pageNumber 1-based page number
 * @param text page text with whitespace runs collapsed
 */
public record PageText(int pageNumber, String text) {

  public PageText {
    text = text == null ? "" : text;
  }
}
