package com.flamingo.ai.guidelines.service.ingestion;

import com.flamingo.ai.guidelines.config.RagConfig;
import com.flamingo.ai.guidelines.service.ingestion.model.DetectedSection;
import com.flamingo.ai.guidelines.service.ingestion.model.PageText;
import com.flamingo.ai.guidelines.service.text.TextNormalizer;
import com.google.common.base.Splitter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Splits section text into chunks inside a token band, keeping structurally significant blocks
 * (recommendations, algorithms, tables, criteria, appendices) together.
 *
 * <p>Paragraphs are grouped into blocks: a paragraph that starts a structural element closes the
 * current block. Blocks are then accumulated until adding the next one would pass the band's upper
 * bound while the accumulation already reaches the lower bound. A structural block that alone is
 * larger than the upper bound becomes its own chunk.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StructuralChunker {

  static final Pattern STRUCTURAL_START =
      Pattern.compile(
          "\\b(рекомендац|алгоритм|таблица|критери|приложени"
              + "|recommendation|algorithm|table)",
          Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.UNICODE_CHARACTER_CLASS);

  private static final String PARAGRAPH_BREAK = "\n\n";
  private static final Splitter PARAGRAPHS =
      Splitter.on(PARAGRAPH_BREAK).trimResults().omitEmptyStrings();

  private final RagConfig ragConfig;

  /**
   * Joins the texts of the section's page range with blank lines. Missing pages count as empty.
   *
   * @return the trimmed section text, possibly empty
   */
  public String sectionText(DetectedSection section, List<PageText> pages) {
    Map<Integer, String> byPage =
        pages.stream().collect(Collectors.toMap(PageText::pageNumber, PageText::text, (a, b) -> a));
    List<String> parts = new ArrayList<>();
    for (int page = section.pageStart(); page <= section.pageEnd(); page++) {
      parts.add(byPage.getOrDefault(page, ""));
    }
    return String.join(PARAGRAPH_BREAK, parts).trim();
  }

  /**
   * Splits text into whitespace-normalized, non-empty chunks.
   *
   * @param text section text with paragraphs separated by blank lines
   * @return chunks in text order
   */
  public List<String> split(String text) {
    int minTokens = ragConfig.getChunking().getMinTokens();
    int maxTokens = ragConfig.getChunking().getMaxTokens();

    List<String> raw = new ArrayList<>();
    List<String> current = new ArrayList<>();
    int tokens = 0;

    for (String block : toBlocks(text)) {
      int blockTokens = TextNormalizer.estimateTokens(block);
      if (blockTokens > maxTokens && isStructural(block)) {
        if (!current.isEmpty()) {
          raw.add(String.join(PARAGRAPH_BREAK, current));
          current = new ArrayList<>();
          tokens = 0;
        }
        raw.add(block);
        continue;
      }
      if (tokens + blockTokens > maxTokens && tokens >= minTokens) {
        raw.add(String.join(PARAGRAPH_BREAK, current));
        current = new ArrayList<>();
        tokens = 0;
      }
      current.add(block);
      tokens += blockTokens;
    }
    if (!current.isEmpty()) {
      raw.add(String.join(PARAGRAPH_BREAK, current));
    }

    List<String> chunks =
        raw.stream()
            .map(TextNormalizer::normalizeSpace)
            .filter(Predicate.not(String::isEmpty))
            .toList();
    log.debug("Split {} chars into {} chunks", text.length(), chunks.size());
    return chunks;
  }

  private List<String> toBlocks(String text) {
    List<String> blocks = new ArrayList<>();
    List<String> carry = new ArrayList<>();
    for (String paragraph : PARAGRAPHS.split(text)) {
      if (isStructural(paragraph) && !carry.isEmpty()) {
        blocks.add(String.join(PARAGRAPH_BREAK, carry).trim());
        carry = new ArrayList<>();
      }
      carry.add(paragraph);
    }
    if (!carry.isEmpty()) {
      blocks.add(String.join(PARAGRAPH_BREAK, carry).trim());
    }
    return blocks;
  }

  static boolean isStructural(String text) {
    return STRUCTURAL_START.matcher(text).find();
  }
}
