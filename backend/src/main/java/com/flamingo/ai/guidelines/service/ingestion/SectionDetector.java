package com.flamingo.ai.guidelines.service.ingestion;

import com.flamingo.ai.guidelines.service.ingestion.model.DetectedSection;
import com.flamingo.ai.guidelines.service.ingestion.model.PageText;
import com.flamingo.ai.guidelines.service.ingestion.model.TocEntry;
import com.flamingo.ai.guidelines.service.text.TextNormalizer;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Derives the ordered section list of a document.
 *
 * <p>Sources are tried in order:
 *
 * <ol>
 *   <li>the native table of contents, when the PDF has one;
 *   <li>numbered headings such as {@code "3.2.1 Diagnosis criteria"} found near the top of pages;
 *   <li>a single synthetic {@code "document"} section spanning every page.
 * </ol>
 *
 * <p>A section ends on the page before the next section starts; the last section ends on the last
 * page. Pages before the first section belong to the first section.
 */
@Service
@Slf4j
public class SectionDetector {

  static final String WHOLE_DOCUMENT_PATH = "document";

  private static final Pattern HEADING = Pattern.compile("^\\s*((?:\\d+\\.){0,4}\\d+)\\s+(.+)$");
  private static final int SEGMENTS_SCANNED_PER_PAGE = 6;
  private static final int MAX_TITLE_LENGTH = 200;

  private record Heading(int level, String path, int page) {}

  /**
   * Detects sections.
   *
   * @param pages page texts in page order
   * @param toc native outline entries, may be empty
   * @return sections with dense order indices; empty only when there are no pages
   */
  public List<DetectedSection> detect(List<PageText> pages, List<TocEntry> toc) {
    if (pages.isEmpty()) {
      return List.of();
    }
    int lastPage = pages.get(pages.size() - 1).pageNumber();

    List<Heading> headings = fromToc(toc);
    String origin = "toc";
    if (headings.isEmpty()) {
      headings = fromPageText(pages);
      origin = "headings";
    }
    if (headings.isEmpty()) {
      log.debug("No table of contents or numbered headings, using one section");
      return List.of(new DetectedSection(WHOLE_DOCUMENT_PATH, 0, 1, 1, lastPage));
    }

    List<DetectedSection> sections = withBoundaries(headings, lastPage);
    log.debug("Detected {} sections from {}", sections.size(), origin);
    return sections;
  }

  private List<Heading> fromToc(List<TocEntry> toc) {
    List<Heading> headings = new ArrayList<>();
    if (toc == null) {
      return headings;
    }
    for (TocEntry entry : toc) {
      String path = TextNormalizer.normalizeSpace(entry.title());
      headings.add(new Heading(entry.level(), path, entry.page() > 0 ? entry.page() : 1));
    }
    return headings;
  }

  /** Numbered headings among the first sentence-like segments of each page, first occurrence. */
  private List<Heading> fromPageText(List<PageText> pages) {
    List<Heading> headings = new ArrayList<>();
    Set<String> seen = new HashSet<>();
    for (PageText page : pages) {
      String[] segments = page.text().split("\\. ");
      int scanned = Math.min(SEGMENTS_SCANNED_PER_PAGE, segments.length);
      for (int i = 0; i < scanned; i++) {
        Matcher matcher = HEADING.matcher(segments[i].trim());
        if (!matcher.matches()) {
          continue;
        }
        String code = matcher.group(1);
        String title = matcher.group(2);
        if (title.length() > MAX_TITLE_LENGTH) {
          title = title.substring(0, MAX_TITLE_LENGTH);
        }
        String path = (code + " " + title).trim();
        if (seen.add(path)) {
          int level = (int) code.chars().filter(c -> c == '.').count() + 1;
          headings.add(new Heading(level, path, page.pageNumber()));
        }
      }
    }
    // stable: keeps on-page order for headings of the same page
    headings.sort(Comparator.comparingInt(Heading::page));
    return headings;
  }

  private List<DetectedSection> withBoundaries(List<Heading> headings, int lastPage) {
    List<DetectedSection> sections = new ArrayList<>(headings.size());
    for (int i = 0; i < headings.size(); i++) {
      Heading heading = headings.get(i);
      int pageStart = i == 0 ? 1 : clamp(heading.page(), lastPage);
      int pageEnd =
          i + 1 < headings.size() ? clamp(headings.get(i + 1).page(), lastPage) - 1 : lastPage;
      sections.add(
          new DetectedSection(
              heading.path(), i, heading.level(), pageStart, Math.max(pageStart, pageEnd)));
    }
    return sections;
  }

  private static int clamp(int page, int lastPage) {
    return Math.max(1, Math.min(page, lastPage));
  }
}
