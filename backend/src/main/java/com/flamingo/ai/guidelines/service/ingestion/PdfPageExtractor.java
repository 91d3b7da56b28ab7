package com.flamingo.ai.guidelines.service.ingestion;

import com.flamingo.ai.guidelines.exception.IngestionException;
import com.flamingo.ai.guidelines.service.ingestion.model.ExtractedPdf;
import com.flamingo.ai.guidelines.service.ingestion.model.PageText;
import com.flamingo.ai.guidelines.service.ingestion.model.TocEntry;
import com.flamingo.ai.guidelines.service.text.TextNormalizer;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.apache.pdfbox.text.PDFTextStripper;
import org.springframework.stereotype.Service;

/**
 * Reads per-page text and the native outline of a PDF with Apache PDFBox.
 *
 * <p>Page text is whitespace-normalized, so each page reaches the chunker as one paragraph. Outline
 * entries whose destination cannot be resolved start on page 1.
 */
@Service
@Slf4j
public class PdfPageExtractor {

  public ExtractedPdf extract(Path pdfPath) {
    try (PDDocument document = Loader.loadPDF(pdfPath.toFile())) {
      return extract(document);
    } catch (IOException e) {
      log.error("PDFBox failed to read {}: {}", pdfPath, e.getMessage());
      throw new IngestionException("Failed to read PDF " + pdfPath + ": " + e.getMessage(), e);
    }
  }

  public ExtractedPdf extract(byte[] pdfBytes) {
    try (PDDocument document = Loader.loadPDF(pdfBytes)) {
      return extract(document);
    } catch (IOException e) {
      log.error("PDFBox failed to read uploaded PDF: {}", e.getMessage());
      throw new IngestionException("Failed to read uploaded PDF: " + e.getMessage(), e);
    }
  }

  private ExtractedPdf extract(PDDocument document) throws IOException {
    List<PageText> pages = extractPages(document);
    List<TocEntry> toc = extractOutline(document);
    log.debug("Extracted {} pages and {} outline entries", pages.size(), toc.size());
    return new ExtractedPdf(pages, toc);
  }

  private List<PageText> extractPages(PDDocument document) throws IOException {
    PDFTextStripper stripper = new PDFTextStripper();
    int pageCount = document.getNumberOfPages();
    List<PageText> pages = new ArrayList<>(pageCount);
    for (int page = 1; page <= pageCount; page++) {
      stripper.setStartPage(page);
      stripper.setEndPage(page);
      pages.add(new PageText(page, TextNormalizer.normalizeSpace(stripper.getText(document))));
    }
    return pages;
  }

  private List<TocEntry> extractOutline(PDDocument document) throws IOException {
    List<TocEntry> entries = new ArrayList<>();
    PDDocumentOutline outline = document.getDocumentCatalog().getDocumentOutline();
    if (outline != null) {
      walkOutline(outline.children(), 1, document, entries);
    }
    return entries;
  }

  private void walkOutline(
      Iterable<PDOutlineItem> items, int level, PDDocument document, List<TocEntry> entries)
      throws IOException {
    for (PDOutlineItem item : items) {
      entries.add(new TocEntry(level, item.getTitle(), destinationPage(item, document)));
      walkOutline(item.children(), level + 1, document, entries);
    }
  }

  private int destinationPage(PDOutlineItem item, PDDocument document) throws IOException {
    PDPage page = item.findDestinationPage(document);
    if (page == null) {
      return 1;
    }
    int index = document.getPages().indexOf(page);
    return index >= 0 ? index + 1 : 1;
  }
}
