package com.flamingo.ai.guidelines.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.guidelines.exception.IngestionException;
import com.flamingo.ai.guidelines.service.ingestion.model.ExtractedPdf;
import com.flamingo.ai.guidelines.service.ingestion.model.PageText;
import com.flamingo.ai.guidelines.service.ingestion.model.TocEntry;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.destination.PDPageFitDestination;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDDocumentOutline;
import org.apache.pdfbox.pdmodel.interactive.documentnavigation.outline.PDOutlineItem;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PdfPageExtractorTest {

  private static byte[] guidelinePdf;

  private final PdfPageExtractor extractor = new PdfPageExtractor();

  @BeforeAll
  static void createPdf() throws IOException {
    try (PDDocument document = new PDDocument()) {
      PDType1Font font = new PDType1Font(Standard14Fonts.FontName.HELVETICA);
      List<PDPage> pages = new ArrayList<>();
      for (String line :
          List.of(
              "1 Introduction   Hypertension basics",
              "2 Treatment  ACE inhibitors first",
              "Dosing    table")) {
        PDPage page = new PDPage();
        document.addPage(page);
        pages.add(page);
        try (PDPageContentStream content = new PDPageContentStream(document, page)) {
          content.beginText();
          content.setFont(font, 12);
          content.newLineAtOffset(72, 700);
          content.showText(line);
          content.endText();
        }
      }

      PDDocumentOutline outline = new PDDocumentOutline();
      document.getDocumentCatalog().setDocumentOutline(outline);
      PDOutlineItem introduction = outlineItem("1 Introduction", pages.get(0));
      PDOutlineItem treatment = outlineItem("2 Treatment", pages.get(1));
      treatment.addLast(outlineItem("2.1 Dosing", pages.get(2)));
      PDOutlineItem unresolved = new PDOutlineItem();
      unresolved.setTitle("Appendix");
      outline.addLast(introduction);
      outline.addLast(treatment);
      outline.addLast(unresolved);

      ByteArrayOutputStream out = new ByteArrayOutputStream();
      document.save(out);
      guidelinePdf = out.toByteArray();
    }
  }

  private static PDOutlineItem outlineItem(String title, PDPage page) {
    PDPageFitDestination destination = new PDPageFitDestination();
    destination.setPage(page);
    PDOutlineItem item = new PDOutlineItem();
    item.setTitle(title);
    item.setDestination(destination);
    return item;
  }

  @Nested
  @DisplayName("extract")
  class ExtractTests {

    @Test
    @DisplayName("should return whitespace-normalized text per page")
    void shouldExtractPages() {
      ExtractedPdf pdf = extractor.extract(guidelinePdf);

      assertThat(pdf.pages()).extracting(PageText::pageNumber).containsExactly(1, 2, 3);
      assertThat(pdf.pages().get(0).text()).isEqualTo("1 Introduction Hypertension basics");
      assertThat(pdf.pages().get(2).text()).isEqualTo("Dosing table");
    }

    @Test
    @DisplayName("should flatten the outline with levels and resolved pages")
    void shouldExtractOutline() {
      ExtractedPdf pdf = extractor.extract(guidelinePdf);

      assertThat(pdf.toc())
          .containsExactly(
              new TocEntry(1, "1 Introduction", 1),
              new TocEntry(1, "2 Treatment", 2),
              new TocEntry(2, "2.1 Dosing", 3),
              new TocEntry(1, "Appendix", 1));
    }

    @Test
    @DisplayName("should read a PDF from disk")
    void shouldExtractFromPath(@TempDir Path tempDir) throws IOException {
      Path file = Files.write(tempDir.resolve("kr-1.pdf"), guidelinePdf);

      assertThat(extractor.extract(file).pages()).hasSize(3);
    }

    @Test
    @DisplayName("should report unreadable content as an ingestion failure")
    void shouldRejectGarbage() {
      assertThatThrownBy(() -> extractor.extract("not a pdf".getBytes()))
          .isInstanceOf(IngestionException.class)
          .hasMessageContaining("Failed to read uploaded PDF");
    }

    @Test
    @DisplayName("should report a missing file as an ingestion failure")
    void shouldRejectMissingFile(@TempDir Path tempDir) {
      assertThatThrownBy(() -> extractor.extract(tempDir.resolve("missing.pdf")))
          .isInstanceOf(IngestionException.class);
    }
  }
}
