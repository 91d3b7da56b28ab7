package com.flamingo.ai.guidelines.service.ingestion;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.guidelines.config.RagConfig;
import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.enums.IngestionStatus;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineChunk;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineDocument;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineRecommendation;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineSection;
import com.flamingo.ai.guidelines.exception.BackendUnavailableException;
import com.flamingo.ai.guidelines.service.ingestion.model.DocumentMetadata;
import com.flamingo.ai.guidelines.service.ingestion.model.ExtractedPdf;
import com.flamingo.ai.guidelines.service.ingestion.model.IngestionSummary;
import com.flamingo.ai.guidelines.service.ingestion.model.PageText;
import com.flamingo.ai.guidelines.service.ingestion.model.TocEntry;
import com.flamingo.ai.guidelines.service.observe.PipelineObserver;
import com.flamingo.ai.guidelines.service.rag.EmbeddingService;
import com.flamingo.ai.guidelines.service.text.EntityTermExtractor;
import com.flamingo.ai.guidelines.store.KnowledgeStore;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class GuidelineIngestionServiceTest {

  private static final String DOC_ID = "kr-1";

  @Mock private PdfPageExtractor pdfPageExtractor;
  @Mock private EmbeddingService embeddingService;
  @Mock private KnowledgeStore store;
  @Mock private PipelineObserver observer;

  private GuidelineIngestionService service;

  private final List<PageText> pages =
      List.of(
          new PageText(1, "Артериальная гипертензия является распространенным заболеванием."),
          new PageText(2, "Рекомендуется назначать эналаприл пациентам с АГ."),
          new PageText(3, "Эналаприл 5 мг в сутки."));

  private final List<TocEntry> toc =
      List.of(new TocEntry(1, "1 Введение", 1), new TocEntry(1, "2 Рекомендации", 2));

  @BeforeEach
  void setUp() {
    RagConfig ragConfig = new RagConfig();
    service =
        new GuidelineIngestionService(
            new SectionDetector(),
            new StructuralChunker(ragConfig),
            new ChunkClassifier(),
            new EntityTermExtractor(),
            pdfPageExtractor,
            embeddingService,
            store,
            observer,
            new ObjectMapper());

    lenient().when(store.findDocumentByContentHash(anyString())).thenReturn(Optional.empty());
    lenient()
        .when(store.upsertSection(any(GuidelineSection.class)))
        .thenAnswer(inv -> inv.<GuidelineSection>getArgument(0).getSectionId());
    lenient()
        .when(store.upsertChunk(any(GuidelineChunk.class)))
        .thenAnswer(inv -> inv.<GuidelineChunk>getArgument(0).getChunkId());
    lenient()
        .when(store.upsertRecommendation(any(GuidelineRecommendation.class)))
        .thenAnswer(inv -> inv.<GuidelineRecommendation>getArgument(0).getRecommendationId());
    lenient()
        .when(embeddingService.embedTexts(anyList()))
        .thenAnswer(
            inv ->
                inv.<List<String>>getArgument(0).stream().map(t -> List.of(0.1f, 0.2f)).toList());
  }

  private static DocumentMetadata metadata(String title) {
    return DocumentMetadata.builder().docId(DOC_ID).title(title).year(2024).build();
  }

  @Nested
  @DisplayName("ingestDocument")
  class IngestDocumentTests {

    @Test
    @DisplayName("should write document, sections, chunks and links in order")
    void shouldWriteInOrder() {
      // When
      IngestionSummary summary = service.ingestDocument(pages, toc, metadata("Гипертензия"));

      // Then
      InOrder order = inOrder(store);
      order.verify(store).findDocumentByContentHash(anyString());
      order.verify(store).upsertDocument(any(GuidelineDocument.class));
      order.verify(store, times(2)).upsertSection(any(GuidelineSection.class));
      order.verify(store).deleteChunksByDocId(DOC_ID);
      order.verify(store).upsertChunk(any(GuidelineChunk.class));
      order.verify(store).linkChunkToSection(anyString(), anyString());
      order.verify(store).linkChunkToDocument(anyString(), eq(DOC_ID));
      order.verify(store).upsertChunk(any(GuidelineChunk.class));
      order.verify(store).linkChunkToSection(anyString(), anyString());
      order.verify(store).linkChunkToDocument(anyString(), eq(DOC_ID));
      order.verify(store).upsertRecommendation(any(GuidelineRecommendation.class));
      order.verify(store).linkRecommendationToChunk(anyString(), anyString());
      order.verify(store).refresh();

      assertThat(summary.status()).isEqualTo(IngestionStatus.INGESTED);
      assertThat(summary.pages()).isEqualTo(3);
      assertThat(summary.sections()).isEqualTo(2);
      assertThat(summary.chunks()).isEqualTo(2);
      assertThat(summary.reusedChunks()).isZero();
      assertThat(summary.emptySections()).isZero();
      assertThat(summary.avgTokens()).isPositive();
      verify(observer).onIngestionStarted(DOC_ID, 3);
      verify(observer).onIngestionFinished(summary);
    }

    @Test
    @DisplayName("should store classified, embedded chunks with section pages")
    void shouldStoreChunkFields() {
      ArgumentCaptor<GuidelineChunk> chunks = ArgumentCaptor.forClass(GuidelineChunk.class);

      service.ingestDocument(pages, toc, metadata("Гипертензия"));

      verify(store, times(2)).upsertChunk(chunks.capture());
      GuidelineChunk intro = chunks.getAllValues().get(0);
      GuidelineChunk treatment = chunks.getAllValues().get(1);
      assertThat(intro.getSectionPath()).isEqualTo("1 Введение");
      assertThat(intro.getChunkType()).isEqualTo(ChunkType.OTHER);
      assertThat(intro.getOrder()).isZero();
      assertThat(intro.getEmbedding()).containsExactly(0.1f, 0.2f);
      assertThat(treatment.getSectionPath()).isEqualTo("2 Рекомендации");
      assertThat(treatment.getChunkType()).isEqualTo(ChunkType.RECOMMENDATION);
      assertThat(treatment.getOrder()).isEqualTo(1);
      assertThat(treatment.getPageStart()).isEqualTo(2);
      assertThat(treatment.getPageEnd()).isEqualTo(3);
      assertThat(treatment.getText())
          .isEqualTo("Рекомендуется назначать эналаприл пациентам с АГ. Эналаприл 5 мг в сутки.");
      assertThat(treatment.getEntityMentions()).contains("Эналаприл");
      assertThat(treatment.getChunkHash()).isNotBlank();
      assertThat(treatment.getChunkId()).isNotEqualTo(intro.getChunkId());
    }

    @Test
    @DisplayName("should record metadata on the document")
    void shouldStoreDocumentMetadata() {
      ArgumentCaptor<GuidelineDocument> document = ArgumentCaptor.forClass(GuidelineDocument.class);

      service.ingestDocument(pages, toc, metadata("Гипертензия"));

      verify(store).upsertDocument(document.capture());
      assertThat(document.getValue().getDocId()).isEqualTo(DOC_ID);
      assertThat(document.getValue().getTitle()).isEqualTo("Гипертензия");
      assertThat(document.getValue().getYear()).isEqualTo(2024);
      assertThat(document.getValue().getContentHash()).hasSize(64);
      assertThat(document.getValue().getMetadataJson()).contains("\"docId\":\"kr-1\"");
    }

    @Test
    @DisplayName("should skip a document whose content is already stored")
    void shouldSkipDuplicateContent() {
      // Given
      when(store.findDocumentByContentHash(anyString()))
          .thenReturn(Optional.of(GuidelineDocument.builder().docId("kr-0").build()));

      // When
      IngestionSummary summary = service.ingestDocument(pages, toc, metadata(null));

      // Then
      assertThat(summary.status()).isEqualTo(IngestionStatus.SKIPPED_DUPLICATE);
      assertThat(summary.chunks()).isZero();
      verify(store, never()).upsertDocument(any());
      verify(store, never()).upsertChunk(any());
      verify(store, never()).deleteChunksByDocId(anyString());
      verifyNoInteractions(embeddingService);
      verify(observer).onIngestionFinished(summary);
    }

    @Test
    @DisplayName("should count chunks the store already had")
    void shouldCountReusedChunks() {
      when(store.upsertChunk(any(GuidelineChunk.class))).thenReturn("stored-chunk");

      IngestionSummary summary = service.ingestDocument(pages, toc, metadata(null));

      assertThat(summary.reusedChunks()).isEqualTo(2);
      verify(store, times(2)).linkChunkToDocument("stored-chunk", DOC_ID);
    }

    @Test
    @DisplayName("should count sections whose pages carry no text")
    void shouldCountEmptySections() {
      List<PageText> withBlankPage =
          List.of(new PageText(1, "Введение в тему."), new PageText(2, "  "));
      List<TocEntry> twoSections =
          List.of(new TocEntry(1, "1 Введение", 1), new TocEntry(1, "2 Приложения", 2));

      IngestionSummary summary =
          service.ingestDocument(withBlankPage, twoSections, metadata(null));

      assertThat(summary.sections()).isEqualTo(2);
      assertThat(summary.emptySections()).isEqualTo(1);
      assertThat(summary.chunks()).isEqualTo(1);
    }

    @Test
    @DisplayName("should reject metadata without a document id")
    void shouldRejectBlankDocId() {
      DocumentMetadata noId = DocumentMetadata.builder().docId(" ").build();

      assertThatThrownBy(() -> service.ingestDocument(pages, toc, noId))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(store, embeddingService);
    }

    @Test
    @DisplayName("should propagate an embedding outage after the document was written")
    void shouldPropagateEmbeddingOutage() {
      when(embeddingService.embedTexts(anyList()))
          .thenThrow(
              new BackendUnavailableException(
                  BackendUnavailableException.EMBEDDING, "Embedding model unavailable"));

      assertThatThrownBy(() -> service.ingestDocument(pages, toc, metadata(null)))
          .isInstanceOf(BackendUnavailableException.class);
      verify(store, never()).upsertChunk(any());
      verify(store, never()).deleteChunksByDocId(anyString());
      verify(store, never()).refresh();
    }

    @Test
    @DisplayName("should clear chunks of an earlier version before writing the new ones")
    void shouldReplaceChunksOfEarlierVersion() {
      // Given
      when(store.deleteChunksByDocId(DOC_ID)).thenReturn(5L);

      // When
      IngestionSummary summary = service.ingestDocument(pages, toc, metadata(null));

      // Then
      InOrder order = inOrder(embeddingService, store);
      order.verify(embeddingService).embedTexts(anyList());
      order.verify(store).deleteChunksByDocId(DOC_ID);
      order.verify(store, times(2)).upsertChunk(any(GuidelineChunk.class));
      assertThat(summary.status()).isEqualTo(IngestionStatus.INGESTED);
      assertThat(summary.chunks()).isEqualTo(2);
    }
  }

  @Nested
  @DisplayName("ingestPdf")
  class IngestPdfTests {

    @Test
    @DisplayName("should default the title to the file name")
    void shouldDefaultTitleToFileName() {
      Path pdf = Path.of("input", "kr-hypertension.pdf");
      when(pdfPageExtractor.extract(pdf)).thenReturn(new ExtractedPdf(pages, toc));
      ArgumentCaptor<GuidelineDocument> document = ArgumentCaptor.forClass(GuidelineDocument.class);

      service.ingestPdf(pdf, metadata(null));

      verify(store).upsertDocument(document.capture());
      assertThat(document.getValue().getTitle()).isEqualTo("kr-hypertension");
    }

    @Test
    @DisplayName("should keep an explicit title for uploads")
    void shouldKeepExplicitTitle() {
      byte[] bytes = {1, 2, 3};
      when(pdfPageExtractor.extract(bytes)).thenReturn(new ExtractedPdf(pages, List.of()));
      ArgumentCaptor<GuidelineDocument> document = ArgumentCaptor.forClass(GuidelineDocument.class);

      IngestionSummary summary = service.ingestPdf(bytes, "upload.pdf", metadata("Гипертензия"));

      verify(store).upsertDocument(document.capture());
      assertThat(document.getValue().getTitle()).isEqualTo("Гипертензия");
      assertThat(summary.status()).isEqualTo(IngestionStatus.INGESTED);
    }
  }

  @Nested
  @DisplayName("deleteDocument")
  class DeleteDocumentTests {

    @Test
    @DisplayName("should cascade the delete through the store")
    void shouldDelete() {
      service.deleteDocument(DOC_ID);

      verify(store).deleteByDocId(DOC_ID);
    }

    @Test
    @DisplayName("should reject a blank id")
    void shouldRejectBlankId() {
      assertThatThrownBy(() -> service.deleteDocument(""))
          .isInstanceOf(IllegalArgumentException.class);
      verifyNoInteractions(store);
    }
  }
}
