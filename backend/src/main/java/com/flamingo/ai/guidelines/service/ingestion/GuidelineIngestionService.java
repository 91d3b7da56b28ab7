package com.flamingo.ai.guidelines.service.ingestion;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.enums.IngestionStatus;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineChunk;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineDocument;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineRecommendation;
import com.flamingo.ai.guidelines.elasticsearch.GuidelineSection;
import com.flamingo.ai.guidelines.exception.IngestionException;
import com.flamingo.ai.guidelines.service.ingestion.model.DetectedSection;
import com.flamingo.ai.guidelines.service.ingestion.model.DocumentMetadata;
import com.flamingo.ai.guidelines.service.ingestion.model.ExtractedPdf;
import com.flamingo.ai.guidelines.service.ingestion.model.IngestionSummary;
import com.flamingo.ai.guidelines.service.ingestion.model.PageText;
import com.flamingo.ai.guidelines.service.ingestion.model.TocEntry;
import com.flamingo.ai.guidelines.service.observe.PipelineObserver;
import com.flamingo.ai.guidelines.service.rag.EmbeddingService;
import com.flamingo.ai.guidelines.service.text.EntityTermExtractor;
import com.flamingo.ai.guidelines.service.text.TextNormalizer;
import com.flamingo.ai.guidelines.store.KnowledgeStore;
import com.google.common.io.Files;
import io.micrometer.core.annotation.Timed;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests one guideline: detect sections, chunk, classify, embed and persist.
 *
 * <p>Writes follow a fixed order so that every reference points at a stored record: the document,
 * then its sections, then each chunk with its section and document links, and finally a
 * recommendation for every recommendation or algorithm chunk. A document whose content hash is
 * already stored is skipped without writing anything.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GuidelineIngestionService {

  private final SectionDetector sectionDetector;
  private final StructuralChunker chunker;
  private final ChunkClassifier classifier;
  private final EntityTermExtractor entityTermExtractor;
  private final PdfPageExtractor pdfPageExtractor;
  private final EmbeddingService embeddingService;
  private final KnowledgeStore store;
  private final PipelineObserver observer;
  private final ObjectMapper objectMapper;

  /** A chunk computed from a section before anything is stored. */
  private record PendingChunk(DetectedSection section, String text, ChunkType type) {}

  /** Reads a PDF from disk and ingests it; the title defaults to the file name. */
  public IngestionSummary ingestPdf(Path pdfPath, DocumentMetadata metadata) {
    ExtractedPdf pdf = pdfPageExtractor.extract(pdfPath);
    String fileName = pdfPath.getFileName().toString();
    return ingestDocument(pdf.pages(), pdf.toc(), withDefaultTitle(metadata, fileName));
  }

  /** Ingests an uploaded PDF. */
  public IngestionSummary ingestPdf(byte[] pdfBytes, String fileName, DocumentMetadata metadata) {
    ExtractedPdf pdf = pdfPageExtractor.extract(pdfBytes);
    return ingestDocument(pdf.pages(), pdf.toc(), withDefaultTitle(metadata, fileName));
  }

  /**
   * Ingests a document from its page texts and outline.
   *
   * @param pages whitespace-normalized page texts in page order
   * @param toc native outline entries, may be empty
   * @param metadata document metadata; {@code docId} is required
   * @return the ingestion outcome
   * @throws IllegalArgumentException if the document id is blank
   * @throws com.flamingo.ai.guidelines.exception.BackendUnavailableException if storage or the
   *     embedding model fails
   */
  @Timed(value = "guideline.ingest", description = "Time to ingest one guideline")
  public IngestionSummary ingestDocument(
      List<PageText> pages, List<TocEntry> toc, DocumentMetadata metadata) {
    if (metadata == null || metadata.docId() == null || metadata.docId().isBlank()) {
      throw new IllegalArgumentException("Document id is required");
    }
    long startNanos = System.nanoTime();
    String docId = metadata.docId();
    observer.onIngestionStarted(docId, pages.size());

    String contentHash =
        TextNormalizer.stableHash(
            pages.stream().map(PageText::text).collect(Collectors.joining("\n")));
    if (store.findDocumentByContentHash(contentHash).isPresent()) {
      log.info("Skip duplicate document hash doc_id={}", docId);
      IngestionSummary summary =
          IngestionSummary.skipped(
              docId,
              IngestionStatus.SKIPPED_DUPLICATE,
              pages.size(),
              elapsedSeconds(startNanos),
              "A document with identical content is already stored");
      observer.onIngestionFinished(summary);
      return summary;
    }

    store.upsertDocument(toDocument(metadata, contentHash));

    List<DetectedSection> sections = sectionDetector.detect(pages, toc);
    Map<String, String> sectionIds = new HashMap<>();
    for (DetectedSection section : sections) {
      sectionIds.put(section.path(), store.upsertSection(toSection(docId, section)));
    }

    List<PendingChunk> pending = new ArrayList<>();
    int emptySections = 0;
    for (DetectedSection section : sections) {
      String sectionText = chunker.sectionText(section, pages);
      if (sectionText.isEmpty()) {
        emptySections++;
        continue;
      }
      for (String text : chunker.split(sectionText)) {
        pending.add(new PendingChunk(section, text, classifier.classify(text, section.path())));
      }
    }

    List<List<Float>> embeddings =
        embeddingService.embedTexts(pending.stream().map(PendingChunk::text).toList());

    // chunks of an earlier version of this doc id would otherwise mix into retrieval
    long replaced = store.deleteChunksByDocId(docId);
    if (replaced > 0) {
      log.info("Replacing {} chunks of an earlier version of doc_id={}", replaced, docId);
    }

    int totalTokens = 0;
    int reused = 0;
    Set<String> storedHashes = new HashSet<>();
    for (int order = 0; order < pending.size(); order++) {
      PendingChunk chunk = pending.get(order);
      GuidelineChunk record = toChunk(docId, chunk, order, embeddings.get(order));
      totalTokens += record.getTokenCount();

      String chunkId = store.upsertChunk(record);
      if (!storedHashes.add(record.getChunkHash()) || !chunkId.equals(record.getChunkId())) {
        reused++;
      }
      String sectionId = sectionIds.get(chunk.section().path());
      if (sectionId != null) {
        store.linkChunkToSection(chunkId, sectionId);
      }
      store.linkChunkToDocument(chunkId, docId);

      if (chunk.type().isPrioritized()) {
        String recommendationId =
            store.upsertRecommendation(
                GuidelineRecommendation.builder()
                    .recommendationId(TextNormalizer.stableHash(docId + "|" + chunk.text()))
                    .docId(docId)
                    .statement(chunk.text())
                    .build());
        store.linkRecommendationToChunk(recommendationId, chunkId);
      }
    }
    store.refresh();

    double avgTokens = Math.round(100.0 * totalTokens / Math.max(1, pending.size())) / 100.0;
    IngestionSummary summary =
        IngestionSummary.builder()
            .docId(docId)
            .status(IngestionStatus.INGESTED)
            .pages(pages.size())
            .sections(sections.size())
            .chunks(pending.size())
            .reusedChunks(reused)
            .emptySections(emptySections)
            .avgTokens(avgTokens)
            .runtimeSeconds(elapsedSeconds(startNanos))
            .build();
    observer.onIngestionFinished(summary);
    return summary;
  }

  /**
   * Removes a document with its recommendations, sections and chunks.
   *
   * @throws IllegalArgumentException if the document id is blank
   */
  public void deleteDocument(String docId) {
    if (docId == null || docId.isBlank()) {
      throw new IllegalArgumentException("Document id is required");
    }
    store.deleteByDocId(docId);
  }

  private GuidelineDocument toDocument(DocumentMetadata metadata, String contentHash) {
    return GuidelineDocument.builder()
        .docId(metadata.docId())
        .title(metadata.title() != null ? metadata.title() : metadata.docId())
        .year(metadata.year())
        .specialty(metadata.specialty())
        .sourceUrl(metadata.sourceUrl())
        .contentHash(contentHash)
        .createdAt(Instant.now())
        .metadataJson(toJson(metadata))
        .build();
  }

  private static GuidelineSection toSection(String docId, DetectedSection section) {
    return GuidelineSection.builder()
        .sectionId(TextNormalizer.stableHash(docId + "|" + section.path()))
        .docId(docId)
        .path(section.path())
        .order(section.order())
        .level(section.level())
        .pageStart(section.pageStart())
        .pageEnd(section.pageEnd())
        .build();
  }

  private GuidelineChunk toChunk(
      String docId, PendingChunk chunk, int order, List<Float> embedding) {
    DetectedSection section = chunk.section();
    String chunkHash = TextNormalizer.stableHash(docId + "|" + section.path() + "|" + chunk.text());
    String chunkId =
        TextNormalizer.stableHash(
            docId + "|" + section.path() + "|" + section.pageStart() + "|" + chunkHash);
    return GuidelineChunk.builder()
        .chunkId(chunkId)
        .docId(docId)
        .sectionPath(section.path())
        .order(order)
        .pageStart(section.pageStart())
        .pageEnd(section.pageEnd())
        .text(chunk.text())
        .chunkType(chunk.type())
        .tokenCount(TextNormalizer.estimateTokens(chunk.text()))
        .chunkHash(chunkHash)
        .entityMentions(entityTermExtractor.mentions(chunk.text()))
        .embedding(embedding)
        .build();
  }

  private String toJson(DocumentMetadata metadata) {
    try {
      return objectMapper.writeValueAsString(metadata);
    } catch (JsonProcessingException e) {
      throw new IngestionException(
          "Cannot serialize metadata of doc_id=" + metadata.docId() + ": " + e.getMessage(), e);
    }
  }

  private static DocumentMetadata withDefaultTitle(DocumentMetadata metadata, String fileName) {
    if (metadata.title() != null && !metadata.title().isBlank()) {
      return metadata;
    }
    return DocumentMetadata.builder()
        .docId(metadata.docId())
        .title(Files.getNameWithoutExtension(fileName))
        .year(metadata.year())
        .specialty(metadata.specialty())
        .sourceUrl(metadata.sourceUrl())
        .attributes(metadata.attributes())
        .build();
  }

  private static double elapsedSeconds(long startNanos) {
    return Math.round((System.nanoTime() - startNanos) / 1_000_000.0) / 1000.0;
  }
}
