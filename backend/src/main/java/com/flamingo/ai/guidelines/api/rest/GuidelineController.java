package com.flamingo.ai.guidelines.api.rest;

import com.flamingo.ai.guidelines.api.dto.request.ContextRequest;
import com.flamingo.ai.guidelines.api.dto.response.ChunkResponse;
import com.flamingo.ai.guidelines.api.dto.response.ContextResponse;
import com.flamingo.ai.guidelines.domain.enums.IngestionStatus;
import com.flamingo.ai.guidelines.domain.model.ChunkRecord;
import com.flamingo.ai.guidelines.exception.IngestionException;
import com.flamingo.ai.guidelines.service.ingestion.GuidelineIngestionService;
import com.flamingo.ai.guidelines.service.ingestion.model.DocumentMetadata;
import com.flamingo.ai.guidelines.service.ingestion.model.IngestionSummary;
import com.flamingo.ai.guidelines.service.rag.ContextRetrievalService;
import jakarta.validation.Valid;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

/** REST controller for single guidelines: upload, context retrieval and deletion. */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class GuidelineController {

  private final GuidelineIngestionService ingestionService;
  private final ContextRetrievalService contextRetrievalService;

  /** Ingests an uploaded guideline PDF. */
  @PostMapping(consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
  public ResponseEntity<IngestionSummary> uploadGuideline(
      @RequestParam("file") MultipartFile file,
      @RequestParam("docId") String docId,
      @RequestParam(value = "title", required = false) String title,
      @RequestParam(value = "year", required = false) Integer year,
      @RequestParam(value = "specialty", required = false) String specialty,
      @RequestParam(value = "sourceUrl", required = false) String sourceUrl) {
    if (file.isEmpty()) {
      throw new IllegalArgumentException("Uploaded file is empty");
    }
    byte[] content;
    try {
      content = file.getBytes();
    } catch (IOException e) {
      throw new IngestionException("Cannot read uploaded file: " + e.getMessage(), e);
    }
    String fileName = file.getOriginalFilename() != null ? file.getOriginalFilename() : docId;
    DocumentMetadata metadata =
        DocumentMetadata.builder()
            .docId(docId)
            .title(title)
            .year(year)
            .specialty(specialty)
            .sourceUrl(sourceUrl)
            .attributes(Map.of("filename", fileName))
            .build();
    IngestionSummary summary = ingestionService.ingestPdf(content, fileName, metadata);
    HttpStatus status =
        summary.status() == IngestionStatus.INGESTED ? HttpStatus.CREATED : HttpStatus.OK;
    return ResponseEntity.status(status).body(summary);
  }

  /** Retrieves packed context for a query. */
  @PostMapping("/{docId}/context")
  public ResponseEntity<ContextResponse> retrieveContext(
      @PathVariable String docId, @Valid @RequestBody ContextRequest request) {
    List<ChunkRecord> packed =
        contextRetrievalService.retrieveContext(docId, request.getQuery(), request.toFilters());
    ContextResponse response =
        ContextResponse.builder()
            .docId(docId)
            .count(packed.size())
            .chunks(packed.stream().map(ChunkResponse::from).toList())
            .context(contextRetrievalService.buildContext(packed))
            .build();
    return ResponseEntity.ok(response);
  }

  /** Deletes a guideline with everything derived from it. */
  @DeleteMapping("/{docId}")
  public ResponseEntity<Void> deleteGuideline(@PathVariable String docId) {
    ingestionService.deleteDocument(docId);
    return ResponseEntity.noContent().build();
  }
}
