package com.flamingo.ai.guidelines.api.rest;

import com.flamingo.ai.guidelines.api.dto.request.BatchIngestionRequest;
import com.flamingo.ai.guidelines.service.ingestion.BatchIngestionService;
import com.flamingo.ai.guidelines.service.ingestion.model.BatchIngestionSummary;
import jakarta.validation.Valid;
import java.nio.file.Path;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for batch ingestion from a server-side directory. */
@RestController
@RequestMapping("/api/ingestion")
@RequiredArgsConstructor
public class IngestionController {

  private final BatchIngestionService batchIngestionService;

  /** Ingests every manifest row of a directory; runs synchronously. */
  @PostMapping("/batch")
  public ResponseEntity<BatchIngestionSummary> ingestBatch(
      @Valid @RequestBody BatchIngestionRequest request) {
    Path inputDir = Path.of(request.getInputDir());
    Path manifest = Path.of(request.getManifestPath());
    BatchIngestionSummary summary =
        request.getCheckpointFile() == null || request.getCheckpointFile().isBlank()
            ? batchIngestionService.ingestDirectory(inputDir, manifest)
            : batchIngestionService.ingestDirectory(
                inputDir, manifest, Path.of(request.getCheckpointFile()));
    return ResponseEntity.ok(summary);
  }
}
