package com.flamingo.ai.guidelines.service.ingestion;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.guidelines.config.RagConfig;
import com.flamingo.ai.guidelines.domain.enums.IngestionStatus;
import com.flamingo.ai.guidelines.exception.IngestionException;
import com.flamingo.ai.guidelines.service.ingestion.model.BatchIngestionSummary;
import com.flamingo.ai.guidelines.service.ingestion.model.IngestionSummary;
import com.flamingo.ai.guidelines.service.ingestion.model.ManifestRecord;
import io.micrometer.core.annotation.Timed;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Stream;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Ingests a directory of guideline PDFs described by a manifest.
 *
 * <p>Rows run one after another in document id order. Rows that cannot be used (no document id,
 * no matching PDF, unreadable PDF) are reported as {@link IngestionStatus#SKIPPED_INVALID_INPUT}
 * and the run goes on. Backend outages abort the run; the checkpoint keeps what already succeeded.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BatchIngestionService {

  private final ManifestReader manifestReader;
  private final GuidelineIngestionService ingestionService;
  private final RagConfig ragConfig;
  private final ObjectMapper objectMapper;

  public BatchIngestionSummary ingestDirectory(Path inputDir, Path manifestPath) {
    Path checkpointFile = Path.of(ragConfig.getIngestion().getCheckpointFile());
    return ingestDirectory(inputDir, manifestPath, checkpointFile);
  }

  /**
   * Runs a batch with an explicit checkpoint file.
   *
   * @throws IngestionException if the input directory, manifest or checkpoint cannot be read
   */
  @Timed(value = "guideline.ingest.batch", description = "Time to ingest a manifest batch")
  public BatchIngestionSummary ingestDirectory(
      Path inputDir, Path manifestPath, Path checkpointFile) {
    if (!Files.isDirectory(inputDir)) {
      throw new IngestionException("Input directory does not exist: " + inputDir);
    }
    long startNanos = System.nanoTime();
    log.info("Batch ingestion started input_dir={} manifest={}", inputDir, manifestPath);

    List<ManifestRecord> records = new ArrayList<>(manifestReader.read(manifestPath));
    records.sort(Comparator.comparing(ManifestRecord::sortKey));
    IngestionCheckpoint checkpoint = IngestionCheckpoint.load(checkpointFile, objectMapper);

    List<IngestionSummary> docs = new ArrayList<>();
    Set<String> usedFiles = new HashSet<>();
    int ingested = 0;
    int skipped = 0;

    for (ManifestRecord record : records) {
      IngestionSummary summary = ingestRecord(inputDir, record, checkpoint, usedFiles);
      docs.add(summary);
      if (summary.status() == IngestionStatus.INGESTED) {
        ingested++;
        checkpoint.markDone(summary.docId());
      } else {
        skipped++;
      }
    }

    List<String> unmatched = unmatchedPdfs(inputDir, usedFiles);
    double runtime = Math.round((System.nanoTime() - startNanos) / 1_000_000.0) / 1000.0;
    log.info(
        "Batch ingestion finished docs_total={} docs_ingested={} docs_skipped={} runtime={}s",
        records.size(),
        ingested,
        skipped,
        runtime);
    return new BatchIngestionSummary(records.size(), ingested, skipped, docs, unmatched, runtime);
  }

  private IngestionSummary ingestRecord(
      Path inputDir, ManifestRecord record, IngestionCheckpoint checkpoint, Set<String> usedFiles) {
    String docId = record.docId();
    if (docId.isBlank()) {
      log.warn("Skipping manifest record {}: empty doc_id", record.key());
      return invalid(record.key(), "Manifest record has no document id");
    }
    Optional<Path> pdf = resolvePdf(inputDir, record);
    if (pdf.isEmpty()) {
      log.warn("Skipping doc_id={}: no matching PDF found in {}", docId, inputDir);
      return invalid(docId, "No matching PDF found in " + inputDir);
    }
    usedFiles.add(pdf.get().getFileName().toString());
    if (checkpoint.isDone(docId)) {
      log.info("Skipping doc_id={}: already marked done in checkpoint", docId);
      return IngestionSummary.skipped(
          docId, IngestionStatus.SKIPPED_CHECKPOINT, 0, 0.0, "Already ingested in an earlier run");
    }
    try {
      return ingestionService.ingestPdf(pdf.get(), record.metadata());
    } catch (IngestionException e) {
      log.warn("Skipping doc_id={}: {}", docId, e.getMessage());
      return invalid(docId, e.getMessage());
    }
  }

  /**
   * Finds the PDF for a record. Candidates, first existing {@code .pdf} file wins: {@code
   * <doc_id>.pdf}, the explicit file name, the manifest key, the manifest key plus {@code .pdf}.
   */
  Optional<Path> resolvePdf(Path inputDir, ManifestRecord record) {
    Set<String> candidates = new LinkedHashSet<>();
    if (!record.docId().isBlank()) {
      candidates.add(record.docId() + ".pdf");
    }
    if (record.filename() != null && !record.filename().isBlank()) {
      candidates.add(record.filename().trim());
    }
    String key = record.key() == null ? "" : record.key().trim();
    if (!key.isEmpty()) {
      candidates.add(key);
      if (!key.toLowerCase(Locale.ROOT).endsWith(".pdf")) {
        candidates.add(key + ".pdf");
      }
    }
    for (String candidate : candidates) {
      Path path = inputDir.resolve(candidate);
      if (Files.isRegularFile(path) && isPdf(path)) {
        return Optional.of(path);
      }
    }
    return Optional.empty();
  }

  private List<String> unmatchedPdfs(Path inputDir, Set<String> usedFiles) {
    try (Stream<Path> files = Files.list(inputDir)) {
      List<String> unmatched =
          files
              .filter(Files::isRegularFile)
              .filter(BatchIngestionService::isPdf)
              .map(path -> path.getFileName().toString())
              .filter(name -> !usedFiles.contains(name))
              .sorted()
              .toList();
      unmatched.forEach(name -> log.warn("Ignoring {}: no manifest record", name));
      return unmatched;
    } catch (IOException e) {
      throw new IngestionException("Cannot list input directory " + inputDir, e);
    }
  }

  private static boolean isPdf(Path path) {
    return path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".pdf");
  }

  private static IngestionSummary invalid(String docId, String message) {
    return IngestionSummary.skipped(docId, IngestionStatus.SKIPPED_INVALID_INPUT, 0, 0.0, message);
  }
}
