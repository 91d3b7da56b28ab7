package com.flamingo.ai.guidelines.service.ingestion;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.flamingo.ai.guidelines.exception.IngestionException;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * JSON file mapping document ids to {@code "done"}, rewritten after every successful ingestion so
 * an interrupted batch can resume. A missing file is an empty checkpoint.
 */
@Slf4j
public class IngestionCheckpoint {

  static final String DONE = "done";

  private final Path file;
  private final ObjectMapper objectMapper;
  private final Map<String, String> entries;

  private IngestionCheckpoint(Path file, ObjectMapper objectMapper, Map<String, String> entries) {
    this.file = file;
    this.objectMapper = objectMapper;
    this.entries = entries;
  }

  public static IngestionCheckpoint load(Path file, ObjectMapper objectMapper) {
    if (!Files.isRegularFile(file)) {
      return new IngestionCheckpoint(file, objectMapper, new LinkedHashMap<>());
    }
    try {
      Map<String, String> entries =
          objectMapper.readValue(
              file.toFile(), new TypeReference<LinkedHashMap<String, String>>() {});
      log.info("Loaded checkpoint {} with {} entries", file, entries.size());
      return new IngestionCheckpoint(file, objectMapper, entries);
    } catch (IOException e) {
      throw new IngestionException(
          "Cannot read checkpoint " + file + ": " + e.getMessage(),
          "The ingestion checkpoint file is unreadable.",
          e);
    }
  }

  public boolean isDone(String docId) {
    return DONE.equals(entries.get(docId));
  }

  /** Marks the document done and persists the checkpoint. */
  public void markDone(String docId) {
    entries.put(docId, DONE);
    try {
      Path parent = file.toAbsolutePath().getParent();
      if (parent != null) {
        Files.createDirectories(parent);
      }
      objectMapper.writerWithDefaultPrettyPrinter().writeValue(file.toFile(), entries);
    } catch (IOException e) {
      throw new IngestionException(
          "Cannot write checkpoint " + file + ": " + e.getMessage(),
          "The ingestion checkpoint file could not be written.",
          e);
    }
  }

  public Path getFile() {
    return file;
  }
}
