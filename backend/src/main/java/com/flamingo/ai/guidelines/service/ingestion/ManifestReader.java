package com.flamingo.ai.guidelines.service.ingestion;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.flamingo.ai.guidelines.exception.IngestionException;
import com.flamingo.ai.guidelines.service.ingestion.model.DocumentMetadata;
import com.flamingo.ai.guidelines.service.ingestion.model.ManifestRecord;
import com.google.common.primitives.Ints;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Reads a batch manifest describing the guidelines to ingest.
 *
 * <p>Accepted layouts:
 *
 * <ul>
 *   <li>CSV with a header row; a missing file name is derived as {@code <doc_id>.pdf}
 *   <li>a JSON array of rows
 *   <li>a JSON object with a {@code documents} array of rows
 *   <li>a JSON object keyed by file name whose values are rows
 * </ul>
 *
 * <p>Column aliases: {@code doc_id}/{@code ID}/{@code id}, {@code title}/{@code Наименование},
 * {@code filename}/{@code file}. A year is kept only when it is all digits. When a row has no
 * document id, the file name without extension is used. A later row with the same key replaces an
 * earlier one.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ManifestReader {

  private static final char BOM = '\uFEFF';

  private final ObjectMapper objectMapper;

  /**
   * Reads and normalizes every manifest row.
   *
   * @throws IngestionException if the file cannot be read or has an unsupported layout
   */
  public List<ManifestRecord> read(Path manifestPath) {
    String content;
    try {
      content = Files.readString(manifestPath, StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IngestionException(
          "Cannot read manifest " + manifestPath + ": " + e.getMessage(),
          "The manifest file could not be read.",
          e);
    }
    if (!content.isEmpty() && content.charAt(0) == BOM) {
      content = content.substring(1);
    }

    Map<String, ManifestRecord> records;
    try {
      records =
          manifestPath.toString().toLowerCase(Locale.ROOT).endsWith(".csv")
              ? fromCsv(content)
              : fromJson(objectMapper.readTree(content));
    } catch (IOException e) {
      throw new IngestionException(
          "Malformed manifest " + manifestPath + ": " + e.getMessage(),
          "The manifest file is malformed.",
          e);
    }
    log.info("Loaded {} manifest records from {}", records.size(), manifestPath);
    return new ArrayList<>(records.values());
  }

  private Map<String, ManifestRecord> fromCsv(String content) throws IOException {
    CsvMapper csvMapper = new CsvMapper();
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    Map<String, ManifestRecord> records = new LinkedHashMap<>();
    try (MappingIterator<Map<String, String>> rows =
        csvMapper.readerForMapOf(String.class).with(schema).readValues(content)) {
      int index = 0;
      while (rows.hasNext()) {
        index++;
        Map<String, Object> row = new LinkedHashMap<>();
        rows.next().forEach((column, value) -> row.put(column.trim(), value));
        String filename = firstText(row, "filename", "file");
        String docId = firstText(row, "doc_id", "ID", "id");
        if (filename.isEmpty() && !docId.isEmpty()) {
          filename = docId + ".pdf";
        }
        put(records, filename.isEmpty() ? "#" + index : filename, filename, row);
      }
    }
    return records;
  }

  private Map<String, ManifestRecord> fromJson(JsonNode root) {
    if (root.isArray()) {
      return fromRows(root);
    }
    if (root.isObject()) {
      JsonNode documents = root.get("documents");
      if (documents != null && documents.isArray()) {
        return fromRows(documents);
      }
      Map<String, ManifestRecord> records = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = root.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        if (!field.getValue().isObject()) {
          continue;
        }
        Map<String, Object> row = toRow(field.getValue());
        String key = field.getKey().trim();
        put(records, key, firstText(row, "filename", "file"), row);
      }
      return records;
    }
    throw new IngestionException(
        "Unsupported manifest JSON layout: " + root.getNodeType(),
        "The manifest must be a JSON array or object.",
        null);
  }

  private Map<String, ManifestRecord> fromRows(JsonNode rows) {
    Map<String, ManifestRecord> records = new LinkedHashMap<>();
    int index = 0;
    for (JsonNode node : rows) {
      index++;
      if (!node.isObject()) {
        log.warn("Ignoring manifest row {}: not an object", index);
        continue;
      }
      Map<String, Object> row = toRow(node);
      String filename = firstText(row, "filename", "file");
      // rows without a file name still get a distinct key so they show up as invalid input
      String key = filename.isEmpty() ? "#" + index : filename;
      put(records, key, filename, row);
    }
    return records;
  }

  private void put(
      Map<String, ManifestRecord> records, String key, String filename, Map<String, Object> row) {
    records.put(key, new ManifestRecord(key, filename, toMetadata(row, key)));
  }

  static DocumentMetadata toMetadata(Map<String, Object> row, String key) {
    String docId = firstText(row, "doc_id", "ID", "id");
    if (docId.isEmpty() && !key.isEmpty() && !key.startsWith("#")) {
      docId = com.google.common.io.Files.getNameWithoutExtension(key).trim();
    }
    String title = firstText(row, "title", "Наименование");
    return DocumentMetadata.builder()
        .docId(docId)
        .title(title.isEmpty() ? null : title)
        .year(parseYear(row.get("year")))
        .specialty(emptyToNull(firstText(row, "specialty")))
        .sourceUrl(emptyToNull(firstText(row, "source_url")))
        .attributes(row)
        .build();
  }

  /** All-digit years only; values outside the {@code int} range are treated as unknown. */
  static Integer parseYear(Object value) {
    if (value instanceof Number number) {
      long year = number.longValue();
      return year == number.doubleValue() && year >= 0 && year <= Integer.MAX_VALUE
          ? (int) year
          : null;
    }
    if (value instanceof String text) {
      String stripped = text.trim();
      if (!stripped.isEmpty() && stripped.chars().allMatch(Character::isDigit)) {
        Integer year = Ints.tryParse(stripped);
        if (year == null) {
          log.warn("Ignoring out-of-range manifest year '{}'", stripped);
        }
        return year;
      }
    }
    return null;
  }

  private static String firstText(Map<String, Object> row, String... columns) {
    for (String column : columns) {
      Object value = row.get(column);
      if (value != null && !String.valueOf(value).isBlank()) {
        return String.valueOf(value).trim();
      }
    }
    return "";
  }

  private static String emptyToNull(String value) {
    return value.isEmpty() ? null : value;
  }

  @SuppressWarnings("unchecked")
  private Map<String, Object> toRow(JsonNode node) {
    return new LinkedHashMap<>(objectMapper.convertValue(node, Map.class));
  }
}
