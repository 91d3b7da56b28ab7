package com.flamingo.ai.guidelines.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/** Configuration properties for the segmentation and retrieval pipeline. */
@Configuration
@ConfigurationProperties(prefix = "rag")
@Getter
@Setter
public class RagConfig {

  private Chunking chunking = new Chunking();
  private Retrieval retrieval = new Retrieval();
  private Packing packing = new Packing();
  private Ingestion ingestion = new Ingestion();

  /** Token band used when grouping paragraphs into chunks. */
  @Getter
  @Setter
  public static class Chunking {
    private int minTokens = 500;
    private int maxTokens = 1200;
  }

  @Getter
  @Setter
  public static class Retrieval {
    /** Candidates requested from each hybrid stream and kept after fusion. */
    private int candidateLimit = 32;

    /** Seeds kept after reranking. */
    private int seedLimit = 12;

    /** Maximum number of chunks the graph expander may add. */
    private int expansionBudget = 8;
  }

  @Getter
  @Setter
  public static class Packing {
    private int packedMin = 6;
    private int packedMax = 12;
    private int perSectionCap = 3;
  }

  @Getter
  @Setter
  public static class Ingestion {
    private String checkpointFile = ".guideline_ingest_checkpoint.json";
  }
}
