package com.flamingo.ai.guidelines.config;

import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import java.time.Duration;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * OpenAI-compatible embedding model shared by ingestion (chunk vectors) and retrieval (query
 * vectors). Both sides must use the same model and dimensions as the chunk index mapping.
 */
@Configuration
@Slf4j
public class LangChain4jConfig {

  @Value("${langchain4j.openai.api-key:}")
  private String apiKey;

  @Value("${langchain4j.openai.base-url:}")
  private String baseUrl;

  @Value("${langchain4j.openai.embedding-model.model-name:text-embedding-3-small}")
  private String modelName;

  @Value("${langchain4j.openai.embedding-model.dimensions:1536}")
  private int dimensions;

  @Value("${langchain4j.openai.embedding-model.max-segments-per-batch:256}")
  private int maxSegmentsPerBatch;

  @Value("${langchain4j.openai.embedding-model.timeout:60s}")
  private Duration timeout;

  @Bean
  public EmbeddingModel embeddingModel() {
    if (apiKey == null || apiKey.isBlank()) {
      throw new IllegalStateException(
          "Embedding API key is required. Set the OPENAI_API_KEY environment variable.");
    }
    OpenAiEmbeddingModel.OpenAiEmbeddingModelBuilder builder =
        OpenAiEmbeddingModel.builder()
            .apiKey(apiKey)
            .modelName(modelName)
            .dimensions(dimensions)
            .maxSegmentsPerBatch(maxSegmentsPerBatch)
            .timeout(timeout);
    if (baseUrl != null && !baseUrl.isBlank()) {
      builder.baseUrl(baseUrl);
    }
    log.info("Embedding model {} with {} dimensions", modelName, dimensions);
    return builder.build();
  }
}
