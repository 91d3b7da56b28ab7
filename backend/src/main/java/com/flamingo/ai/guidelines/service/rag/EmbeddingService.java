package com.flamingo.ai.guidelines.service.rag;

import com.flamingo.ai.guidelines.exception.BackendUnavailableException;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.data.segment.TextSegment;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.util.ArrayList;
import java.util.List;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Turns query and chunk text into vectors through the configured LangChain4j embedding model.
 *
 * <p>Failures surface as {@link BackendUnavailableException}; calls are never retried here.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EmbeddingService {

  // text-embedding-3-small accepts 8192 tokens; Cyrillic text can run close to 1 char per token
  static final int MAX_CHARS_PER_EMBEDDING = 5000;

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;

  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextFallback")
  public List<Float> embedText(String text) {
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      Response<Embedding> response = embeddingModel.embed(truncate(text, 0));
      List<Float> vector = toList(response.content());
      meterRegistry.counter("embedding.requests.success", "type", "single").increment();
      return vector;
    } catch (BackendUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(
          BackendUnavailableException.EMBEDDING, "Embedding request failed: " + e.getMessage(), e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.duration"));
    }
  }

  /**
   * Embeds texts in one model call.
   *
   * @return one vector per input text, in input order
   */
  @CircuitBreaker(name = "openai", fallbackMethod = "embedTextsFallback")
  public List<List<Float>> embedTexts(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    Timer.Sample sample = Timer.start(meterRegistry);
    try {
      List<TextSegment> segments = new ArrayList<>(texts.size());
      for (int i = 0; i < texts.size(); i++) {
        segments.add(TextSegment.from(truncate(texts.get(i), i)));
      }
      List<Embedding> embeddings = embeddingModel.embedAll(segments).content();
      if (embeddings == null || embeddings.size() != texts.size()) {
        throw new BackendUnavailableException(
            BackendUnavailableException.EMBEDDING,
            "Embedding model returned "
                + (embeddings == null ? 0 : embeddings.size())
                + " vectors for "
                + texts.size()
                + " texts");
      }
      List<List<Float>> vectors = new ArrayList<>(embeddings.size());
      for (Embedding embedding : embeddings) {
        vectors.add(toList(embedding));
      }
      meterRegistry.counter("embedding.requests.success", "type", "batch").increment();
      return vectors;
    } catch (BackendUnavailableException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new BackendUnavailableException(
          BackendUnavailableException.EMBEDDING,
          "Batch embedding request failed: " + e.getMessage(),
          e);
    } finally {
      sample.stop(meterRegistry.timer("embedding.batch.duration"));
    }
  }

  private String truncate(String text, int index) {
    if (text.length() <= MAX_CHARS_PER_EMBEDDING) {
      return text;
    }
    log.warn(
        "Text {} too long for embedding, truncating from {} chars to {} chars",
        index,
        text.length(),
        MAX_CHARS_PER_EMBEDDING);
    return text.substring(0, MAX_CHARS_PER_EMBEDDING);
  }

  private static List<Float> toList(Embedding embedding) {
    float[] vector = embedding == null ? new float[0] : embedding.vector();
    if (vector.length == 0) {
      throw new BackendUnavailableException(
          BackendUnavailableException.EMBEDDING, "Embedding model returned an empty vector");
    }
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedTextFallback(String text, Throwable t) {
    log.error("Embedding failed, circuit breaker: {}", t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "single").increment();
    throw asUnavailable(t);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedTextsFallback(List<String> texts, Throwable t) {
    log.error("Batch embedding of {} texts failed: {}", texts.size(), t.getMessage());
    meterRegistry.counter("embedding.requests.failure", "type", "batch").increment();
    throw asUnavailable(t);
  }

  private static BackendUnavailableException asUnavailable(Throwable t) {
    if (t instanceof BackendUnavailableException unavailable) {
      return unavailable;
    }
    return new BackendUnavailableException(
        BackendUnavailableException.EMBEDDING, "Embedding model unavailable: " + t.getMessage(), t);
  }
}
