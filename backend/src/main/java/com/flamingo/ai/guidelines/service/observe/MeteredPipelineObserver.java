package com.flamingo.ai.guidelines.service.observe;

import com.flamingo.ai.guidelines.service.ingestion.model.IngestionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/** Logs pipeline progress and records it as Micrometer meters. */
@Component
@RequiredArgsConstructor
@Slf4j
public class MeteredPipelineObserver implements PipelineObserver {

  private final MeterRegistry meterRegistry;

  @Override
  public void onIngestionStarted(String docId, int pages) {
    log.info("Ingesting doc_id={} pages={}", docId, pages);
  }

  @Override
  public void onIngestionFinished(IngestionSummary summary) {
    log.info(
        "Ingestion finished doc_id={} status={} sections={} chunks={} reused={} runtime={}s",
        summary.docId(),
        summary.status().getValue(),
        summary.sections(),
        summary.chunks(),
        summary.reusedChunks(),
        summary.runtimeSeconds());
    meterRegistry
        .counter("ingestion.documents", "status", summary.status().getValue())
        .increment();
    meterRegistry.counter("ingestion.chunks").increment(summary.chunks());
  }

  @Override
  public void onRetrievalStage(String docId, RetrievalStage stage, int count) {
    log.debug("Retrieval doc_id={} stage={} count={}", docId, stage, count);
    meterRegistry
        .summary("retrieval.stage.chunks", "stage", stage.name().toLowerCase(Locale.ROOT))
        .record(count);
  }
}
