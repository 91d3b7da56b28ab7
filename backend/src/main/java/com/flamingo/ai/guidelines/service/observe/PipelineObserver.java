package com.flamingo.ai.guidelines.service.observe;

import com.flamingo.ai.guidelines.service.ingestion.model.IngestionSummary;

/**
 * Receives progress events from ingestion and retrieval.
 *
 * <p>Implementations must not throw; pipeline results never depend on an observer.
 */
public interface PipelineObserver {

  void onIngestionStarted(String docId, int pages);

  void onIngestionFinished(IngestionSummary summary);

  /**
   * Called after each retrieval stage.
   *
   * @param docId document being queried
   * @param stage the stage that just completed
   * @param count number of chunks the stage produced
   */
  void onRetrievalStage(String docId, RetrievalStage stage, int count);
}
