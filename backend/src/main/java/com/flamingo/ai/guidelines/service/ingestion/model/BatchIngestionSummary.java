package com.flamingo.ai.guidelines.service.ingestion.model;

import java.util.List;

/**
 * Outcome of a batch ingestion run.
 *
 * @param docsTotal manifest rows considered
 * @param docsIngested documents written
 * @param docsSkipped duplicates, checkpointed and invalid rows
 * @param docs one summary per considered row, in processing order
 * @param unmatchedFiles PDFs in the input directory that no manifest row refers to
 * @param runtimeSeconds wall time of the run
 */
public record BatchIngestionSummary(
    int docsTotal,
    int docsIngested,
    int docsSkipped,
    List<IngestionSummary> docs,
    List<String> unmatchedFiles,
    double runtimeSeconds) {}
