package com.flamingo.ai.guidelines.service.ingestion.model;

/**
 * A section boundary produced by the section detector.
 *
 * @param path heading path, e.g. {@code "3.2.1 Diagnosis criteria"}
 * @param order dense position within the document, from 0
 * @param level depth in the heading hierarchy, from 1
 * @param pageStart first page, inclusive
 * @param pageEnd last page, inclusive, never before {@code pageStart}
 */
public record DetectedSection(String path, int order, int level, int pageStart, int pageEnd) {}
