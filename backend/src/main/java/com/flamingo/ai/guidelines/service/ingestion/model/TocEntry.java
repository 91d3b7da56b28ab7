package com.flamingo.ai.guidelines.service.ingestion.model;

/**
 * One entry of a document's native table of contents (the PDF outline).
 *
 * @param level outline depth, 1 for top-level entries
 * @param title entry title, used as the section path
 * @param page 1-based start page
 */
public record TocEntry(int level, String title, int page) {}
