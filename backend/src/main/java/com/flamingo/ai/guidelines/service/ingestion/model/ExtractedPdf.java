package com.flamingo.ai.guidelines.service.ingestion.model;

import java.util.List;

/**
 * Text and outline read from a PDF.
 *
 * @param pages page texts in page order
 * @param toc outline entries in outline order; empty when the PDF has no outline
 */
public record ExtractedPdf(List<PageText> pages, List<TocEntry> toc) {}
