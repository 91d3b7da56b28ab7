package com.flamingo.ai.guidelines.api;

import static org.assertj.core.api.Assertions.assertThat;

import com.flamingo.ai.guidelines.api.rest.GuidelineController;
import com.flamingo.ai.guidelines.api.rest.IngestionController;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.bind.annotation.RequestMapping;

/**
 * Contract tests for the REST surface.
 *
 * <ul>
 *   <li>POST /api/documents - Upload and ingest a guideline PDF
 *   <li>POST /api/documents/{docId}/context - Retrieve packed context
 *   <li>DELETE /api/documents/{docId} - Delete a guideline
 *   <li>POST /api/ingestion/batch - Ingest a manifest directory
 * </ul>
 */
class ApiContractTest {

  @Nested
  @DisplayName("GuidelineController API contract")
  class GuidelineControllerContract {

    @Test
    @DisplayName("should be mapped to /api/documents")
    void shouldBeMappedToApiDocuments() {
      RequestMapping mapping = GuidelineController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/documents");
    }
  }

  @Nested
  @DisplayName("IngestionController API contract")
  class IngestionControllerContract {

    @Test
    @DisplayName("should be mapped to /api/ingestion")
    void shouldBeMappedToApiIngestion() {
      RequestMapping mapping = IngestionController.class.getAnnotation(RequestMapping.class);
      assertThat(mapping).isNotNull();
      assertThat(mapping.value()).containsExactly("/api/ingestion");
    }
  }
}
