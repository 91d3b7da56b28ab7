package com.flamingo.ai.guidelines.exception;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.mock.web.MockHttpServletRequest;

class GlobalExceptionHandlerTest {

  private SimpleMeterRegistry meterRegistry;
  private GlobalExceptionHandler handler;
  private MockHttpServletRequest request;

  @BeforeEach
  void setUp() {
    meterRegistry = new SimpleMeterRegistry();
    handler = new GlobalExceptionHandler(meterRegistry);
    request = new MockHttpServletRequest("POST", "/api/documents/kr-1/context");
  }

  @Test
  @DisplayName("should map a storage outage to 503 with the storage code")
  void shouldMapStorageOutage() {
    BackendUnavailableException ex =
        new BackendUnavailableException(
            BackendUnavailableException.ELASTICSEARCH,
            "guideline-chunks keyword_search unavailable",
            new IOException("Connection refused"));

    ResponseEntity<ApiError> response = handler.handleBackendUnavailable(ex, request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.STORAGE_UNAVAILABLE);
    assertThat(response.getBody().getMessage()).doesNotContain("Connection refused");
    assertThat(response.getBody().getPath()).isEqualTo("/api/documents/kr-1/context");
    assertThat(response.getBody().getErrorId()).hasSize(8);
    assertThat(
            meterRegistry.counter("api_errors_total", "error_type", "backend_unavailable").count())
        .isEqualTo(1.0);
  }

  @Test
  @DisplayName("should map an unreadable source to 422 with the user message")
  void shouldMapIngestionFailure() {
    IngestionException ex =
        new IngestionException("Failed to read PDF /data/kr-1.pdf: EOF", new IOException("EOF"));

    ResponseEntity<ApiError> response = handler.handleIngestion(ex, request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.UNPROCESSABLE_ENTITY);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INGESTION_FAILED);
    assertThat(response.getBody().getMessage()).isEqualTo(ex.getUserMessage());
  }

  @Test
  @DisplayName("should hide internal details of unexpected errors")
  void shouldHideUnexpectedErrors() {
    ResponseEntity<ApiError> response =
        handler.handleGeneric(new IllegalStateException("index mapping broken"), request);

    assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
    assertThat(response.getBody().getCode()).isEqualTo(ApiError.INTERNAL_ERROR);
    assertThat(response.getBody().getMessage()).doesNotContain("mapping");
  }
}
