package com.flamingo.ai.guidelines.api.dto.request;

import com.flamingo.ai.guidelines.domain.enums.ChunkType;
import com.flamingo.ai.guidelines.domain.model.RetrievalFilters;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import java.util.Set;
import java.util.stream.Collectors;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for context retrieval. Chunk types use their stored values, e.g. "table". */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextRequest {

  @NotBlank(message = "Query is required")
  @Size(max = 4000, message = "Query must be at most 4000 characters")
  private String query;

  private String sectionPrefix;

  private Set<String> chunkTypes;

  @Min(value = 1, message = "pageStart must be positive")
  private Integer pageStart;

  @Min(value = 1, message = "pageEnd must be positive")
  private Integer pageEnd;

  /**
   * Builds search filters; throws {@link IllegalArgumentException} for an inverted page range or
   * an unknown chunk type.
   */
  public RetrievalFilters toFilters() {
    Set<ChunkType> types =
        chunkTypes == null
            ? Set.of()
            : chunkTypes.stream().map(ChunkType::parse).collect(Collectors.toSet());
    String prefix = sectionPrefix == null || sectionPrefix.isBlank() ? null : sectionPrefix;
    return new RetrievalFilters(prefix, types, pageStart, pageEnd);
  }
}
