package com.flamingo.ai.guidelines.elasticsearch;

import java.util.ArrayList;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A recommendation statement and the chunks that support it.
 *
 * <p>The grading fields are carried for downstream consumers; the lexical pipeline leaves them
 * empty.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuidelineRecommendation {

  private String recommendationId;
  private String docId;
  private String statement;
  private String strength;
  private String evidenceLevel;
  private String population;
  private String contraindications;
  @Builder.Default private List<String> chunkIds = new ArrayList<>();
}
