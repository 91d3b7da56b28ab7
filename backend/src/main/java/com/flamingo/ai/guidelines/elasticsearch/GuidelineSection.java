package com.flamingo.ai.guidelines.elasticsearch;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** A page-bounded section of a guideline, ordered densely from zero within its document. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GuidelineSection {

  private String sectionId;
  private String docId;
  private String path;
  private int order;
  private int level;
  private int pageStart;
  private int pageEnd;
}
