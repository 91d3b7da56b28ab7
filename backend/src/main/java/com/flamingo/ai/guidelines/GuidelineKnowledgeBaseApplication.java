package com.flamingo.ai.guidelines;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the guideline knowledge base service. */
@SpringBootApplication
public class GuidelineKnowledgeBaseApplication {

  public static void main(String[] args) {
    SpringApplication.run(GuidelineKnowledgeBaseApplication.class, args);
  }
}
