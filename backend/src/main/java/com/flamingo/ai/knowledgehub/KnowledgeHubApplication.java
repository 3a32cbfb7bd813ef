package com.flamingo.ai.knowledgehub;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/** Entry point for the knowledge hub retrieval and synchronization service. */
@SpringBootApplication
public class KnowledgeHubApplication {

  public static void main(String[] args) {
    SpringApplication.run(KnowledgeHubApplication.class, args);
  }
}
