package com.flamingo.ai.knowledgehub.config;

import java.util.concurrent.Executor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

/** Executors for the I/O-bound fan-out done by retrieval, embedding and webhook delivery. */
@Configuration
@EnableAsync
public class AsyncConfig {

  /** One task per corpus per query. */
  @Bean(name = "retrievalExecutor")
  public Executor retrievalExecutor() {
    return executor(3, 12, 100, "retrieval-");
  }

  @Bean(name = "embeddingExecutor")
  public Executor embeddingExecutor(RagConfig ragConfig) {
    int concurrency = Math.max(1, ragConfig.getEmbedding().getBatchConcurrency());
    return executor(concurrency, concurrency, 500, "embed-");
  }

  /** Fire-and-forget webhook triggers; retries run sequentially inside one task. */
  @Bean(name = "webhookExecutor")
  public Executor webhookExecutor() {
    return executor(2, 4, 200, "webhook-");
  }

  private static ThreadPoolTaskExecutor executor(
      int corePoolSize, int maxPoolSize, int queueCapacity, String threadNamePrefix) {
    ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
    executor.setCorePoolSize(corePoolSize);
    executor.setMaxPoolSize(maxPoolSize);
    executor.setQueueCapacity(queueCapacity);
    executor.setThreadNamePrefix(threadNamePrefix);
    executor.initialize();
    return executor;
  }
}
