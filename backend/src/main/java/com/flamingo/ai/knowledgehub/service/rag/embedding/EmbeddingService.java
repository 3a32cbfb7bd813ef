package com.flamingo.ai.knowledgehub.service.rag.embedding;

import com.flamingo.ai.knowledgehub.config.RagConfig;
import com.flamingo.ai.knowledgehub.exception.EmbeddingException;
import com.google.common.collect.Lists;
import dev.langchain4j.data.embedding.Embedding;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.output.Response;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.micrometer.core.annotation.Timed;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Turns text into vectors using the configured embedding model.
 *
 * <p>Input longer than the configured ceiling is cut silently and line breaks are flattened to
 * spaces. Callers that need every character embedded must chunk first.
 */
@Service
@Slf4j
public class EmbeddingService {

  private final EmbeddingModel embeddingModel;
  private final MeterRegistry meterRegistry;
  private final Executor embeddingExecutor;
  private final int maxChars;
  private final int batchConcurrency;

  public EmbeddingService(
      EmbeddingModel embeddingModel,
      MeterRegistry meterRegistry,
      @Qualifier("embeddingExecutor") Executor embeddingExecutor,
      RagConfig ragConfig) {
    this.embeddingModel = embeddingModel;
    this.meterRegistry = meterRegistry;
    this.embeddingExecutor = embeddingExecutor;
    this.maxChars = ragConfig.getEmbedding().getMaxChars();
    this.batchConcurrency = Math.max(1, ragConfig.getEmbedding().getBatchConcurrency());
  }

  /**
   * Embeds a single text.
   *
   * @param text the text to embed
   * @return embedding vector
   * @throws EmbeddingException if the provider fails or the circuit is open
   */
  @Timed(value = "embedding.embed", description = "Time to embed text")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedFallback")
  public List<Float> embed(String text) {
    return embedOne(text);
  }

  /**
   * Embeds several texts with one independent call each, run concurrently on the embedding
   * executor. At most {@code batchConcurrency} calls are in flight; the next window starts once
   * the previous one has completed. The result list is in input order. Any failed call fails the
   * whole batch and no further windows are submitted.
   *
   * @param texts the texts to embed
   * @return one vector per input text
   * @throws EmbeddingException if any call fails
   */
  @Timed(value = "embedding.embedBatch", description = "Time to embed batch")
  @CircuitBreaker(name = "openai", fallbackMethod = "embedBatchFallback")
  public List<List<Float>> embedBatch(List<String> texts) {
    if (texts.isEmpty()) {
      return List.of();
    }
    List<List<Float>> results = new ArrayList<>(texts.size());
    for (List<String> window : Lists.partition(texts, batchConcurrency)) {
      results.addAll(embedWindow(window));
    }
    return results;
  }

  private List<List<Float>> embedWindow(List<String> window) {
    List<CompletableFuture<List<Float>>> futures = new ArrayList<>(window.size());
    try {
      for (String text : window) {
        futures.add(CompletableFuture.supplyAsync(() -> embedOne(text), embeddingExecutor));
      }
      CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
    } catch (RejectedExecutionException e) {
      futures.forEach(future -> future.cancel(true));
      throw new EmbeddingException("Embedding executor rejected the batch: " + e.getMessage(), e);
    } catch (CompletionException e) {
      throw unwrap(e);
    }
    List<List<Float>> results = new ArrayList<>(window.size());
    for (CompletableFuture<List<Float>> future : futures) {
      results.add(future.join());
    }
    return results;
  }

  /** Truncates to the character ceiling and flattens line breaks. */
  String prepare(String text) {
    String prepared = text == null ? "" : text;
    if (prepared.length() > maxChars) {
      log.debug("Truncating embedding input from {} to {} chars", prepared.length(), maxChars);
      prepared = prepared.substring(0, maxChars);
    }
    return prepared.replace("\r\n", " ").replace('\n', ' ').replace('\r', ' ');
  }

  private List<Float> embedOne(String text) {
    String prepared = prepare(text);
    try {
      Response<Embedding> response = embeddingModel.embed(prepared);
      meterRegistry.counter("embedding.requests.success").increment();
      return toFloatList(response.content().vector());
    } catch (RuntimeException e) {
      meterRegistry.counter("embedding.requests.failure").increment();
      throw new EmbeddingException("Embedding request failed: " + e.getMessage(), e);
    }
  }

  private static EmbeddingException unwrap(CompletionException e) {
    Throwable cause = e.getCause() != null ? e.getCause() : e;
    if (cause instanceof EmbeddingException embeddingException) {
      return embeddingException;
    }
    return new EmbeddingException("Batch embedding failed: " + cause.getMessage(), cause);
  }

  private static List<Float> toFloatList(float[] vector) {
    List<Float> result = new ArrayList<>(vector.length);
    for (float f : vector) {
      result.add(f);
    }
    return result;
  }

  @SuppressWarnings("unused")
  private List<Float> embedFallback(String text, Throwable t) {
    throw asEmbeddingException(t);
  }

  @SuppressWarnings("unused")
  private List<List<Float>> embedBatchFallback(List<String> texts, Throwable t) {
    throw asEmbeddingException(t);
  }

  private EmbeddingException asEmbeddingException(Throwable t) {
    if (t instanceof EmbeddingException embeddingException) {
      return embeddingException;
    }
    log.error("Embedding unavailable: {}", t.getMessage());
    return new EmbeddingException("Embedding provider unavailable: " + t.getMessage(), t);
  }
}
