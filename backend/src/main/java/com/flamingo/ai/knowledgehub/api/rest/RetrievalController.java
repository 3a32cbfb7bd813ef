package com.flamingo.ai.knowledgehub.api.rest;

import com.flamingo.ai.knowledgehub.api.dto.request.RetrievalRequest;
import com.flamingo.ai.knowledgehub.service.rag.GroundedContext;
import com.flamingo.ai.knowledgehub.service.rag.GroundingService;
import com.flamingo.ai.knowledgehub.service.rag.RetrievalResult;
import com.flamingo.ai.knowledgehub.service.rag.RetrievalService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for retrieval and grounding. */
@RestController
@RequestMapping("/api/retrieval")
@RequiredArgsConstructor
public class RetrievalController {

  private final GroundingService groundingService;
  private final RetrievalService retrievalService;

  /** Context, citations and confidence for a query; degrades to ungrounded on failure. */
  @PostMapping("/ground")
  public ResponseEntity<GroundedContext> ground(@Valid @RequestBody RetrievalRequest request) {
    return ResponseEntity.ok(groundingService.ground(request.getQuery(), request.toOptions()));
  }

  /** Raw retrieval result; embedding or search failures surface as errors. */
  @PostMapping("/search")
  public ResponseEntity<RetrievalResult> search(@Valid @RequestBody RetrievalRequest request) {
    return ResponseEntity.ok(retrievalService.retrieve(request.getQuery(), request.toOptions()));
  }
}
