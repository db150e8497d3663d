package com.flamingo.ai.newscopilot.api.rest;

import com.flamingo.ai.newscopilot.api.dto.request.AnalyzeArticleRequest;
import com.flamingo.ai.newscopilot.api.dto.response.AnalysisResponse;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import com.flamingo.ai.newscopilot.domain.model.AggregatedAnalysis;
import com.flamingo.ai.newscopilot.domain.model.ArticleContext;
import com.flamingo.ai.newscopilot.service.article.ArticleContextFactory;
import com.flamingo.ai.newscopilot.service.cache.AnalysisResultCache;
import com.flamingo.ai.newscopilot.service.cache.CacheStats;
import com.flamingo.ai.newscopilot.service.coordinator.AnalysisCoordinator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

/** REST controller for article analysis. */
@RestController
@RequestMapping("/api/analysis")
@RequiredArgsConstructor
@Slf4j
public class AnalysisController {

  private final AnalysisCoordinator coordinator;
  private final ArticleContextFactory articleContextFactory;
  private final AnalysisResultCache cache;

  /** Runs the requested kinds, or the core kinds when none are given. */
  @PostMapping
  public ResponseEntity<AnalysisResponse> analyze(
      @Valid @RequestBody AnalyzeArticleRequest request) {
    ArticleContext article =
        articleContextFactory.create(
            request.getText(), request.getSourceUrl(), request.getLanguage());
    AggregatedAnalysis analysis = coordinator.run(article, request.toAnalysisRequest());
    return ResponseEntity.ok(AnalysisResponse.fromDomain(analysis));
  }

  /** Runs the core kinds and caches them for later on-demand requests. */
  @PostMapping("/core")
  public ResponseEntity<AnalysisResponse> analyzeCore(
      @Valid @RequestBody AnalyzeArticleRequest request) {
    ArticleContext article =
        articleContextFactory.create(
            request.getText(), request.getSourceUrl(), request.getLanguage());
    AggregatedAnalysis analysis =
        coordinator.runCore(
            article, RequesterTier.fromString(request.getTier()), request.getSessionKey());
    return ResponseEntity.ok(AnalysisResponse.fromDomain(analysis));
  }

  /**
   * Runs one on-demand kind against a session's cached core context.
   *
   * @param sessionKey session returned by the core request
   * @param kind kind id, e.g. {@code fact-check}
   * @param tier requester tier
   * @return the aggregated result; 409 when the session has no cached core context
   */
  @PostMapping("/sessions/{sessionKey}/{kind}")
  public ResponseEntity<AnalysisResponse> analyzeOnDemand(
      @PathVariable String sessionKey,
      @PathVariable String kind,
      @RequestParam(defaultValue = "FREE") String tier) {
    AnalysisKind analysisKind = AnalysisKind.fromId(kind);
    log.info("On-demand {} requested for session {}", analysisKind.getId(), sessionKey);
    AggregatedAnalysis analysis =
        coordinator.runOnDemand(sessionKey, analysisKind, RequesterTier.fromString(tier));
    return ResponseEntity.ok(AnalysisResponse.fromDomain(analysis));
  }

  /** Drops a session's cached context. */
  @DeleteMapping("/sessions/{sessionKey}")
  public ResponseEntity<Void> invalidateSession(@PathVariable String sessionKey) {
    cache.invalidate(sessionKey);
    return ResponseEntity.noContent().build();
  }

  @GetMapping("/cache/stats")
  public ResponseEntity<CacheStats> cacheStats() {
    return ResponseEntity.ok(cache.stats());
  }
}
