package com.flamingo.ai.newscopilot.api.dto.response;

import com.flamingo.ai.newscopilot.domain.model.AggregatedAnalysis;
import com.flamingo.ai.newscopilot.domain.model.KindError;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for an aggregated analysis run. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResponse {

  /** Key to pass to later on-demand requests. */
  private String sessionKey;

  private List<AnalysisResultResponse> results;
  private List<KindError> errors;
  private boolean fullSuccess;

  /** Whether on-demand analyses can now run against this session. */
  private boolean cachedForOnDemand;

  private int totalTokens;
  private long elapsedMs;

  public static AnalysisResponse fromDomain(AggregatedAnalysis analysis) {
    return AnalysisResponse.builder()
        .sessionKey(analysis.sessionKey())
        .results(
            analysis.results().values().stream().map(AnalysisResultResponse::fromDomain).toList())
        .errors(analysis.errors())
        .fullSuccess(analysis.isFullSuccess())
        .cachedForOnDemand(analysis.cachedForOnDemand())
        .totalTokens(analysis.totalTokens())
        .elapsedMs(analysis.elapsed().toMillis())
        .build();
  }
}
