package com.flamingo.ai.newscopilot.api.dto.response;

import com.flamingo.ai.newscopilot.domain.model.AggregatedAnalysis;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for analysis progress events streamed over SSE. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisEventResponse {

  /** Event type: result, done, error. */
  private String eventType;

  /** Event data (JSON object). */
  private Object data;

  /** One kind finished. */
  public static AnalysisEventResponse result(AnalysisResult result) {
    return AnalysisEventResponse.builder()
        .eventType("result")
        .data(AnalysisResultResponse.fromDomain(result))
        .build();
  }

  /** All kinds finished; carries the aggregate without repeating the payloads. */
  public static AnalysisEventResponse done(AggregatedAnalysis analysis) {
    return AnalysisEventResponse.builder()
        .eventType("done")
        .data(
            new DoneData(
                analysis.sessionKey(),
                analysis.isFullSuccess(),
                analysis.errors().size(),
                analysis.cachedForOnDemand(),
                analysis.totalTokens(),
                analysis.elapsed().toMillis()))
        .build();
  }

  public static AnalysisEventResponse error(String errorId, String message) {
    return AnalysisEventResponse.builder()
        .eventType("error")
        .data(new ErrorData(errorId, message))
        .build();
  }

  /** Done event data. */
  @Data
  @AllArgsConstructor
  public static class DoneData {
    private String sessionKey;
    private boolean fullSuccess;
    private int failedKinds;
    private boolean cachedForOnDemand;
    private int totalTokens;
    private long elapsedMs;
  }

  /** Error event data. */
  @Data
  @AllArgsConstructor
  public static class ErrorData {
    private String errorId;
    private String message;
  }
}
