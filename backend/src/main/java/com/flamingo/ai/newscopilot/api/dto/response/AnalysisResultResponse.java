package com.flamingo.ai.newscopilot.api.dto.response;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisStatus;
import com.flamingo.ai.newscopilot.domain.enums.FailureReason;
import com.flamingo.ai.newscopilot.domain.model.AnalysisResult;
import java.util.List;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Response DTO for one analysis kind. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalysisResultResponse {

  private AnalysisKind kind;
  private AnalysisStatus status;
  private JsonNode payload;
  private List<String> citations;
  private String model;
  private int retries;
  private int inputTokens;
  private int outputTokens;
  private int llmCalls;
  private long elapsedMs;
  private FailureReason failureReason;

  /** User-facing explanation when the status is not SUCCESS. */
  private String error;

  private List<String> defects;

  public static AnalysisResultResponse fromDomain(AnalysisResult result) {
    return AnalysisResultResponse.builder()
        .kind(result.kind())
        .status(result.status())
        .payload(result.payload())
        .citations(result.citations())
        .model(result.modelId())
        .retries(result.retries())
        .inputTokens(result.tokenUsage().inputTokens())
        .outputTokens(result.tokenUsage().outputTokens())
        .llmCalls(result.tokenUsage().calls())
        .elapsedMs(result.elapsed().toMillis())
        .failureReason(result.failureReason())
        .error(
            result.failureReason() != null ? result.failureReason().getUserMessage() : null)
        .defects(result.defects())
        .build();
  }
}
