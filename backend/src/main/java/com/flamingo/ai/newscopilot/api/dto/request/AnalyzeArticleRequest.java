package com.flamingo.ai.newscopilot.api.dto.request;

import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import com.flamingo.ai.newscopilot.domain.model.AnalysisRequest;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Request DTO for analysing an already-extracted article. */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnalyzeArticleRequest {

  @NotBlank(message = "Article text is required")
  @Size(max = 200000, message = "Article text must not exceed 200000 characters")
  private String text;

  @Size(max = 2048, message = "Source URL must not exceed 2048 characters")
  private String sourceUrl;

  /** ISO 639-1 language code; detected from the text when absent. */
  private String language;

  /** Requested kinds; the core kinds when empty. */
  private List<AnalysisKind> kinds;

  /** FREE, PREMIUM or ADMIN; FREE when absent. */
  private String tier;

  /** Existing session to merge into; a new one is created when absent. */
  private String sessionKey;

  /** Overall deadline override in seconds. */
  @Positive(message = "Deadline must be positive")
  private Integer deadlineSeconds;

  /** Maps to the coordinator's request; no kinds means the core kinds. */
  public AnalysisRequest toAnalysisRequest() {
    Set<AnalysisKind> requested =
        kinds == null || kinds.isEmpty() ? AnalysisKind.coreKinds() : EnumSet.copyOf(kinds);
    Duration deadline = deadlineSeconds != null ? Duration.ofSeconds(deadlineSeconds) : null;
    return new AnalysisRequest(requested, RequesterTier.fromString(tier), sessionKey, deadline);
  }
}
