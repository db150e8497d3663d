package com.flamingo.ai.newscopilot.service.model;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.flamingo.ai.newscopilot.config.AnalysisProperties;
import com.flamingo.ai.newscopilot.domain.enums.AnalysisKind;
import com.flamingo.ai.newscopilot.domain.enums.RequesterTier;
import com.flamingo.ai.newscopilot.domain.model.ModelChoice;
import java.util.ArrayList;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("ModelSelector Tests")
class ModelSelectorTest {

  private static final int SHORT = 800;
  private static final int LONG = 6000;

  private AnalysisProperties properties;
  private ModelSelector selector;

  @BeforeEach
  void setUp() {
    properties = new AnalysisProperties();
    selector = new ModelSelector(properties);
  }

  @Nested
  @DisplayName("Baseline")
  class Baseline {

    @Test
    @DisplayName("Should start jargon on the cheapest model")
    void shouldStartJargonOnCheapestModel() {
      ModelChoice choice = selector.select(AnalysisKind.JARGON, RequesterTier.FREE, SHORT, 0);

      assertThat(choice.modelId()).isEqualTo("gpt-5-nano");
      assertThat(choice.ladderIndex()).isZero();
      assertThat(choice.supportsLiveSearch()).isFalse();
    }

    @ParameterizedTest
    @EnumSource(
        value = AnalysisKind.class,
        names = {"FACT_CHECK", "BIAS", "TIMELINE", "EXPERT", "SOCIAL_PULSE"})
    @DisplayName("Should start reasoning and search kinds on the standard model")
    void shouldStartReasoningKindsOnStandardModel(AnalysisKind kind) {
      ModelChoice choice = selector.select(kind, RequesterTier.FREE, SHORT, 0);

      assertThat(choice.modelId()).isEqualTo("gpt-5-mini");
      assertThat(choice.supportsLiveSearch()).isTrue();
    }

    @Test
    @DisplayName("Should start long articles one step higher")
    void shouldStartLongArticlesOneStepHigher() {
      ModelChoice choice = selector.select(AnalysisKind.JARGON, RequesterTier.FREE, LONG, 0);

      assertThat(choice.modelId()).isEqualTo("gpt-5-mini");
    }

    @Test
    @DisplayName("Should give premium requesters the top model for high-complexity kinds")
    void shouldGivePremiumTopModelForHighComplexity() {
      ModelChoice factCheck =
          selector.select(AnalysisKind.FACT_CHECK, RequesterTier.PREMIUM, SHORT, 0);
      ModelChoice timeline =
          selector.select(AnalysisKind.TIMELINE, RequesterTier.PREMIUM, SHORT, 0);

      assertThat(factCheck.modelId()).isEqualTo("gpt-5");
      assertThat(timeline.modelId()).isEqualTo("gpt-5-mini");
    }

    @Test
    @DisplayName("Should carry the configured token limit")
    void shouldCarryConfiguredTokenLimit() {
      ModelChoice choice = selector.select(AnalysisKind.BIAS, RequesterTier.ADMIN, SHORT, 0);

      assertThat(choice.maxTokens()).isEqualTo(8192);
    }
  }

  @Nested
  @DisplayName("Escalation")
  class Escalation {

    @Test
    @DisplayName("Should escalate one step per retry")
    void shouldEscalateOneStepPerRetry() {
      assertThat(selector.select(AnalysisKind.TIMELINE, RequesterTier.PREMIUM, SHORT, 1).modelId())
          .isEqualTo("gpt-5");
      assertThat(selector.select(AnalysisKind.JARGON, RequesterTier.FREE, SHORT, 1).modelId())
          .isEqualTo("gpt-5-mini");
    }

    @Test
    @DisplayName("Should clamp escalation at the tier ceiling")
    void shouldClampEscalationAtTierCeiling() {
      ModelChoice choice = selector.select(AnalysisKind.FACT_CHECK, RequesterTier.FREE, LONG, 5);

      assertThat(choice.modelId()).isEqualTo("gpt-5-mini");
      assertThat(choice.ladderIndex())
          .isEqualTo(selector.tierMaximum(RequesterTier.FREE).ladderIndex());
    }

    @Test
    @DisplayName("Should stop escalating at the configured escalation ceiling")
    void shouldStopAtEscalationCeiling() {
      properties.getModels().setEscalationCeiling(1);

      ModelChoice choice = selector.select(AnalysisKind.TIMELINE, RequesterTier.ADMIN, SHORT, 3);

      assertThat(choice.modelId()).isEqualTo("gpt-5-mini");
    }

    @Test
    @DisplayName("Should never escalate below the starting model")
    void shouldNeverEscalateBelowStart() {
      properties.getModels().setEscalationCeiling(0);

      ModelChoice choice =
          selector.select(AnalysisKind.FACT_CHECK, RequesterTier.PREMIUM, SHORT, 2);

      assertThat(choice.modelId()).isEqualTo("gpt-5");
    }

    @Test
    @DisplayName("Should be monotonic in retry count and never exceed the tier maximum")
    void shouldBeMonotonicAndClamped() {
      for (AnalysisKind kind : AnalysisKind.values()) {
        for (RequesterTier tier : RequesterTier.values()) {
          for (int words : new int[] {0, SHORT, LONG}) {
            int ceiling = selector.tierMaximum(tier).ladderIndex();
            for (int retry = 0; retry < 6; retry++) {
              ModelChoice current = selector.select(kind, tier, words, retry);
              ModelChoice next = selector.select(kind, tier, words, retry + 1);

              assertThat(next.ladderIndex())
                  .as("%s/%s/%d words, retry %d -> %d", kind, tier, words, retry, retry + 1)
                  .isGreaterThanOrEqualTo(current.ladderIndex());
              assertThat(next.ladderIndex()).isLessThanOrEqualTo(ceiling);
            }
          }
        }
      }
    }

    @Test
    @DisplayName("Should return the same choice for the same inputs")
    void shouldBeDeterministic() {
      ModelChoice first = selector.select(AnalysisKind.EXPERT, RequesterTier.PREMIUM, LONG, 1);
      ModelChoice second = selector.select(AnalysisKind.EXPERT, RequesterTier.PREMIUM, LONG, 1);

      assertThat(first).isEqualTo(second);
    }
  }

  @Test
  @DisplayName("Should review with the cheapest model")
  void shouldReviewWithCheapestModel() {
    assertThat(selector.selectReviewer().modelId()).isEqualTo("gpt-5-nano");
  }

  @Test
  @DisplayName("Should treat a tier without a ceiling as cheapest only")
  void shouldTreatMissingTierCeilingAsCheapest() {
    properties.getModels().getTierCeilings().remove(RequesterTier.FREE);

    ModelChoice choice = selector.select(AnalysisKind.BIAS, RequesterTier.FREE, LONG, 3);

    assertThat(choice.modelId()).isEqualTo("gpt-5-nano");
  }

  @Test
  @DisplayName("Should reject an empty model ladder")
  void shouldRejectEmptyLadder() {
    properties.getModels().setLadder(new ArrayList<>());

    assertThatThrownBy(() -> selector.select(AnalysisKind.JARGON, RequesterTier.FREE, SHORT, 0))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("ladder");
  }
}
