package com.flamingo.ai.newscopilot.service.llm;

import static com.flamingo.ai.newscopilot.support.TestArticles.json;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("SchemaShapeValidator Tests")
class SchemaShapeValidatorTest {

  private static final JsonNode SCHEMA =
      json(
          """
          {
            "type": "object",
            "required": ["claims", "score"],
            "properties": {
              "score": {"type": "integer"},
              "claims": {
                "type": "array",
                "minItems": 1,
                "items": {
                  "type": "object",
                  "required": ["claim", "verdict"],
                  "properties": {
                    "claim": {"type": "string"},
                    "verdict": {"type": "string", "enum": ["true", "false", "unverifiable"]}
                  }
                }
              }
            }
          }
          """);

  private final SchemaShapeValidator validator = new SchemaShapeValidator();

  @Test
  @DisplayName("Should accept a conforming payload")
  void shouldAcceptConformingPayload() {
    JsonNode payload =
        json("{\"score\":7,\"claims\":[{\"claim\":\"Rates rose\",\"verdict\":\"true\"}]}");

    assertThat(validator.validate(payload, SCHEMA)).isEmpty();
  }

  @Test
  @DisplayName("Should report missing required properties with their path")
  void shouldReportMissingProperties() {
    JsonNode payload = json("{\"claims\":[{\"claim\":\"Rates rose\"}]}");

    assertThat(validator.validate(payload, SCHEMA))
        .containsExactlyInAnyOrder(
            "$.score: required property missing",
            "$.claims[0].verdict: required property missing");
  }

  @Test
  @DisplayName("Should report wrong types, enum values and short arrays")
  void shouldReportShapeViolations() {
    assertThat(validator.validate(json("{\"score\":\"high\",\"claims\":[]}"), SCHEMA))
        .anyMatch(v -> v.startsWith("$.score: expected integer"))
        .anyMatch(v -> v.startsWith("$.claims: expected at least 1 items"));
    assertThat(
            validator.validate(
                json("{\"score\":1,\"claims\":[{\"claim\":\"x\",\"verdict\":\"maybe\"}]}"),
                SCHEMA))
        .singleElement()
        .asString()
        .startsWith("$.claims[0].verdict: value 'maybe'");
  }

  @Test
  @DisplayName("Should reject a top-level value of the wrong type")
  void shouldRejectWrongRootType() {
    assertThat(validator.validate(json("[1,2]"), SCHEMA))
        .containsExactly("$: expected object but was array");
  }

  @Test
  @DisplayName("Should treat explicit nulls as missing")
  void shouldTreatNullAsMissing() {
    assertThat(validator.validate(json("{\"score\":null,\"claims\":[]}"), SCHEMA))
        .contains("$.score: required property missing");
  }
}
