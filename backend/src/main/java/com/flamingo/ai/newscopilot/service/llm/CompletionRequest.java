package com.flamingo.ai.newscopilot.service.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.flamingo.ai.newscopilot.domain.model.ModelChoice;
import com.flamingo.ai.newscopilot.service.prompt.Prompt;
import com.flamingo.ai.newscopilot.service.search.SearchParameters;
import java.time.Duration;
import java.util.Objects;

/**
 * One structured completion call.
 *
 * @param label short label for logs and metrics, e.g. the analysis kind
 * @param prompt system and user messages
 * @param schema expected JSON schema of the answer
 * @param search live-search parameters, {@link SearchParameters#NONE} for none
 * @param model model to call
 * @param timeout per-attempt timeout
 */
public record CompletionRequest(
    String label,
    Prompt prompt,
    JsonNode schema,
    SearchParameters search,
    ModelChoice model,
    Duration timeout) {

  public CompletionRequest {
    Objects.requireNonNull(prompt, "prompt");
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(model, "model");
    Objects.requireNonNull(timeout, "timeout");
    search = search != null ? search : SearchParameters.NONE;
  }
}
