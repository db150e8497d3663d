package com.flamingo.ai.newscopilot.service.llm;

/**
 * Narrow contract to the external completion service. Implementations own the per-call timeout and
 * the retry of transient failures.
 */
public interface LlmClient {

  /**
   * Completes a prompt and returns a schema-conformant JSON answer.
   *
   * @param request the completion request
   * @return the parsed answer with citations and token usage
   * @throws com.flamingo.ai.newscopilot.exception.TransientProviderException when transient
   *     failures persist after all retries
   * @throws com.flamingo.ai.newscopilot.exception.LlmServiceException on non-transient provider
   *     failures
   * @throws com.flamingo.ai.newscopilot.exception.LogicalSchemaException when the answer is not
   *     JSON or does not fit the schema
   * @throws com.flamingo.ai.newscopilot.exception.DeadlineExceededException when the calling
   *     thread is cancelled
   */
  CompletionResult complete(CompletionRequest request);
}
