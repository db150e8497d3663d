package com.flamingo.ai.newscopilot.service.prompt;

/** System instructions plus the user message carrying the article. */
public record Prompt(String system, String user) {

  public int length() {
    return system.length() + user.length();
  }
}
