package com.flamingo.ai.newscopilot.domain.enums;

/** Terminal outcome of one analysis kind. */
public enum AnalysisStatus {
  SUCCESS,
  PARTIAL_SUCCESS,
  FAILED
}
