package com.flamingo.ai.newscopilot.domain.enums;

import java.util.Locale;

/** Subscription tier of the requester; bounds the most expensive model they can receive. */
public enum RequesterTier {
  FREE,
  PREMIUM,
  ADMIN;

  public static RequesterTier fromString(String value) {
    if (value == null || value.isBlank()) {
      return FREE;
    }
    try {
      return RequesterTier.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      return FREE;
    }
  }
}
