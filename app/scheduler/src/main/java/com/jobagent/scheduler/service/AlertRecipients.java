/*
 * Where: Scheduler service layer
 * What: Parses comma-separated recipient lists
 * Why: Operators type these by hand, so stray spaces and repeats are common
 */
package com.jobagent.scheduler.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class AlertRecipients {

  private AlertRecipients() {}

  /** Splits on commas, trims, drops blanks and repeats, keeps first-seen order. */
  public static List<String> parse(String raw) {
    if (raw == null || raw.isBlank()) {
      return List.of();
    }
    final Set<String> unique = new LinkedHashSet<>();
    for (String part : raw.split(",")) {
      final String trimmed = part.trim();
      if (!trimmed.isEmpty()) {
        unique.add(trimmed);
      }
    }
    return List.copyOf(new ArrayList<>(unique));
  }
}
