package com.cario.phiguard.app.util;

import com.cario.phiguard.app.model.Citation;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/** Markdown renderings of citations and entity summaries for display clients. */
public final class CitationFormatUtils {

  private CitationFormatUtils() {}

  /** Numbered markdown list of sources, matching the {@code [n]} references in the answer. */
  public static String toMarkdown(List<Citation> citations) {
    if (citations == null || citations.isEmpty()) {
      return "*No web sources cited*";
    }
    StringBuilder sb = new StringBuilder("### Web Sources");
    int i = 1;
    for (Citation c : citations) {
      sb.append('\n').append(i++).append(". [").append(escape(c.getTitle())).append("](");
      sb.append(c.getUrl()).append(')');
    }
    return sb.toString();
  }

  /** One bullet per category, sorted by category name. */
  public static String formatEntitySummary(Map<String, Integer> countsByCategory) {
    if (countsByCategory == null || countsByCategory.isEmpty()) {
      return "No PII/PHI detected";
    }
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, Integer> e : new TreeMap<>(countsByCategory).entrySet()) {
      if (sb.length() > 0) sb.append('\n');
      sb.append("• ").append(e.getKey()).append(": ").append(e.getValue());
    }
    return sb.toString();
  }

  private static String escape(String title) {
    return title.replace("[", "\\[").replace("]", "\\]");
  }
}
