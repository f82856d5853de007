package com.cario.phiguard.app.service;

import com.cario.phiguard.app.model.PiiEntity;
import com.cario.phiguard.app.model.ResolvedEntitySet;

/**
 * Rewrites text with entity spans replaced by category placeholders.
 *
 * <p>All offsets refer to the original text; the output is assembled left to right in one pass so
 * replacements of differing length never shift a later span.
 */
public class RedactionRenderer {

  public String render(String originalText, ResolvedEntitySet entities) {
    if (entities.isEmpty()) {
      return originalText;
    }
    return rewrite(originalText, entities, (e, span) -> e.getCategory().placeholder());
  }

  /**
   * Markdown view of the original text with every entity marked as {@code **[span](Category)**}.
   * For display to the user only; never forwarded.
   */
  public String highlight(String originalText, ResolvedEntitySet entities) {
    if (entities.isEmpty()) {
      return originalText;
    }
    return rewrite(
        originalText, entities, (e, span) -> "**[" + span + "](" + e.getCategory() + ")**");
  }

  private interface Replacement {
    String apply(PiiEntity entity, String span);
  }

  private static String rewrite(String text, ResolvedEntitySet entities, Replacement replacement) {
    StringBuilder out = new StringBuilder(text.length() + entities.size() * 16);
    int cursor = 0;
    for (PiiEntity e : entities) {
      if (e.endOffset() > text.length()) {
        throw new IllegalArgumentException(
            "entity " + e.describe() + " exceeds text length " + text.length());
      }
      out.append(text, cursor, e.getStartOffset());
      out.append(replacement.apply(e, text.substring(e.getStartOffset(), e.endOffset())));
      cursor = e.endOffset();
    }
    out.append(text, cursor, text.length());
    return out.toString();
  }
}
