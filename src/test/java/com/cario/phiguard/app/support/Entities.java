package com.cario.phiguard.app.support;

import com.cario.phiguard.app.model.EntityCategory;
import com.cario.phiguard.app.model.PiiEntity;

/** Builders for entities in tests. */
public final class Entities {

  private Entities() {}

  /** Entity covering {@code text.substring(start, start + length)}. */
  public static PiiEntity span(
      String category, String text, int start, int length, double confidence) {
    return new PiiEntity(
        EntityCategory.of(category),
        null,
        text.substring(start, start + length),
        start,
        length,
        confidence);
  }

  /** Entity whose span is located by searching {@code needle} in {@code text}. */
  public static PiiEntity find(String category, String text, String needle, double confidence) {
    int start = text.indexOf(needle);
    if (start < 0) throw new IllegalArgumentException(needle + " not in text");
    return span(category, text, start, needle.length(), confidence);
  }

  /** Entity with synthetic text, for tests that only care about offsets. */
  public static PiiEntity at(String category, int start, int length, double confidence) {
    return new PiiEntity(
        EntityCategory.of(category), null, "x".repeat(length), start, length, confidence);
  }
}
