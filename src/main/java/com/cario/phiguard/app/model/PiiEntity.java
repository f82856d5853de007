package com.cario.phiguard.app.model;

import java.util.Objects;
import lombok.Builder;
import lombok.Value;

/**
 * A span of the analysed text that the detector classified as PII/PHI.
 *
 * <p>Offsets are UTF-16 code unit indices into the analysed text, i.e. plain {@link String}
 * indices. {@code [startOffset, endOffset())} is the covered range.
 */
@Value
@Builder
public class PiiEntity {

  EntityCategory category;

  /** Finer grained category when the detector supplies one; may be null. */
  String subcategory;

  String text;

  int startOffset;

  int length;

  double confidenceScore;

  public PiiEntity(
      EntityCategory category,
      String subcategory,
      String text,
      int startOffset,
      int length,
      double confidenceScore) {
    this.category = Objects.requireNonNull(category, "category");
    this.subcategory = subcategory;
    this.text = Objects.requireNonNull(text, "text");
    if (startOffset < 0) {
      throw new IllegalArgumentException("startOffset must be >= 0 but was " + startOffset);
    }
    if (length < 1) {
      throw new IllegalArgumentException("length must be >= 1 but was " + length);
    }
    if (Double.isNaN(confidenceScore) || confidenceScore < 0.0 || confidenceScore > 1.0) {
      throw new IllegalArgumentException(
          "confidenceScore must be within [0,1] but was " + confidenceScore);
    }
    this.startOffset = startOffset;
    this.length = length;
    this.confidenceScore = confidenceScore;
  }

  /** Exclusive end of the span. */
  public int endOffset() {
    return startOffset + length;
  }

  public boolean overlaps(PiiEntity other) {
    return startOffset < other.endOffset() && other.startOffset < endOffset();
  }

  /** Log-safe description: category and position, never the entity text. */
  public String describe() {
    return category + "@" + startOffset + "+" + length + "(" + confidenceScore + ")";
  }
}
