package com.cario.phiguard.app.model;

import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;
import java.util.Objects;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Category of a detected PII/PHI entity as named by the detection service (for example {@code
 * Person}, {@code MedicalRecordNumber}, {@code PhoneNumber}).
 *
 * <p>The detector's category vocabulary is open ended, so this is a value type rather than an
 * enum. Two categories are equal when their names are equal.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class EntityCategory {

  String name;

  public static EntityCategory of(String name) {
    Objects.requireNonNull(name, "category name");
    String trimmed = name.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException("category name must not be blank");
    }
    return new EntityCategory(trimmed);
  }

  @JsonValue
  public String getName() {
    return name;
  }

  /** Placeholder that replaces entities of this category, e.g. {@code [PERSON]}. */
  public String placeholder() {
    return "[" + name.toUpperCase(Locale.ROOT) + "]";
  }

  @Override
  public String toString() {
    return name;
  }
}
