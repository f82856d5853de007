package com.cario.phiguard.app.model;

import java.util.Locale;

/** Detection domain. {@code HEALTHCARE} enables protected health information categories. */
public enum DomainFilter {
  GENERAL("none"),
  HEALTHCARE("phi");

  private final String wireValue;

  DomainFilter(String wireValue) {
    this.wireValue = wireValue;
  }

  /** Value of the {@code domain} parameter sent to the detection endpoint. */
  public String wireValue() {
    return wireValue;
  }

  /**
   * Parses a configured value. Accepts the enum name as well as the endpoint's own names ({@code
   * none}, {@code phi}), case-insensitively.
   *
   * @return the filter, or null when the value is not recognized
   */
  public static DomainFilter parse(String value) {
    if (value == null) return null;
    String v = value.trim().toLowerCase(Locale.ROOT);
    for (DomainFilter f : values()) {
      if (f.name().toLowerCase(Locale.ROOT).equals(v) || f.wireValue.equals(v)) {
        return f;
      }
    }
    return null;
  }
}
