package com.cario.phiguard.app.model;

import java.util.Locale;

public enum PolicyMode {
  /** Forward the query with every surviving entity replaced by its placeholder. */
  REDACT,
  /** Never forward a query that contains a surviving entity. */
  REJECT;

  /** Case-insensitive parse; returns null for unknown values. */
  public static PolicyMode parse(String value) {
    if (value == null) return null;
    String v = value.trim().toUpperCase(Locale.ROOT);
    for (PolicyMode m : values()) {
      if (m.name().equals(v)) return m;
    }
    return null;
  }
}
